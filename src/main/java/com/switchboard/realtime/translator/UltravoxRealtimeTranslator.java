package com.switchboard.realtime.translator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.config.SwitchboardProperties;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.realtime.RealtimeErrorPolicy;
import com.switchboard.realtime.RealtimeMessage;
import com.switchboard.realtime.RealtimeMessage.AudioFrame;
import com.switchboard.realtime.RealtimeMessage.FunctionCall;
import com.switchboard.realtime.RealtimeMessage.FunctionResponse;
import com.switchboard.realtime.RealtimeMessage.ResponseRequest;
import com.switchboard.realtime.RealtimeMessage.StatusMessage;
import com.switchboard.realtime.RealtimeMessage.TextInput;
import com.switchboard.realtime.RealtimeMessage.TextOutput;
import com.switchboard.realtime.SessionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Ultravox realtime protocol: {@code {"type": ..., "data": {...}}} frames.
 */
@Slf4j
@Component
public class UltravoxRealtimeTranslator extends AbstractRealtimeTranslator {

    public static final String PROVIDER = "ultravox";

    static final String DEFAULT_MODEL = "ultravox-v2";
    private static final String DEFAULT_ENDPOINT = "wss://api.ultravox.ai/v1";
    private static final int SAMPLE_RATE = 24000;

    static final RealtimeErrorPolicy DEFAULT_POLICY = RealtimeErrorPolicy.of(
            List.of("server_error", "authentication_failed"),
            List.of("rate_limit"),
            List.of("authentication_failed", "invalid_api_key"));

    @Autowired
    public UltravoxRealtimeTranslator(ObjectMapper objectMapper, SwitchboardProperties properties) {
        super(PROVIDER, DEFAULT_POLICY, objectMapper, properties);
    }

    public UltravoxRealtimeTranslator(ObjectMapper objectMapper) {
        this(objectMapper, null);
    }

    @Override
    public URI endpoint(SessionConfig config, ProviderCredentials credentials) {
        return UriComponentsBuilder.fromUriString(socketBase(credentials, DEFAULT_ENDPOINT) + "/realtime")
                .queryParam("model", config.getModel() != null ? config.getModel() : DEFAULT_MODEL)
                .build()
                .toUri();
    }

    @Override
    public HttpHeaders headers(ProviderCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credentials.getApiKey());
        headers.set("X-Ultravox-Version", "1.0");
        return headers;
    }

    @Override
    public String subprotocol() {
        return "ultravox.v1";
    }

    @Override
    public List<String> initializationMessages(SessionConfig config) {
        return List.of(sessionUpdate(config));
    }

    @Override
    public String sessionUpdate(SessionConfig config) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "session_config");
        ObjectNode data = frame.putObject("data");
        data.put("model", config.getModel() != null ? config.getModel() : DEFAULT_MODEL);
        if (config.getInstructions() != null) {
            data.put("systemPrompt", config.getInstructions());
        }
        data.putObject("audioConfig")
                .put("inputFormat", config.getInputFormat().wireName())
                .put("outputFormat", config.getOutputFormat().wireName())
                .put("sampleRate", SAMPLE_RATE)
                .put("channels", 1);
        if (config.hasTurnDetection()) {
            ObjectNode turn = data.putObject("turnDetection").put("enabled", true);
            if (config.getTurnDetection().getThreshold() != null) {
                turn.put("vadThreshold", config.getTurnDetection().getThreshold());
            }
            if (config.getTurnDetection().getSilenceDurationMs() != null) {
                turn.put("silenceDurationMs", config.getTurnDetection().getSilenceDurationMs());
            }
        }
        ObjectNode response = data.putObject("responseConfig");
        if (config.getTemperature() != null) {
            response.put("temperature", config.getTemperature());
        }
        response.put("voice", config.getVoice() != null ? config.getVoice() : "nova");
        if (config.hasTools()) {
            data.set("tools", toolsArray(config, false));
        }
        return frame.toString();
    }

    /**
     * Ultravox has no commit frame; without server VAD an explicit generate closes the turn.
     */
    @Override
    public List<String> endOfInput(SessionConfig config) {
        return config.hasTurnDetection() ? List.of() : List.of(toProviderWire(ResponseRequest.now()));
    }

    @Override
    public String toProviderWire(RealtimeMessage message) {
        ObjectNode frame = objectMapper.createObjectNode();
        if (message instanceof AudioFrame audio) {
            frame.put("type", "audio");
            frame.putObject("data")
                    .put("audio", encodeAudio(audio.data()))
                    .put("sampleRate", audio.sampleRate())
                    .put("channels", audio.channels());
        } else if (message instanceof TextInput text) {
            frame.put("type", "text");
            frame.putObject("data").put("text", text.text()).put("role", "user");
        } else if (message instanceof FunctionResponse response) {
            frame.put("type", "function_result");
            frame.putObject("data").put("callId", response.callId()).put("result", response.output());
        } else if (message instanceof ResponseRequest request) {
            frame.put("type", "generate");
            ObjectNode data = frame.putObject("data");
            if (request.instructions() != null) {
                data.put("prompt", request.instructions());
            }
            if (request.temperature() != null) {
                data.put("temperature", request.temperature());
            }
        } else {
            throw notSupported(message);
        }
        return frame.toString();
    }

    @Override
    public List<RealtimeMessage> fromProviderWire(String frame) {
        JsonNode node = readFrame(frame);
        String type = node.get("type").asText();
        JsonNode data = node.path("data");
        switch (type) {
            case "session_started":
            case "session_updated":
                return List.of(new StatusMessage(type, data.isMissingNode() ? null : data.toString()));
            case "audio_chunk":
                if (!data.hasNonNull("audio")) {
                    return none();
                }
                return List.of(new AudioFrame(decodeAudio(data.get("audio").asText()),
                        data.path("sampleRate").asInt(SAMPLE_RATE), data.path("channels").asInt(1), true));
            case "text_chunk":
                return data.hasNonNull("text")
                        ? List.of(new TextOutput(data.get("text").asText(), !data.path("final").asBoolean(false)))
                        : none();
            case "function_call":
                return List.of(new FunctionCall(data.path("callId").asText(), data.path("name").asText(null),
                        rawText(data.path("arguments"))));
            case "generation_complete": {
                List<RealtimeMessage> messages = new ArrayList<>(2);
                messages.add(new StatusMessage("response_complete", null));
                if (node.path("usage").isObject()) {
                    messages.add(new StatusMessage("usage_update", node.get("usage").toString()));
                }
                return messages;
            }
            case "error":
                return List.of(errorFrom(data.isObject() ? data : node.path("error")));
            default:
                log.warn("Unknown Ultravox message type: {}", type);
                return none();
        }
    }
}
