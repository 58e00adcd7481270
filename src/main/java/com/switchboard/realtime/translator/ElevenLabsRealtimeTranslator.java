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
 * ElevenLabs conversational AI. The session model is the agent id; audio is 16 kHz PCM.
 */
@Slf4j
@Component
public class ElevenLabsRealtimeTranslator extends AbstractRealtimeTranslator {

    public static final String PROVIDER = "elevenlabs";

    static final String DEFAULT_AGENT = "conversational-v1";
    private static final String DEFAULT_ENDPOINT = "wss://api.elevenlabs.io/v1";
    private static final int SAMPLE_RATE = 16000;

    static final RealtimeErrorPolicy DEFAULT_POLICY = RealtimeErrorPolicy.of(
            List.of("authentication_error", "server_error"),
            List.of("rate_limit_exceeded"),
            List.of("authentication_error", "invalid_api_key", "subscription_expired", "quota_exceeded"));

    @Autowired
    public ElevenLabsRealtimeTranslator(ObjectMapper objectMapper, SwitchboardProperties properties) {
        super(PROVIDER, DEFAULT_POLICY, objectMapper, properties);
    }

    public ElevenLabsRealtimeTranslator(ObjectMapper objectMapper) {
        this(objectMapper, null);
    }

    @Override
    public URI endpoint(SessionConfig config, ProviderCredentials credentials) {
        return UriComponentsBuilder.fromUriString(socketBase(credentials, DEFAULT_ENDPOINT) + "/convai/conversation")
                .queryParam("agent_id", config.getModel() != null ? config.getModel() : DEFAULT_AGENT)
                .build()
                .toUri();
    }

    @Override
    public HttpHeaders headers(ProviderCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("xi-api-key", credentials.getApiKey());
        headers.set("X-ElevenLabs-Version", "v1");
        return headers;
    }

    @Override
    public String subprotocol() {
        return null;
    }

    @Override
    public List<String> initializationMessages(SessionConfig config) {
        return List.of(sessionUpdate(config),
                objectMapper.createObjectNode().put("type", "conversation_start").toString());
    }

    @Override
    public String sessionUpdate(SessionConfig config) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "conversation_config");
        ObjectNode body = frame.putObject("config");
        body.put("agent_id", config.getModel() != null ? config.getModel() : DEFAULT_AGENT);
        if (config.getVoice() != null) {
            body.put("voice_id", config.getVoice());
        }
        if (config.getInstructions() != null) {
            body.put("system_prompt", config.getInstructions());
        }
        body.put("language", config.getLanguage() != null ? config.getLanguage() : "en");
        body.putObject("generation_config")
                .put("temperature", config.getTemperature() != null ? config.getTemperature() : 0.8)
                .put("response_format", "audio");
        body.putObject("audio_config")
                .put("input_format", "pcm_" + SAMPLE_RATE)
                .put("output_format", "pcm_" + SAMPLE_RATE)
                .put("encoding", "pcm_s16le");
        body.putObject("interruption_config")
                .put("enabled", config.hasTurnDetection())
                .put("threshold_ms", config.hasTurnDetection()
                        && config.getTurnDetection().getSilenceDurationMs() != null
                        ? config.getTurnDetection().getSilenceDurationMs() : 500);
        if (config.hasTools()) {
            body.set("tools", toolsArray(config, false));
        }
        return frame.toString();
    }

    @Override
    public List<String> endOfInput(SessionConfig config) {
        return List.of(toProviderWire(ResponseRequest.now()));
    }

    @Override
    public String toProviderWire(RealtimeMessage message) {
        ObjectNode frame = objectMapper.createObjectNode();
        if (message instanceof AudioFrame audio) {
            frame.put("type", "audio_input");
            frame.putObject("audio")
                    .put("data", encodeAudio(audio.data()))
                    .put("format", "pcm")
                    .put("sample_rate", SAMPLE_RATE)
                    .put("channels", 1);
        } else if (message instanceof TextInput text) {
            frame.put("type", "text_input");
            frame.put("text", text.text());
            frame.putObject("metadata").put("role", "user");
        } else if (message instanceof FunctionResponse response) {
            frame.put("type", "tool_response");
            frame.put("tool_call_id", response.callId());
            frame.put("output", response.output());
        } else if (message instanceof ResponseRequest request) {
            frame.put("type", "generate_response");
            ObjectNode config = frame.putObject("config");
            if (request.instructions() != null) {
                config.put("instructions", request.instructions());
            }
            config.put("temperature", request.temperature() != null ? request.temperature() : 0.8);
        } else {
            throw notSupported(message);
        }
        return frame.toString();
    }

    @Override
    public List<RealtimeMessage> fromProviderWire(String frame) {
        JsonNode node = readFrame(frame);
        String type = node.get("type").asText();
        switch (type) {
            case "conversation_started":
            case "conversation_updated":
                return List.of(new StatusMessage(type.replace("conversation_", "session_"), frame));
            case "audio_output": {
                JsonNode audio = node.path("audio");
                return audio.hasNonNull("data")
                        ? List.of(new AudioFrame(decodeAudio(audio.get("data").asText()),
                                audio.path("sample_rate").asInt(SAMPLE_RATE), 1, true))
                        : none();
            }
            case "text_output":
                return node.hasNonNull("text")
                        ? List.of(new TextOutput(node.get("text").asText(), node.path("is_partial").asBoolean(false)))
                        : none();
            case "tool_call":
                return List.of(new FunctionCall(node.path("tool_call_id").asText(), node.path("tool_name").asText(null),
                        rawText(node.path("arguments"))));
            case "turn_complete": {
                List<RealtimeMessage> messages = new ArrayList<>(2);
                messages.add(new StatusMessage("response_complete", null));
                JsonNode metrics = node.path("metrics");
                if (metrics.has("characters_synthesized")) {
                    ObjectNode usage = objectMapper.createObjectNode()
                            .put("characters", metrics.get("characters_synthesized").asInt())
                            .put("duration_ms", metrics.path("duration_ms").asInt(0));
                    messages.add(new StatusMessage("usage_update", usage.toString()));
                }
                return messages;
            }
            case "interruption":
                return List.of(new StatusMessage("interrupted", frame));
            case "error":
                return List.of(errorFrom(node.has("error") ? node.get("error") : node));
            default:
                log.warn("Unknown ElevenLabs message type: {}", type);
                return none();
        }
    }
}
