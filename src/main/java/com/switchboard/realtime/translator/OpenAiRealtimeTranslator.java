package com.switchboard.realtime.translator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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
import com.switchboard.realtime.TurnDetectionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI Realtime API (beta v1 event protocol).
 */
@Slf4j
@Component
public class OpenAiRealtimeTranslator extends AbstractRealtimeTranslator {

    public static final String PROVIDER = "openai";

    static final String DEFAULT_MODEL = "gpt-4o-realtime-preview";
    private static final String DEFAULT_ENDPOINT = "wss://api.openai.com/v1";
    private static final int OUTPUT_SAMPLE_RATE = 24000;

    static final RealtimeErrorPolicy DEFAULT_POLICY = RealtimeErrorPolicy.of(
            List.of("server_error"),
            List.of("rate_limit_error"),
            List.of("invalid_api_key", "insufficient_quota"));

    @Autowired
    public OpenAiRealtimeTranslator(ObjectMapper objectMapper, SwitchboardProperties properties) {
        super(PROVIDER, DEFAULT_POLICY, objectMapper, properties);
    }

    public OpenAiRealtimeTranslator(ObjectMapper objectMapper) {
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
        headers.set("OpenAI-Beta", "realtime=v1");
        return headers;
    }

    @Override
    public String subprotocol() {
        return "openai-beta.realtime-v1";
    }

    @Override
    public List<String> initializationMessages(SessionConfig config) {
        return List.of(sessionUpdate(config));
    }

    @Override
    public String sessionUpdate(SessionConfig config) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "session.update");
        ObjectNode session = frame.putObject("session");

        ArrayNode modalities = session.putArray("modalities");
        (config.getModalities() != null ? config.getModalities() : List.of("audio", "text")).forEach(modalities::add);
        if (config.getInstructions() != null) {
            session.put("instructions", config.getInstructions());
        }
        if (config.getVoice() != null) {
            session.put("voice", config.getVoice());
        }
        session.put("input_audio_format", config.getInputFormat().wireName());
        session.put("output_audio_format", config.getOutputFormat().wireName());

        if (config.hasTurnDetection()) {
            TurnDetectionConfig vad = config.getTurnDetection();
            ObjectNode turn = session.putObject("turn_detection");
            turn.put("type", vad.getType());
            if (vad.getThreshold() != null) {
                turn.put("threshold", vad.getThreshold());
            }
            if (vad.getPrefixPaddingMs() != null) {
                turn.put("prefix_padding_ms", vad.getPrefixPaddingMs());
            }
            if (vad.getSilenceDurationMs() != null) {
                turn.put("silence_duration_ms", vad.getSilenceDurationMs());
            }
        } else {
            session.putNull("turn_detection");
        }
        if (config.hasTools()) {
            session.set("tools", toolsArray(config, true));
        }
        if (config.getTemperature() != null) {
            session.put("temperature", config.getTemperature());
        }
        return frame.toString();
    }

    /**
     * Commits the input buffer. Without server VAD nothing triggers a response, so one is requested.
     */
    @Override
    public List<String> endOfInput(SessionConfig config) {
        String commit = objectMapper.createObjectNode().put("type", "input_audio_buffer.commit").toString();
        if (config.hasTurnDetection()) {
            return List.of(commit);
        }
        return List.of(commit, toProviderWire(ResponseRequest.now()));
    }

    @Override
    public String toProviderWire(RealtimeMessage message) {
        ObjectNode frame = objectMapper.createObjectNode();
        if (message instanceof AudioFrame audio) {
            frame.put("type", "input_audio_buffer.append");
            frame.put("audio", encodeAudio(audio.data()));
        } else if (message instanceof TextInput text) {
            frame.put("type", "conversation.item.create");
            ObjectNode item = frame.putObject("item");
            item.put("type", "message");
            item.put("role", "user");
            item.putArray("content").addObject()
                    .put("type", "input_text")
                    .put("text", text.text());
        } else if (message instanceof FunctionResponse response) {
            frame.put("type", "conversation.item.create");
            frame.putObject("item")
                    .put("type", "function_call_output")
                    .put("call_id", response.callId())
                    .put("output", response.output());
        } else if (message instanceof ResponseRequest request) {
            frame.put("type", "response.create");
            if (request.instructions() != null || request.temperature() != null) {
                ObjectNode response = frame.putObject("response");
                if (request.instructions() != null) {
                    response.put("instructions", request.instructions());
                }
                if (request.temperature() != null) {
                    response.put("temperature", request.temperature());
                }
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
        switch (type) {
            case "session.created":
            case "session.updated":
                return List.of(new StatusMessage(type.replace('.', '_'), node.path("session").path("id").asText(null)));
            case "response.audio.delta":
                return List.of(new AudioFrame(decodeAudio(node.path("delta").asText("")), OUTPUT_SAMPLE_RATE, 1, true));
            case "response.text.delta":
            case "response.audio_transcript.delta":
                return List.of(new TextOutput(node.path("delta").asText(""), true));
            case "response.text.done":
                return List.of(new TextOutput(node.path("text").asText(""), false));
            case "response.function_call_arguments.done":
                return List.of(new FunctionCall(node.path("call_id").asText(), node.path("name").asText(null),
                        node.path("arguments").asText("")));
            case "response.done": {
                List<RealtimeMessage> messages = new ArrayList<>(2);
                messages.add(new StatusMessage("response_complete", null));
                JsonNode usage = node.path("response").path("usage");
                if (usage.isObject()) {
                    messages.add(new StatusMessage("usage_update", usage.toString()));
                }
                return messages;
            }
            case "input_audio_buffer.speech_started":
                return List.of(new StatusMessage("speech_started", null));
            case "input_audio_buffer.speech_stopped":
                return List.of(new StatusMessage("speech_stopped", null));
            case "error":
                return List.of(errorFrom(node.path("error")));
            default:
                log.debug("Ignoring OpenAI realtime event {}", type);
                return none();
        }
    }
}
