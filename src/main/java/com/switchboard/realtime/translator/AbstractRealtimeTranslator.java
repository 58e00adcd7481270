package com.switchboard.realtime.translator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.CommunicationException;
import com.switchboard.exception.RequestValidationException;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.model.ToolDefinition;
import com.switchboard.realtime.RealtimeError;
import com.switchboard.realtime.RealtimeErrorPolicy;
import com.switchboard.realtime.RealtimeMessage;
import com.switchboard.realtime.RealtimeTranslator;
import com.switchboard.realtime.SessionConfig;

import java.util.Base64;
import java.util.List;

/**
 * Shared frame parsing, error classification and tool mapping for the JSON-framed realtime providers.
 */
public abstract class AbstractRealtimeTranslator implements RealtimeTranslator {

    protected final ObjectMapper objectMapper;
    private final String provider;
    private final RealtimeErrorPolicy errorPolicy;

    protected AbstractRealtimeTranslator(String provider, RealtimeErrorPolicy defaultPolicy,
                                         ObjectMapper objectMapper, SwitchboardProperties properties) {
        this.provider = provider;
        this.objectMapper = objectMapper;
        this.errorPolicy = properties != null
                ? defaultPolicy.overriddenBy(properties.getRealtime().getErrorPolicies().get(provider))
                : defaultPolicy;
    }

    @Override
    public String getProvider() {
        return provider;
    }

    @Override
    public RealtimeError classifyError(String code, String message) {
        return errorPolicy.classify(code, message);
    }

    public RealtimeErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    protected JsonNode readFrame(String frame) {
        try {
            JsonNode node = objectMapper.readTree(frame);
            if (node == null || !node.has("type")) {
                throw CommunicationException.malformedResponse(provider + " realtime frame has no type", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw CommunicationException.malformedResponse(
                    "Malformed " + provider + " realtime frame: " + e.getOriginalMessage(), e);
        }
    }

    protected RealtimeMessage.ErrorMessage errorFrom(JsonNode error) {
        String code = error.path("code").asText(null);
        if (code == null) {
            code = error.path("type").asText(null);
        }
        return new RealtimeMessage.ErrorMessage(classifyError(code, error.path("message").asText(null)));
    }

    protected RequestValidationException notSupported(RealtimeMessage message) {
        return new RequestValidationException("Message kind '" + message.kind() + "' cannot be sent to "
                + provider, provider, "realtime", null);
    }

    protected ArrayNode toolsArray(SessionConfig config, boolean typed) {
        ArrayNode tools = objectMapper.createArrayNode();
        for (ToolDefinition tool : config.getTools()) {
            ObjectNode node = tools.addObject();
            if (typed) {
                node.put("type", "function");
            }
            node.put("name", tool.getFunction().getName());
            if (tool.getFunction().getDescription() != null) {
                node.put("description", tool.getFunction().getDescription());
            }
            if (tool.getFunction().getParameters() != null) {
                node.set("parameters", tool.getFunction().getParameters());
            }
        }
        return tools;
    }

    /**
     * Configured base URL with its HTTP scheme switched to the WebSocket one.
     */
    protected static String socketBase(ProviderCredentials credentials, String defaultEndpoint) {
        String base = credentials.baseUrlOr(defaultEndpoint);
        if (base.startsWith("https://")) {
            return "wss://" + base.substring("https://".length());
        }
        if (base.startsWith("http://")) {
            return "ws://" + base.substring("http://".length());
        }
        return base;
    }

    protected static String encodeAudio(byte[] audio) {
        return Base64.getEncoder().encodeToString(audio);
    }

    protected byte[] decodeAudio(String audio) {
        try {
            return Base64.getDecoder().decode(audio);
        } catch (IllegalArgumentException e) {
            throw CommunicationException.malformedResponse("Invalid base64 audio from " + provider, e);
        }
    }

    protected static String rawText(JsonNode node) {
        return node.isTextual() ? node.asText() : node.toString();
    }

    protected static List<RealtimeMessage> none() {
        return List.of();
    }
}
