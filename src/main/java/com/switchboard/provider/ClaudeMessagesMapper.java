package com.switchboard.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.Choice;
import com.switchboard.model.ContentBlock;
import com.switchboard.model.Message;
import com.switchboard.model.MessageContent;
import com.switchboard.model.ToolCall;
import com.switchboard.model.ToolDefinition;
import com.switchboard.model.Usage;
import com.switchboard.streaming.ChunkFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Unified chat types to and from the Claude Messages format, shared by the Anthropic API
 * and Claude models on Bedrock.
 */
final class ClaudeMessagesMapper {

    static final int DEFAULT_MAX_TOKENS = 4096;

    private final ObjectMapper objectMapper;

    ClaudeMessagesMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Request body without the model field; callers add model or API version as their endpoint requires.
     */
    ObjectNode toRequest(ChatCompletionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();

        String system = request.getMessages().stream()
                .filter(message -> Message.ROLE_SYSTEM.equals(message.getRole()))
                .map(Message::getText)
                .collect(Collectors.joining("\n"));
        if (!system.isEmpty()) {
            body.put("system", system);
        }

        ArrayNode messages = body.putArray("messages");
        for (Message message : request.getMessages()) {
            if (!Message.ROLE_SYSTEM.equals(message.getRole())) {
                messages.add(toMessage(message));
            }
        }

        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_MAX_TOKENS);
        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            body.put("top_p", request.getTopP());
        }
        if (request.getTopK() != null) {
            body.put("top_k", request.getTopK());
        }
        if (request.getStop() != null && !request.getStop().isEmpty()) {
            ArrayNode stop = body.putArray("stop_sequences");
            request.getStop().forEach(stop::add);
        }
        if (request.getTools() != null && !request.getTools().isEmpty()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : request.getTools()) {
                ObjectNode node = tools.addObject();
                node.put("name", tool.getFunction().getName());
                if (tool.getFunction().getDescription() != null) {
                    node.put("description", tool.getFunction().getDescription());
                }
                node.set("input_schema", tool.getFunction().getParameters() != null
                        ? tool.getFunction().getParameters()
                        : objectMapper.createObjectNode().put("type", "object"));
            }
            JsonNode toolChoice = toToolChoice(request.getToolChoice());
            if (toolChoice != null) {
                body.set("tool_choice", toolChoice);
            }
        }
        return body;
    }

    ChatCompletionResponse fromResponse(JsonNode response, String requestedModel) {
        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode block : response.path("content")) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                text.append(block.path("text").asText());
            } else if ("tool_use".equals(type)) {
                toolCalls.add(ToolCall.builder()
                        .id(block.path("id").asText())
                        .type("function")
                        .function(new ToolCall.FunctionCall(block.path("name").asText(),
                                block.path("input").toString()))
                        .build());
            }
        }

        Message message = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(MessageContent.text(text.toString()))
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .build();

        return ChatCompletionResponse.builder()
                .id(response.has("id") ? "chatcmpl-" + response.get("id").asText() : ChunkFactory.newId())
                .object(ChatCompletionResponse.OBJECT)
                .created(Instant.now().getEpochSecond())
                .model(requestedModel)
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(message)
                        .finishReason(mapStopReason(response.path("stop_reason").asText(null)))
                        .build()))
                .usage(usage(response.path("usage")))
                .build();
    }

    static Usage usage(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return null;
        }
        Integer input = usage.has("input_tokens") ? usage.get("input_tokens").asInt() : null;
        Integer output = usage.has("output_tokens") ? usage.get("output_tokens").asInt() : null;
        return Usage.builder().promptTokens(input).completionTokens(output).build().withTotal();
    }

    /**
     * Map Claude stop reasons to unified finish reasons.
     */
    static String mapStopReason(String stopReason) {
        if (stopReason == null) {
            return "stop";
        }
        return switch (stopReason) {
            case "max_tokens" -> "length";
            case "tool_use" -> "tool_calls";
            case "refusal" -> "content_filter";
            default -> "stop";
        };
    }

    private ObjectNode toMessage(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        if (Message.ROLE_TOOL.equals(message.getRole())) {
            node.put("role", Message.ROLE_USER);
            ObjectNode result = node.putArray("content").addObject();
            result.put("type", "tool_result");
            result.put("tool_use_id", message.getToolCallId());
            result.put("content", message.getText());
            return node;
        }

        node.put("role", message.getRole());
        ArrayNode content = node.putArray("content");
        MessageContent body = message.getContent();
        if (body instanceof MessageContent.Text text) {
            if (text.text() != null && !text.text().isEmpty()) {
                content.addObject().put("type", "text").put("text", text.text());
            }
        } else if (body instanceof MessageContent.Blocks blocks) {
            for (ContentBlock block : blocks.blocks()) {
                if (block.isText()) {
                    content.addObject().put("type", "text").put("text", block.getText());
                } else if (block.isImage() && block.getImageUrl() != null) {
                    content.add(toImage(block.getImageUrl().getUrl()));
                }
            }
        }
        if (message.getToolCalls() != null) {
            for (ToolCall call : message.getToolCalls()) {
                ObjectNode use = content.addObject();
                use.put("type", "tool_use");
                use.put("id", call.getId());
                use.put("name", call.getFunction().getName());
                use.set("input", parseArguments(call.getFunction().getArguments()));
            }
        }
        return node;
    }

    private ObjectNode toImage(String url) {
        ObjectNode image = objectMapper.createObjectNode();
        image.put("type", "image");
        ObjectNode source = image.putObject("source");
        if (url.startsWith("data:") && url.contains(";base64,")) {
            int comma = url.indexOf(',');
            source.put("type", "base64");
            source.put("media_type", url.substring(5, url.indexOf(';')));
            source.put("data", url.substring(comma + 1));
        } else {
            source.put("type", "url");
            source.put("url", url);
        }
        return image;
    }

    private JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            // arguments are model output and may not be valid JSON; pass them through as a string
            return objectMapper.createObjectNode().put("value", arguments);
        }
    }

    private JsonNode toToolChoice(JsonNode toolChoice) {
        if (toolChoice == null || toolChoice.isNull()) {
            return null;
        }
        if (toolChoice.isTextual()) {
            return switch (toolChoice.asText()) {
                case "required" -> objectMapper.createObjectNode().put("type", "any");
                case "none" -> objectMapper.createObjectNode().put("type", "none");
                default -> objectMapper.createObjectNode().put("type", "auto");
            };
        }
        String name = toolChoice.path("function").path("name").asText(null);
        return name != null
                ? objectMapper.createObjectNode().put("type", "tool").put("name", name)
                : null;
    }
}
