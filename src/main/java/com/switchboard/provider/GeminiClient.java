package com.switchboard.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.capability.Operation;
import com.switchboard.config.SwitchboardProperties;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.Choice;
import com.switchboard.model.ContentBlock;
import com.switchboard.model.EmbeddingRequest;
import com.switchboard.model.EmbeddingResponse;
import com.switchboard.model.Message;
import com.switchboard.model.MessageContent;
import com.switchboard.model.ModelInfo;
import com.switchboard.model.ToolCall;
import com.switchboard.model.ToolDefinition;
import com.switchboard.model.Usage;
import com.switchboard.resilience.CancellationToken;
import com.switchboard.streaming.ChunkFactory;
import com.switchboard.streaming.UpstreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Google Gemini (Generative Language API). The API key travels as the {@code key} query parameter.
 * Chat, SSE streaming, embeddings and model listing.
 */
@Slf4j
@Component
public class GeminiClient extends AbstractProviderClient {

    public static final String NAME = "gemini";

    private static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    @Autowired
    public GeminiClient(WebClient webClient, SwitchboardProperties properties, ClientSupport support) {
        this(ProviderSettings.of(properties, NAME), webClient, support);
    }

    public GeminiClient(ProviderSettings settings, WebClient webClient, ClientSupport support) {
        super(settings, AuthScheme.queryParameter("key"), webClient, support);
    }

    @Override
    protected boolean matchesModel(String model) {
        return model.startsWith("gemini") || model.startsWith("text-embedding-004") || model.startsWith("models/");
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    protected List<String> defaultModels() {
        return List.of("gemini-1.5-pro", "gemini-1.5-flash", "text-embedding-004");
    }

    @Override
    protected Mono<ChatCompletionResponse> doChatCompletion(ChatCompletionRequest request,
                                                            CancellationToken cancellation) {
        Mono<ChatCompletionResponse> call = post(modelPath(request.getModel()) + ":generateContent")
                .bodyValue(toRequest(request))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> fromResponse(response, request.getModel()));
        return withRetry(call, Operation.CHAT, cancellation);
    }

    @Override
    protected Flux<ChatCompletionChunk> doStreamChatCompletion(ChatCompletionRequest request,
                                                               CancellationToken cancellation) {
        Flux<UpstreamEvent> events = post(modelPath(request.getModel()) + ":streamGenerateContent?alt=sse")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(toRequest(request))
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .concatMapIterable(this::toEvents);
        return normalize(events, request.getModel(), cancellation);
    }

    @Override
    protected Mono<EmbeddingResponse> doCreateEmbedding(EmbeddingRequest request, CancellationToken cancellation) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode requests = body.putArray("requests");
        for (String input : request.getInput()) {
            ObjectNode item = requests.addObject();
            item.put("model", modelPath(request.getModel()).substring(1));
            item.putObject("content").putArray("parts").addObject().put("text", input);
        }

        Mono<EmbeddingResponse> call = post(modelPath(request.getModel()) + ":batchEmbedContents")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    List<EmbeddingResponse.EmbeddingData> data = new ArrayList<>();
                    int index = 0;
                    for (JsonNode embedding : response.path("embeddings")) {
                        List<Double> values = new ArrayList<>();
                        embedding.path("values").forEach(value -> values.add(value.asDouble()));
                        data.add(EmbeddingResponse.EmbeddingData.builder().index(index++).embedding(values).build());
                    }
                    int tokens = request.getInput().stream().mapToInt(AbstractProviderClient::estimateTokens).sum();
                    return EmbeddingResponse.builder()
                            .data(data)
                            .model(request.getModel())
                            .usage(Usage.of(tokens, 0))
                            .build();
                });
        return withRetry(call, Operation.EMBEDDING, cancellation);
    }

    @Override
    protected Mono<List<ModelInfo>> doListModels(CancellationToken cancellation) {
        Mono<List<ModelInfo>> call = get("/models")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(body -> {
                    List<ModelInfo> models = new ArrayList<>();
                    for (JsonNode model : body.path("models")) {
                        String name = model.path("name").asText();
                        models.add(ModelInfo.of(name.startsWith("models/") ? name.substring(7) : name, getName()));
                    }
                    return models;
                });
        return withRetry(call, Operation.LIST_MODELS, cancellation);
    }

    private static String modelPath(String model) {
        return model.startsWith("models/") ? "/" + model : "/models/" + model;
    }

    ObjectNode toRequest(ChatCompletionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();

        String system = request.getMessages().stream()
                .filter(message -> Message.ROLE_SYSTEM.equals(message.getRole()))
                .map(Message::getText)
                .collect(Collectors.joining("\n"));
        if (!system.isEmpty()) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", system);
        }

        ArrayNode contents = body.putArray("contents");
        for (Message message : request.getMessages()) {
            if (!Message.ROLE_SYSTEM.equals(message.getRole())) {
                contents.add(toContent(message));
            }
        }

        ObjectNode config = body.putObject("generationConfig");
        if (request.getTemperature() != null) {
            config.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            config.put("topP", request.getTopP());
        }
        if (request.getTopK() != null) {
            config.put("topK", request.getTopK());
        }
        if (request.getMaxTokens() != null) {
            config.put("maxOutputTokens", request.getMaxTokens());
        }
        if (request.getStop() != null && !request.getStop().isEmpty()) {
            ArrayNode stop = config.putArray("stopSequences");
            request.getStop().forEach(stop::add);
        }

        if (request.getTools() != null && !request.getTools().isEmpty()) {
            ArrayNode declarations = body.putArray("tools").addObject().putArray("functionDeclarations");
            for (ToolDefinition tool : request.getTools()) {
                ObjectNode declaration = declarations.addObject();
                declaration.put("name", tool.getFunction().getName());
                if (tool.getFunction().getDescription() != null) {
                    declaration.put("description", tool.getFunction().getDescription());
                }
                if (tool.getFunction().getParameters() != null) {
                    declaration.set("parameters", tool.getFunction().getParameters());
                }
            }
        }
        return body;
    }

    private ObjectNode toContent(Message message) {
        ObjectNode content = objectMapper.createObjectNode();
        content.put("role", Message.ROLE_ASSISTANT.equals(message.getRole()) ? "model" : "user");
        ArrayNode parts = content.putArray("parts");

        if (Message.ROLE_TOOL.equals(message.getRole())) {
            ObjectNode response = parts.addObject().putObject("functionResponse");
            response.put("name", message.getName() != null ? message.getName() : message.getToolCallId());
            response.putObject("response").put("content", message.getText());
            return content;
        }

        MessageContent body = message.getContent();
        if (body instanceof MessageContent.Text text) {
            if (text.text() != null && !text.text().isEmpty()) {
                parts.addObject().put("text", text.text());
            }
        } else if (body instanceof MessageContent.Blocks blocks) {
            for (ContentBlock block : blocks.blocks()) {
                if (block.isText()) {
                    parts.addObject().put("text", block.getText());
                } else if (block.isImage() && block.getImageUrl() != null) {
                    parts.add(toImagePart(block.getImageUrl().getUrl()));
                }
            }
        }
        if (message.getToolCalls() != null) {
            for (ToolCall call : message.getToolCalls()) {
                ObjectNode functionCall = parts.addObject().putObject("functionCall");
                functionCall.put("name", call.getFunction().getName());
                functionCall.set("args", readTree(call.getFunction().getArguments() != null
                        ? call.getFunction().getArguments() : "{}"));
            }
        }
        return content;
    }

    private ObjectNode toImagePart(String url) {
        ObjectNode part = objectMapper.createObjectNode();
        if (url.startsWith("data:") && url.contains(";base64,")) {
            ObjectNode inline = part.putObject("inlineData");
            inline.put("mimeType", url.substring(5, url.indexOf(';')));
            inline.put("data", url.substring(url.indexOf(',') + 1));
        } else {
            ObjectNode file = part.putObject("fileData");
            file.put("mimeType", "image/*");
            file.put("fileUri", url);
        }
        return part;
    }

    ChatCompletionResponse fromResponse(JsonNode response, String requestedModel) {
        JsonNode candidate = response.path("candidates").path(0);
        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        collectParts(candidate, text, toolCalls);

        Message message = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(MessageContent.text(text.toString()))
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .build();

        String finishReason = toolCalls.isEmpty()
                ? mapFinishReason(candidate.path("finishReason").asText(null))
                : "tool_calls";

        return ChatCompletionResponse.builder()
                .id(ChunkFactory.newId())
                .object(ChatCompletionResponse.OBJECT)
                .created(Instant.now().getEpochSecond())
                .model(requestedModel)
                .choices(List.of(Choice.builder().index(0).message(message).finishReason(finishReason).build()))
                .usage(usage(response.path("usageMetadata")))
                .build();
    }

    List<UpstreamEvent> toEvents(ServerSentEvent<String> event) {
        String data = event.data();
        if (data == null || data.isBlank()) {
            return List.of(UpstreamEvent.ignored("keep-alive"));
        }
        JsonNode node = readTree(data);
        JsonNode candidate = node.path("candidates").path(0);

        List<UpstreamEvent> events = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        collectParts(candidate, text, toolCalls);
        if (text.length() > 0) {
            events.add(UpstreamEvent.content(text.toString()));
        }
        if (!toolCalls.isEmpty()) {
            events.add(UpstreamEvent.toolCalls(toolCalls));
        }
        String finishReason = candidate.path("finishReason").asText(null);
        if (finishReason != null) {
            events.add(UpstreamEvent.finish(toolCalls.isEmpty() ? mapFinishReason(finishReason) : "tool_calls"));
        }
        Usage usage = usage(node.path("usageMetadata"));
        if (usage != null) {
            events.add(UpstreamEvent.usage(usage));
        }
        return events.isEmpty() ? List.of(UpstreamEvent.ignored("empty")) : events;
    }

    private void collectParts(JsonNode candidate, StringBuilder text, List<ToolCall> toolCalls) {
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.has("text")) {
                text.append(part.get("text").asText());
            } else if (part.has("functionCall")) {
                JsonNode call = part.get("functionCall");
                int index = toolCalls.size();
                toolCalls.add(ToolCall.builder()
                        .index(index)
                        .id("call_" + index)
                        .type("function")
                        .function(new ToolCall.FunctionCall(call.path("name").asText(), call.path("args").toString()))
                        .build());
            }
        }
    }

    private static Usage usage(JsonNode metadata) {
        if (metadata.isMissingNode() || metadata.isNull()) {
            return null;
        }
        return Usage.builder()
                .promptTokens(metadata.has("promptTokenCount") ? metadata.get("promptTokenCount").asInt() : null)
                .completionTokens(metadata.has("candidatesTokenCount")
                        ? metadata.get("candidatesTokenCount").asInt() : null)
                .totalTokens(metadata.has("totalTokenCount") ? metadata.get("totalTokenCount").asInt() : null)
                .build()
                .withTotal();
    }

    static String mapFinishReason(String finishReason) {
        if (finishReason == null) {
            return "stop";
        }
        return switch (finishReason) {
            case "MAX_TOKENS" -> "length";
            case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT" -> "content_filter";
            default -> "stop";
        };
    }
}
