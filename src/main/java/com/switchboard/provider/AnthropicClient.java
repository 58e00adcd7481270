package com.switchboard.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.capability.Operation;
import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.CommunicationException;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.ModelInfo;
import com.switchboard.model.ToolCall;
import com.switchboard.model.Usage;
import com.switchboard.resilience.CancellationToken;
import com.switchboard.streaming.UpstreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic (Claude) Messages API. Authenticated with the {@code x-api-key} header.
 * Chat and native SSE streaming; embeddings and images are not offered by Anthropic.
 */
@Slf4j
@Component
public class AnthropicClient extends AbstractProviderClient {

    public static final String NAME = "anthropic";

    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final ClaudeMessagesMapper mapper;

    @Autowired
    public AnthropicClient(WebClient webClient, SwitchboardProperties properties, ClientSupport support) {
        this(ProviderSettings.of(properties, NAME), webClient, support);
    }

    public AnthropicClient(ProviderSettings settings, WebClient webClient, ClientSupport support) {
        super(settings, AuthScheme.header("x-api-key"), webClient, support);
        this.mapper = new ClaudeMessagesMapper(objectMapper);
    }

    @Override
    protected boolean matchesModel(String model) {
        return model.startsWith("claude");
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    protected List<String> defaultModels() {
        return List.of("claude-3-5-sonnet-latest", "claude-3-5-haiku-latest", "claude-3-opus-latest");
    }

    @Override
    protected void customizeHeaders(HttpHeaders headers) {
        headers.set("anthropic-version", credentials.getApiVersion() != null
                ? credentials.getApiVersion() : ANTHROPIC_VERSION);
    }

    @Override
    protected Mono<ChatCompletionResponse> doChatCompletion(ChatCompletionRequest request,
                                                            CancellationToken cancellation) {
        ObjectNode body = mapper.toRequest(request);
        body.put("model", request.getModel());

        Mono<ChatCompletionResponse> call = post("/messages")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> mapper.fromResponse(response, request.getModel()));
        return withRetry(call, Operation.CHAT, cancellation);
    }

    @Override
    protected Flux<ChatCompletionChunk> doStreamChatCompletion(ChatCompletionRequest request,
                                                               CancellationToken cancellation) {
        ObjectNode body = mapper.toRequest(request);
        body.put("model", request.getModel());
        body.put("stream", true);

        Flux<UpstreamEvent> events = Flux.defer(() -> {
            StreamState state = new StreamState();
            return post("/messages")
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToFlux(SSE_TYPE)
                    .concatMapIterable(event -> toEvents(event, state));
        });
        return normalize(events, request.getModel(), cancellation);
    }

    @Override
    protected Mono<List<ModelInfo>> doListModels(CancellationToken cancellation) {
        Mono<List<ModelInfo>> call = get("/models")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(body -> {
                    List<ModelInfo> models = new ArrayList<>();
                    for (JsonNode model : body.path("data")) {
                        models.add(ModelInfo.of(model.path("id").asText(), getName()));
                    }
                    return models;
                });
        return withRetry(call, Operation.LIST_MODELS, cancellation);
    }

    /**
     * Maps one Messages API stream event. Tool-use blocks are re-indexed so tool calls count
     * from zero regardless of interleaved text blocks.
     */
    List<UpstreamEvent> toEvents(ServerSentEvent<String> event, StreamState state) {
        String data = event.data();
        if (data == null || data.isBlank()) {
            return List.of(UpstreamEvent.ignored("keep-alive"));
        }
        JsonNode node = readTree(data);
        String type = event.event() != null ? event.event() : node.path("type").asText();

        switch (type) {
            case "message_start": {
                Usage usage = ClaudeMessagesMapper.usage(node.path("message").path("usage"));
                return usage != null ? List.of(UpstreamEvent.usage(promptOnly(usage))) : List.of();
            }
            case "content_block_start": {
                JsonNode block = node.path("content_block");
                if (!"tool_use".equals(block.path("type").asText())) {
                    return List.of();
                }
                int toolIndex = state.toolIndex(node.path("index").asInt());
                return List.of(UpstreamEvent.toolCalls(List.of(ToolCall.builder()
                        .index(toolIndex)
                        .id(block.path("id").asText())
                        .type("function")
                        .function(new ToolCall.FunctionCall(block.path("name").asText(), ""))
                        .build())));
            }
            case "content_block_delta": {
                JsonNode delta = node.path("delta");
                String deltaType = delta.path("type").asText();
                if ("text_delta".equals(deltaType)) {
                    return List.of(UpstreamEvent.content(delta.path("text").asText()));
                }
                if ("input_json_delta".equals(deltaType)) {
                    Integer toolIndex = state.existingToolIndex(node.path("index").asInt());
                    if (toolIndex == null) {
                        return List.of();
                    }
                    return List.of(UpstreamEvent.toolCalls(List.of(ToolCall.builder()
                            .index(toolIndex)
                            .function(ToolCall.FunctionCall.builder()
                                    .arguments(delta.path("partial_json").asText())
                                    .build())
                            .build())));
                }
                return List.of();
            }
            case "message_delta": {
                List<UpstreamEvent> events = new ArrayList<>(2);
                String stopReason = node.path("delta").path("stop_reason").asText(null);
                if (stopReason != null) {
                    events.add(UpstreamEvent.finish(ClaudeMessagesMapper.mapStopReason(stopReason)));
                }
                JsonNode usage = node.path("usage");
                if (usage.has("output_tokens")) {
                    events.add(UpstreamEvent.usage(Usage.builder()
                            .completionTokens(usage.get("output_tokens").asInt())
                            .build()));
                }
                return events;
            }
            case "error":
                throw new CommunicationException("Stream error from " + getName() + ": "
                        + node.path("error").path("message").asText("unknown error"));
            case "content_block_stop":
            case "message_stop":
            case "ping":
                return List.of(UpstreamEvent.ignored(type));
            default:
                log.warn("Unknown Anthropic stream event type: {}", type);
                return List.of(UpstreamEvent.ignored(type));
        }
    }

    private static Usage promptOnly(Usage usage) {
        return Usage.builder().promptTokens(usage.getPromptTokens()).build();
    }

    /**
     * Per-stream mapping from content block index to tool call index.
     */
    static final class StreamState {

        private final Map<Integer, Integer> toolIndexes = new HashMap<>();

        int toolIndex(int blockIndex) {
            return toolIndexes.computeIfAbsent(blockIndex, ignored -> toolIndexes.size());
        }

        Integer existingToolIndex(int blockIndex) {
            return toolIndexes.get(blockIndex);
        }
    }
}
