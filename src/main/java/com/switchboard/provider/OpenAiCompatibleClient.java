package com.switchboard.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.switchboard.capability.Operation;
import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.CommunicationException;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.Delta;
import com.switchboard.model.EmbeddingRequest;
import com.switchboard.model.EmbeddingResponse;
import com.switchboard.model.ImageGenerationRequest;
import com.switchboard.model.ImageGenerationResponse;
import com.switchboard.model.ModelInfo;
import com.switchboard.model.SpeechRequest;
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

/**
 * OpenAI and OpenAI-compatible APIs (bearer auth).
 * Chat, SSE streaming, embeddings, images, text-to-speech and model listing.
 */
@Slf4j
@Component
public class OpenAiCompatibleClient extends AbstractProviderClient {

    public static final String NAME = "openai";

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String DONE = "[DONE]";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    @Autowired
    public OpenAiCompatibleClient(WebClient webClient, SwitchboardProperties properties, ClientSupport support) {
        this(ProviderSettings.of(properties, NAME), webClient, support);
    }

    public OpenAiCompatibleClient(ProviderSettings settings, WebClient webClient, ClientSupport support) {
        super(settings, AuthScheme.bearer(), webClient, support);
    }

    @Override
    protected boolean matchesModel(String model) {
        return model.startsWith("gpt-")
                || model.startsWith("chatgpt")
                || model.startsWith("o1")
                || model.startsWith("o3")
                || model.startsWith("o4")
                || model.startsWith("text-embedding")
                || model.startsWith("dall-e")
                || model.startsWith("tts-")
                || model.contains("turbo");
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    protected List<String> defaultModels() {
        return List.of("gpt-4o", "gpt-4o-mini", "text-embedding-3-small", "dall-e-3", "tts-1");
    }

    @Override
    protected Mono<ChatCompletionResponse> doChatCompletion(ChatCompletionRequest request,
                                                            CancellationToken cancellation) {
        ChatCompletionRequest wireRequest = toWire(request, false);
        Mono<ChatCompletionResponse> call = post("/chat/completions")
                .bodyValue(wireRequest)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .map(response -> complete(response, request.getModel()));
        return withRetry(call, Operation.CHAT, cancellation);
    }

    @Override
    protected Flux<ChatCompletionChunk> doStreamChatCompletion(ChatCompletionRequest request,
                                                               CancellationToken cancellation) {
        ChatCompletionRequest wireRequest = toWire(request, true);
        Flux<UpstreamEvent> events = post("/chat/completions")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(wireRequest)
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .concatMapIterable(this::toEvents);
        return normalize(events, request.getModel(), cancellation);
    }

    @Override
    protected Mono<EmbeddingResponse> doCreateEmbedding(EmbeddingRequest request, CancellationToken cancellation) {
        Mono<EmbeddingResponse> call = post("/embeddings")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(EmbeddingResponse.class)
                .map(response -> {
                    if (response.getUsage() != null) {
                        response.setUsage(response.getUsage().withTotal());
                    }
                    return response;
                });
        return withRetry(call, Operation.EMBEDDING, cancellation);
    }

    @Override
    protected Mono<ImageGenerationResponse> doCreateImage(ImageGenerationRequest request,
                                                          CancellationToken cancellation) {
        Mono<ImageGenerationResponse> call = post("/images/generations")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ImageGenerationResponse.class);
        return withRetry(call, Operation.IMAGE_GENERATION, cancellation);
    }

    @Override
    protected Mono<byte[]> doCreateSpeech(SpeechRequest request, CancellationToken cancellation) {
        Mono<byte[]> call = post("/audio/speech")
                .accept(MediaType.APPLICATION_OCTET_STREAM, MediaType.ALL)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(byte[].class);
        return withRetry(call, Operation.TEXT_TO_SPEECH, cancellation);
    }

    @Override
    protected Mono<List<ModelInfo>> doListModels(CancellationToken cancellation) {
        Mono<List<ModelInfo>> call = get("/models")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(body -> {
                    List<ModelInfo> models = new ArrayList<>();
                    for (JsonNode model : body.path("data")) {
                        models.add(ModelInfo.builder()
                                .id(model.path("id").asText())
                                .created(model.has("created") ? model.get("created").asLong() : null)
                                .ownedBy(model.path("owned_by").asText(getName()))
                                .provider(getName())
                                .build());
                    }
                    return models;
                });
        return withRetry(call, Operation.LIST_MODELS, cancellation);
    }

    /**
     * Drops fields the OpenAI API does not accept.
     */
    private ChatCompletionRequest toWire(ChatCompletionRequest request, boolean stream) {
        return request.toBuilder()
                .topK(null)
                .stream(stream ? Boolean.TRUE : null)
                .build();
    }

    private ChatCompletionResponse complete(ChatCompletionResponse response, String requestedModel) {
        return response.toBuilder()
                .id(response.getId() != null ? response.getId() : ChunkFactory.newId())
                .object(response.getObject() != null ? response.getObject() : ChatCompletionResponse.OBJECT)
                .created(response.getCreated() != null ? response.getCreated() : Instant.now().getEpochSecond())
                .model(response.getModel() != null ? response.getModel() : requestedModel)
                .choices(response.getChoices() != null ? response.getChoices() : List.of())
                .usage(response.getUsage() != null ? response.getUsage().withTotal() : null)
                .build();
    }

    List<UpstreamEvent> toEvents(ServerSentEvent<String> event) {
        String data = event.data();
        if (data == null || data.isBlank()) {
            return List.of(UpstreamEvent.ignored("keep-alive"));
        }
        if (DONE.equals(data.trim())) {
            return List.of(UpstreamEvent.ignored("done"));
        }

        JsonNode node = readTree(data);
        if (node.has("error")) {
            throw new CommunicationException("Stream error from " + getName() + ": "
                    + node.path("error").path("message").asText("unknown error"));
        }

        ChatCompletionChunk chunk;
        try {
            chunk = objectMapper.treeToValue(node, ChatCompletionChunk.class);
        } catch (JsonProcessingException e) {
            throw CommunicationException.malformedResponse("Undecodable stream chunk from " + getName(), e);
        }

        List<UpstreamEvent> events = new ArrayList<>(3);
        ChatCompletionChunk.ChunkChoice choice = chunk.firstChoice();
        if (choice != null) {
            Delta delta = choice.getDelta();
            if (delta != null && delta.getContent() != null) {
                events.add(UpstreamEvent.content(delta.getContent()));
            }
            if (delta != null && delta.getToolCalls() != null && !delta.getToolCalls().isEmpty()) {
                events.add(UpstreamEvent.toolCalls(delta.getToolCalls()));
            }
            if (choice.getFinishReason() != null) {
                events.add(UpstreamEvent.finish(choice.getFinishReason()));
            }
        }
        if (chunk.getUsage() != null) {
            events.add(UpstreamEvent.usage(chunk.getUsage()));
        }
        if (events.isEmpty()) {
            events.add(UpstreamEvent.ignored("empty"));
        }
        return events;
    }
}
