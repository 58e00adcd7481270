package com.switchboard.provider;

import com.switchboard.capability.CapabilityDescriptor;
import com.switchboard.model.AuthenticationResult;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.EmbeddingRequest;
import com.switchboard.model.EmbeddingResponse;
import com.switchboard.model.ImageGenerationRequest;
import com.switchboard.model.ImageGenerationResponse;
import com.switchboard.model.ModelInfo;
import com.switchboard.model.SpeechRequest;
import com.switchboard.resilience.CancellationToken;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Contract every upstream adapter satisfies.
 * Implementations handle provider-specific authentication, wire mapping and API communication;
 * every failure they emit is a {@link com.switchboard.exception.GatewayException}.
 */
public interface ProviderClient {

    /**
     * Get provider name (e.g., "openai", "bedrock", "anthropic").
     */
    String getName();

    /**
     * Check if this provider serves the given model.
     */
    boolean supports(String model);

    /**
     * Check if provider is enabled and configured.
     */
    boolean isEnabled();

    CapabilityDescriptor getCapabilities(String model);

    Mono<ChatCompletionResponse> createChatCompletion(ChatCompletionRequest request, CancellationToken cancellation);

    /**
     * Stream a completion as canonical chunks. Nothing is sent upstream until subscription.
     */
    Flux<ChatCompletionChunk> streamChatCompletion(ChatCompletionRequest request, CancellationToken cancellation);

    Mono<EmbeddingResponse> createEmbedding(EmbeddingRequest request, CancellationToken cancellation);

    Mono<ImageGenerationResponse> createImage(ImageGenerationRequest request, CancellationToken cancellation);

    /**
     * Synthesize speech; the result is the encoded audio.
     */
    Mono<byte[]> createSpeech(SpeechRequest request, CancellationToken cancellation);

    /**
     * Models offered by the provider. Degrades to a static list instead of failing.
     */
    Mono<List<ModelInfo>> listModels(CancellationToken cancellation);

    /**
     * Check the configured credentials against the provider. Fails only when canceled; every
     * other outcome, including rejected credentials, is reported in the result.
     */
    Mono<AuthenticationResult> verifyAuthentication(CancellationToken cancellation);
}
