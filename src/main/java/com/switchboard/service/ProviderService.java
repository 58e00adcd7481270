package com.switchboard.service;

import com.switchboard.capability.CapabilityDescriptor;
import com.switchboard.config.CacheConfiguration;
import com.switchboard.exception.ConfigurationException;
import com.switchboard.exception.RequestValidationException;
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
import com.switchboard.provider.ProviderClient;
import com.switchboard.resilience.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Routes unified requests to provider adapters.
 *
 * <p>A model written as {@code provider/model} goes to that provider when one with the name is registered.
 * Any other model goes to the first enabled provider that supports it.
 */
@Slf4j
@Service
public class ProviderService {

    private final List<ProviderClient> providers;
    private final Cache modelsCache;

    public ProviderService(List<ProviderClient> providers, CacheManager cacheManager) {
        this.providers = providers;
        this.modelsCache = cacheManager.getCache(CacheConfiguration.MODELS_CACHE);
        log.info("Initialized ProviderService with {} providers: {}",
                providers.size(),
                providers.stream().map(ProviderClient::getName).toList());
    }

    public Mono<ChatCompletionResponse> createChatCompletion(ChatCompletionRequest request,
                                                             CancellationToken cancellation) {
        return Mono.defer(() -> {
            Route route = route(request.getModel());
            ChatCompletionRequest routed = request.toBuilder().model(route.model()).build();
            return route.provider().createChatCompletion(routed, cancellation)
                    .map(response -> response.toBuilder().originalModelAlias(request.getModel()).build())
                    .doOnSuccess(response -> log.info("Successfully received response from provider: {}",
                            route.provider().getName()))
                    .doOnError(error -> log.error("Error from provider {}: {}",
                            route.provider().getName(), error.getMessage()));
        });
    }

    public Flux<ChatCompletionChunk> streamChatCompletion(ChatCompletionRequest request,
                                                          CancellationToken cancellation) {
        return Flux.defer(() -> {
            Route route = route(request.getModel());
            return route.provider().streamChatCompletion(request.toBuilder().model(route.model()).build(),
                            cancellation)
                    .doOnError(error -> log.error("Stream from provider {} failed: {}",
                            route.provider().getName(), error.getMessage()));
        });
    }

    public Mono<EmbeddingResponse> createEmbedding(EmbeddingRequest request, CancellationToken cancellation) {
        return Mono.defer(() -> {
            Route route = route(request.getModel());
            return route.provider().createEmbedding(request.toBuilder().model(route.model()).build(), cancellation);
        });
    }

    public Mono<ImageGenerationResponse> createImage(ImageGenerationRequest request, CancellationToken cancellation) {
        return Mono.defer(() -> {
            Route route = route(request.getModel());
            return route.provider().createImage(request.toBuilder().model(route.model()).build(), cancellation);
        });
    }

    public Mono<byte[]> createSpeech(SpeechRequest request, CancellationToken cancellation) {
        return Mono.defer(() -> {
            Route route = route(request.getModel());
            return route.provider().createSpeech(request.toBuilder().model(route.model()).build(), cancellation);
        });
    }

    /**
     * Models of every enabled provider. Each provider's list is cached for the configured TTL.
     */
    public Mono<List<ModelInfo>> listModels(CancellationToken cancellation) {
        return Flux.fromIterable(providers)
                .filter(ProviderClient::isEnabled)
                .concatMap(provider -> listModels(provider, cancellation))
                .flatMapIterable(models -> models)
                .collectList();
    }

    @SuppressWarnings("unchecked")
    public Mono<List<ModelInfo>> listModels(ProviderClient provider, CancellationToken cancellation) {
        return Mono.defer(() -> {
            Cache.ValueWrapper cached = modelsCache != null ? modelsCache.get(provider.getName()) : null;
            if (cached != null) {
                log.debug("Model list cache hit for {}", provider.getName());
                return Mono.just((List<ModelInfo>) cached.get());
            }
            return provider.listModels(cancellation)
                    .doOnNext(models -> {
                        if (modelsCache != null && !models.isEmpty()) {
                            modelsCache.put(provider.getName(), models);
                        }
                    });
        });
    }

    public CapabilityDescriptor getCapabilities(String providerName, String model) {
        return requireProvider(providerName).getCapabilities(model);
    }

    public Mono<AuthenticationResult> verifyAuthentication(String providerName, CancellationToken cancellation) {
        return Mono.defer(() -> requireProvider(providerName).verifyAuthentication(cancellation));
    }

    public List<ProviderClient> getProviders() {
        return providers;
    }

    public Optional<ProviderClient> getProvider(String name) {
        return providers.stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public ProviderClient requireProvider(String name) {
        return getProvider(name).orElseThrow(() -> new RequestValidationException(
                "Unknown provider: " + name + ". Registered providers: "
                        + providers.stream().map(ProviderClient::getName).toList()));
    }

    /**
     * Pick the adapter for a requested model.
     */
    Route route(String requestedModel) {
        if (requestedModel == null || requestedModel.isBlank()) {
            throw new RequestValidationException("Model must be specified");
        }

        int slash = requestedModel.indexOf('/');
        if (slash > 0) {
            Optional<ProviderClient> explicit = getProvider(requestedModel.substring(0, slash));
            if (explicit.isPresent()) {
                ProviderClient provider = explicit.get();
                if (!provider.isEnabled()) {
                    throw new ConfigurationException("Provider " + provider.getName() + " is not enabled",
                            provider.getName(), "route", null);
                }
                String model = requestedModel.substring(slash + 1);
                log.info("Routing model '{}' to provider '{}' (explicit)", model, provider.getName());
                return new Route(provider, model);
            }
        }

        ProviderClient provider = providers.stream()
                .filter(ProviderClient::isEnabled)
                .filter(p -> p.supports(requestedModel))
                .findFirst()
                .orElse(null);

        if (provider == null) {
            log.error("No enabled provider found for model: {}", requestedModel);
            throw new RequestValidationException(
                    "No provider available for model: " + requestedModel
                            + ". Enabled providers: "
                            + providers.stream()
                                    .filter(ProviderClient::isEnabled)
                                    .map(ProviderClient::getName)
                                    .toList());
        }

        log.info("Routing model '{}' to provider '{}'", requestedModel, provider.getName());
        return new Route(provider, requestedModel);
    }

    record Route(ProviderClient provider, String model) {
    }
}
