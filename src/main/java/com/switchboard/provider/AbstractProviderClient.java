package com.switchboard.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.capability.CapabilityDescriptor;
import com.switchboard.capability.Operation;
import com.switchboard.exception.CommunicationException;
import com.switchboard.exception.ConfigurationException;
import com.switchboard.exception.GatewayErrors;
import com.switchboard.exception.GatewayException;
import com.switchboard.exception.RequestCanceledException;
import com.switchboard.exception.RequestValidationException;
import com.switchboard.exception.UnsupportedProviderOperationException;
import com.switchboard.model.AuthenticationResult;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.EmbeddingRequest;
import com.switchboard.model.EmbeddingResponse;
import com.switchboard.model.ImageGenerationRequest;
import com.switchboard.model.ImageGenerationResponse;
import com.switchboard.model.Message;
import com.switchboard.model.ModelInfo;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.model.SpeechRequest;
import com.switchboard.resilience.CancellationToken;
import com.switchboard.streaming.StreamingNormalizer;
import com.switchboard.streaming.UpstreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Abstract base class for provider clients with common functionality.
 *
 * <p>Subclasses implement wire mapping only. This class supplies credential checks,
 * authenticated request setup, request validation, the capability gate, retry, cancellation
 * and error classification. Clients hold no per-request state.
 */
@Slf4j
public abstract class AbstractProviderClient implements ProviderClient {

    protected static final String USER_AGENT = "switchboard/0.1";

    protected final ProviderSettings settings;
    protected final ProviderCredentials credentials;
    protected final WebClient webClient;
    protected final ClientSupport support;
    protected final ObjectMapper objectMapper;
    private final AuthScheme authScheme;

    protected AbstractProviderClient(ProviderSettings settings, AuthScheme authScheme, WebClient webClient,
                                     ClientSupport support) {
        this.settings = settings;
        this.credentials = settings.credentials();
        this.authScheme = authScheme;
        this.webClient = webClient;
        this.support = support;
        this.objectMapper = support.getObjectMapper();
        if (settings.enabled()) {
            validateCredentials(credentials);
        }
    }

    @Override
    public String getName() {
        return settings.name();
    }

    @Override
    public boolean isEnabled() {
        return settings.enabled();
    }

    @Override
    public boolean supports(String model) {
        if (model == null) {
            return false;
        }
        return settings.models().contains(model) || matchesModel(model.toLowerCase(Locale.ROOT));
    }

    @Override
    public CapabilityDescriptor getCapabilities(String model) {
        return support.getCapabilities().getCapabilities(getName(), model);
    }

    /**
     * Model-name heuristic for routing; receives the lower-cased id.
     */
    protected abstract boolean matchesModel(String model);

    protected abstract String defaultBaseUrl();

    /**
     * Called once at construction for enabled providers. Must not depend on subclass fields.
     *
     * @throws ConfigurationException when a required secret is missing
     */
    protected void validateCredentials(ProviderCredentials credentials) {
        if (!credentials.hasApiKey()) {
            throw new ConfigurationException("API key is required", getName(), "configure", null);
        }
    }

    // ---------------------------------------------------------------- operations

    @Override
    public Mono<ChatCompletionResponse> createChatCompletion(ChatCompletionRequest request,
                                                             CancellationToken cancellation) {
        return call(Operation.CHAT, cancellation, () -> {
            validateChatRequest(request);
            requireCapability(request.getModel(), Operation.CHAT);
            log.info("Forwarding chat request to {}: model={}", getName(), request.getModel());
            return doChatCompletion(request, cancellation);
        });
    }

    @Override
    public Flux<ChatCompletionChunk> streamChatCompletion(ChatCompletionRequest request,
                                                          CancellationToken cancellation) {
        Operation operation = Operation.STREAMING_CHAT;
        Flux<ChatCompletionChunk> stream = Flux.defer(() -> {
            validateChatRequest(request);
            requireCapability(request.getModel(), operation);
            log.info("Opening chat stream to {}: model={}", getName(), request.getModel());
            return doStreamChatCompletion(request, cancellation);
        });
        return cancellation.guard(stream, operation.label())
                .onErrorMap(error -> GatewayErrors.wrap(error, getName(), operation.label()))
                .doOnError(error -> logFailure(operation, error));
    }

    @Override
    public Mono<EmbeddingResponse> createEmbedding(EmbeddingRequest request, CancellationToken cancellation) {
        return call(Operation.EMBEDDING, cancellation, () -> {
            validateEmbeddingRequest(request);
            requireCapability(request.getModel(), Operation.EMBEDDING);
            log.info("Forwarding embedding request to {}: model={}", getName(), request.getModel());
            return doCreateEmbedding(request, cancellation);
        });
    }

    @Override
    public Mono<ImageGenerationResponse> createImage(ImageGenerationRequest request, CancellationToken cancellation) {
        return call(Operation.IMAGE_GENERATION, cancellation, () -> {
            validateImageRequest(request);
            requireCapability(request.getModel(), Operation.IMAGE_GENERATION);
            log.info("Forwarding image request to {}: model={}", getName(), request.getModel());
            return doCreateImage(request, cancellation);
        });
    }

    @Override
    public Mono<byte[]> createSpeech(SpeechRequest request, CancellationToken cancellation) {
        return call(Operation.TEXT_TO_SPEECH, cancellation, () -> {
            validateSpeechRequest(request);
            requireCapability(request.getModel(), Operation.TEXT_TO_SPEECH);
            log.info("Forwarding speech request to {}: model={}", getName(), request.getModel());
            return doCreateSpeech(request, cancellation);
        });
    }

    @Override
    public Mono<List<ModelInfo>> listModels(CancellationToken cancellation) {
        Mono<List<ModelInfo>> remote = isEnabled() ? Mono.defer(() -> doListModels(cancellation)) : Mono.empty();
        return cancellation.guard(remote, Operation.LIST_MODELS.label())
                .filter(models -> !models.isEmpty())
                .onErrorResume(error -> !(error instanceof RequestCanceledException), error -> {
                    log.warn("Listing models from {} failed, using fallback list: {}", getName(), error.getMessage());
                    return Mono.empty();
                })
                .switchIfEmpty(Mono.fromSupplier(this::fallbackModels))
                .onErrorMap(error -> GatewayErrors.wrap(error, getName(), Operation.LIST_MODELS.label()));
    }

    @Override
    public Mono<AuthenticationResult> verifyAuthentication(CancellationToken cancellation) {
        if (!credentials.hasApiKey()) {
            return Mono.just(AuthenticationResult.failure(getName(), "API key is missing", null));
        }
        String label = Operation.VERIFY_AUTHENTICATION.label();
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return cancellation.guard(Mono.defer(() -> doVerifyAuthentication(cancellation)), label)
                    .then(Mono.fromSupplier(() -> AuthenticationResult.success(getName(),
                            "Authentication successful", (System.nanoTime() - started) / 1_000_000)))
                    .onErrorResume(error -> !(error instanceof RequestCanceledException), error -> {
                        GatewayException failure = GatewayErrors.wrap(error, getName(), label);
                        log.warn("Authentication check against {} failed: {}", getName(), failure.getMessage());
                        return Mono.just(AuthenticationResult.failure(getName(), describeAuthFailure(failure),
                                failure.getRawMessage()));
                    });
        }).onErrorMap(error -> GatewayErrors.wrap(error, getName(), label));
    }

    // ---------------------------------------------------------------- adapter hooks

    protected abstract Mono<ChatCompletionResponse> doChatCompletion(ChatCompletionRequest request,
                                                                     CancellationToken cancellation);

    /**
     * Defaults to a synthetic stream over the complete response.
     */
    protected Flux<ChatCompletionChunk> doStreamChatCompletion(ChatCompletionRequest request,
                                                               CancellationToken cancellation) {
        return doChatCompletion(request, cancellation)
                .flatMapMany(response -> support.getChunker().stream(response, false, cancellation));
    }

    protected Mono<EmbeddingResponse> doCreateEmbedding(EmbeddingRequest request, CancellationToken cancellation) {
        return unsupported(Operation.EMBEDDING);
    }

    protected Mono<ImageGenerationResponse> doCreateImage(ImageGenerationRequest request,
                                                          CancellationToken cancellation) {
        return unsupported(Operation.IMAGE_GENERATION);
    }

    protected Mono<byte[]> doCreateSpeech(SpeechRequest request, CancellationToken cancellation) {
        return unsupported(Operation.TEXT_TO_SPEECH);
    }

    /**
     * Provider catalog; empty means "use the fallback list".
     */
    protected Mono<List<ModelInfo>> doListModels(CancellationToken cancellation) {
        return Mono.empty();
    }

    /**
     * Heuristic list served when neither the provider nor configuration names any model.
     */
    protected List<String> defaultModels() {
        return List.of();
    }

    /**
     * Cheapest authenticated call the provider offers. Defaults to a strict model listing.
     */
    protected Mono<Void> doVerifyAuthentication(CancellationToken cancellation) {
        return doListModels(cancellation).then();
    }

    // ---------------------------------------------------------------- helpers for adapters

    protected String baseUrl() {
        return credentials.baseUrlOr(defaultBaseUrl());
    }

    /**
     * Extra provider headers such as API versions.
     */
    protected void customizeHeaders(HttpHeaders headers) {
    }

    protected WebClient.RequestBodySpec post(String path) {
        return request(HttpMethod.POST, path).contentType(MediaType.APPLICATION_JSON);
    }

    protected WebClient.RequestHeadersSpec<?> get(String path) {
        return request(HttpMethod.GET, path);
    }

    protected WebClient.RequestBodySpec request(HttpMethod method, String path) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl() + path);
        HttpHeaders auth = new HttpHeaders();
        authScheme.apply(auth, uri, credentials.getApiKey());
        return webClient.method(method)
                .uri(uri.encode().build().toUri())
                .headers(headers -> {
                    headers.addAll(auth);
                    headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
                    customizeHeaders(headers);
                });
    }

    /**
     * Wrap one outbound call in the retry policy.
     */
    protected <T> Mono<T> withRetry(Mono<T> call, Operation operation, CancellationToken cancellation) {
        return withRetry(call, operation.label(), cancellation);
    }

    protected <T> Mono<T> withRetry(Mono<T> call, String operationName, CancellationToken cancellation) {
        return support.getRetryPolicy().execute(call, getName(), operationName, cancellation);
    }

    /**
     * Retry the opening of a native stream, then normalize it into canonical chunks.
     */
    protected Flux<ChatCompletionChunk> normalize(Flux<UpstreamEvent> events, String model,
                                                  CancellationToken cancellation) {
        Flux<UpstreamEvent> retried = support.getRetryPolicy()
                .executeStream(events, getName(), Operation.STREAMING_CHAT.label(), cancellation);
        return StreamingNormalizer.normalize(retried, null, model, cancellation);
    }

    protected JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw CommunicationException.malformedResponse("Undecodable response from " + getName(), e);
        }
    }

    protected <T> Mono<T> unsupported(Operation operation) {
        return Mono.error(new UnsupportedProviderOperationException(
                getName() + " does not support " + operation.label(), getName(), operation.label(), null));
    }

    /**
     * Rough token estimate for providers that report no usage.
     */
    protected static int estimateTokens(String text) {
        return text == null ? 0 : text.length() / 4;
    }

    // ---------------------------------------------------------------- validation

    protected void validateChatRequest(ChatCompletionRequest request) {
        if (request == null) {
            throw invalid("Request is required");
        }
        requireModel(request.getModel());
        List<Message> messages = request.getMessages();
        if (messages == null || messages.isEmpty()) {
            throw invalid("At least one message is required");
        }
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (message == null || message.getRole() == null || !Message.ROLES.contains(message.getRole())) {
                throw invalid("messages[" + i + "].role must be one of " + Message.ROLES);
            }
            boolean hasToolCalls = message.getToolCalls() != null && !message.getToolCalls().isEmpty();
            if (message.getContent() == null && !hasToolCalls) {
                throw invalid("messages[" + i + "].content is required");
            }
        }
        if (request.getTemperature() != null && (request.getTemperature() < 0 || request.getTemperature() > 2)) {
            throw invalid("temperature must be between 0 and 2");
        }
        if (request.getTopP() != null && (request.getTopP() < 0 || request.getTopP() > 1)) {
            throw invalid("top_p must be between 0 and 1");
        }
        if (request.getMaxTokens() != null && request.getMaxTokens() <= 0) {
            throw invalid("max_tokens must be positive");
        }
    }

    protected void validateEmbeddingRequest(EmbeddingRequest request) {
        if (request == null) {
            throw invalid("Request is required");
        }
        requireModel(request.getModel());
        if (request.getInput() == null || request.getInput().isEmpty()) {
            throw invalid("input is required");
        }
    }

    protected void validateImageRequest(ImageGenerationRequest request) {
        if (request == null) {
            throw invalid("Request is required");
        }
        requireModel(request.getModel());
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw invalid("prompt is required");
        }
        if (request.getN() != null && request.getN() < 1) {
            throw invalid("n must be at least 1");
        }
    }

    protected void validateSpeechRequest(SpeechRequest request) {
        if (request == null) {
            throw invalid("Request is required");
        }
        requireModel(request.getModel());
        if (request.getInput() == null || request.getInput().isBlank()) {
            throw invalid("input is required");
        }
    }

    private void requireModel(String model) {
        if (model == null || model.isBlank()) {
            throw invalid("model is required");
        }
    }

    private RequestValidationException invalid(String message) {
        return new RequestValidationException(message);
    }

    private void requireCapability(String model, Operation operation) {
        support.getCapabilities().require(getName(), model, operation);
    }

    // ---------------------------------------------------------------- internals

    private <T> Mono<T> call(Operation operation, CancellationToken cancellation, Supplier<Mono<T>> body) {
        return cancellation.guard(Mono.defer(body), operation.label())
                .onErrorMap(error -> GatewayErrors.wrap(error, getName(), operation.label()))
                .doOnSuccess(result -> log.debug("{} {} succeeded", getName(), operation.label()))
                .doOnError(error -> logFailure(operation, error));
    }

    private void logFailure(Operation operation, Throwable error) {
        if (error instanceof RequestCanceledException) {
            log.info("{} {} canceled by caller", getName(), operation.label());
        } else {
            log.error("{} {} failed: {}", getName(), operation.label(), error.getMessage());
        }
    }

    private List<ModelInfo> fallbackModels() {
        List<String> ids = settings.models().isEmpty() ? defaultModels() : settings.models();
        return ids.stream().map(id -> ModelInfo.of(id, getName())).toList();
    }

    private static String describeAuthFailure(GatewayException failure) {
        if (failure instanceof CommunicationException communication && communication.getStatusCode() != null) {
            int status = communication.getStatusCode();
            if (status == 401 || status == 403) {
                return "Invalid API key";
            }
            return "Provider returned HTTP " + status;
        }
        return "Authentication check failed";
    }
}
