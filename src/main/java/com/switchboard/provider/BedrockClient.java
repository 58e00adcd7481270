package com.switchboard.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.capability.Operation;
import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.CommunicationException;
import com.switchboard.exception.ConfigurationException;
import com.switchboard.exception.GatewayException;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.Choice;
import com.switchboard.model.EmbeddingRequest;
import com.switchboard.model.EmbeddingResponse;
import com.switchboard.model.Message;
import com.switchboard.model.MessageContent;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.model.Usage;
import com.switchboard.resilience.CancellationToken;
import com.switchboard.streaming.ChunkFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClientBuilder;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * AWS Bedrock through the SDK's {@code InvokeModel}. Claude and Titan text models for chat,
 * Titan embedding models for embeddings. Bedrock answers in one piece, so streams are synthesized.
 *
 * <p>Credentials: {@code api-key} holds the access key id and {@code secret} the secret key;
 * {@code ACCESS_KEY_ID:SECRET_ACCESS_KEY} in {@code api-key} alone is accepted too.
 */
@Slf4j
@Component
public class BedrockClient extends AbstractProviderClient {

    public static final String NAME = "bedrock";

    private static final String DEFAULT_REGION = "us-east-1";
    private static final String BEDROCK_ANTHROPIC_VERSION = "bedrock-2023-05-31";
    private static final String VERIFY_MODEL = "anthropic.claude-3-haiku-20240307-v1:0";

    private static final Map<String, String> MODEL_ALIASES = Map.of(
            "claude-3-opus", "anthropic.claude-3-opus-20240229-v1:0",
            "claude-3-sonnet", "anthropic.claude-3-sonnet-20240229-v1:0",
            "claude-3-haiku", "anthropic.claude-3-haiku-20240307-v1:0",
            "claude-3-5-sonnet", "anthropic.claude-3-5-sonnet-20240620-v1:0",
            "titan-text-express", "amazon.titan-text-express-v1",
            "titan-embed-text", "amazon.titan-embed-text-v2:0");

    private final ClaudeMessagesMapper mapper;
    private final BedrockRuntimeAsyncClient bedrock;

    @Autowired
    public BedrockClient(WebClient webClient, SwitchboardProperties properties, ClientSupport support) {
        this(ProviderSettings.of(properties, NAME), webClient, support, null);
    }

    public BedrockClient(ProviderSettings settings, BedrockRuntimeAsyncClient bedrock, ClientSupport support) {
        this(settings, null, support, bedrock);
    }

    private BedrockClient(ProviderSettings settings, WebClient webClient, ClientSupport support,
                          BedrockRuntimeAsyncClient bedrock) {
        super(settings, AuthScheme.none(), webClient, support);
        this.mapper = new ClaudeMessagesMapper(objectMapper);
        if (bedrock != null) {
            this.bedrock = bedrock;
        } else if (isEnabled()) {
            this.bedrock = createClient(credentials);
            log.info("Bedrock client initialized for region: {}", region(credentials));
        } else {
            log.debug("Bedrock provider is disabled, skipping client initialization");
            this.bedrock = null;
        }
    }

    @Override
    protected void validateCredentials(ProviderCredentials credentials) {
        super.validateCredentials(credentials);
        awsCredentials(credentials);
    }

    private static AwsBasicCredentials awsCredentials(ProviderCredentials credentials) {
        if (credentials.getSecret() != null && !credentials.getSecret().isBlank()) {
            return AwsBasicCredentials.create(credentials.getApiKey(), credentials.getSecret());
        }
        String[] parts = credentials.getApiKey().split(":", 2);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ConfigurationException(
                    "Bedrock needs a secret key: set 'secret' or use ACCESS_KEY_ID:SECRET_ACCESS_KEY as api-key",
                    NAME, "configure", null);
        }
        return AwsBasicCredentials.create(parts[0], parts[1]);
    }

    private static String region(ProviderCredentials credentials) {
        return credentials.getRegion() != null ? credentials.getRegion() : DEFAULT_REGION;
    }

    private static BedrockRuntimeAsyncClient createClient(ProviderCredentials credentials) {
        BedrockRuntimeAsyncClientBuilder builder = BedrockRuntimeAsyncClient.builder()
                .region(Region.of(region(credentials)))
                .credentialsProvider(StaticCredentialsProvider.create(awsCredentials(credentials)));
        if (credentials.getBaseUrl() != null && !credentials.getBaseUrl().isBlank()) {
            builder.endpointOverride(URI.create(credentials.getBaseUrl()));
        }
        return builder.build();
    }

    @Override
    protected boolean matchesModel(String model) {
        return model.startsWith("anthropic.")
                || model.startsWith("amazon.titan")
                || model.startsWith("titan-")
                || MODEL_ALIASES.containsKey(model);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://bedrock-runtime." + region(credentials) + ".amazonaws.com";
    }

    @Override
    protected List<String> defaultModels() {
        return List.copyOf(MODEL_ALIASES.values());
    }

    /**
     * Resolve friendly model name to Bedrock model ID.
     */
    static String resolveModelId(String model) {
        return MODEL_ALIASES.getOrDefault(model, model);
    }

    @Override
    protected Mono<ChatCompletionResponse> doChatCompletion(ChatCompletionRequest request,
                                                            CancellationToken cancellation) {
        String modelId = resolveModelId(request.getModel());
        boolean titan = modelId.startsWith("amazon.titan");
        JsonNode body = titan ? toTitanRequest(request) : toClaudeRequest(request);

        Mono<ChatCompletionResponse> call = invoke(modelId, body)
                .map(response -> titan
                        ? fromTitanResponse(response, request.getModel())
                        : mapper.fromResponse(response, request.getModel()));
        return withRetry(call, Operation.CHAT, cancellation);
    }

    @Override
    protected Mono<EmbeddingResponse> doCreateEmbedding(EmbeddingRequest request, CancellationToken cancellation) {
        String modelId = resolveModelId(request.getModel());
        List<String> inputs = request.getInput();
        // Titan embeds one text per invocation
        Mono<EmbeddingResponse> call = Flux.range(0, inputs.size())
                .concatMap(index -> {
                    ObjectNode body = objectMapper.createObjectNode().put("inputText", inputs.get(index));
                    if (request.getDimensions() != null) {
                        body.put("dimensions", request.getDimensions());
                    }
                    return withRetry(invoke(modelId, body), Operation.EMBEDDING, cancellation)
                            .map(response -> Map.entry(index, response));
                })
                .collectList()
                .map(results -> {
                    List<EmbeddingResponse.EmbeddingData> data = new ArrayList<>();
                    int tokens = 0;
                    for (Map.Entry<Integer, JsonNode> result : results) {
                        List<Double> values = new ArrayList<>();
                        result.getValue().path("embedding").forEach(value -> values.add(value.asDouble()));
                        data.add(EmbeddingResponse.EmbeddingData.builder()
                                .index(result.getKey())
                                .embedding(values)
                                .build());
                        tokens += result.getValue().path("inputTextTokenCount").asInt(0);
                    }
                    return EmbeddingResponse.builder()
                            .data(data)
                            .model(request.getModel())
                            .usage(Usage.of(tokens, 0))
                            .build();
                });
        return call;
    }

    @Override
    protected Mono<Void> doVerifyAuthentication(CancellationToken cancellation) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("anthropic_version", BEDROCK_ANTHROPIC_VERSION);
        body.put("max_tokens", 1);
        body.putArray("messages").addObject()
                .put("role", Message.ROLE_USER)
                .put("content", "ping");
        String model = settings.models().isEmpty() ? VERIFY_MODEL : resolveModelId(settings.models().get(0));
        return invoke(model, body).then();
    }

    private Mono<JsonNode> invoke(String modelId, JsonNode body) {
        if (bedrock == null) {
            return Mono.error(new ConfigurationException("Bedrock provider is not enabled or not configured",
                    getName(), null, null));
        }
        InvokeModelRequest invokeRequest = InvokeModelRequest.builder()
                .modelId(modelId)
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromString(body.toString(), StandardCharsets.UTF_8))
                .build();
        return Mono.fromFuture(() -> bedrock.invokeModel(invokeRequest))
                .map(response -> readTree(response.body().asUtf8String()))
                .onErrorMap(error -> !(error instanceof GatewayException), BedrockClient::translateSdkError);
    }

    static Throwable translateSdkError(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof SdkServiceException service) {
            return new CommunicationException("Bedrock returned HTTP " + service.statusCode() + ": "
                    + service.getMessage(), service.statusCode(), null, null, service);
        }
        if (cause instanceof SdkClientException client) {
            return new CommunicationException("Bedrock transport failure: " + client.getMessage(), client);
        }
        return cause;
    }

    private ObjectNode toClaudeRequest(ChatCompletionRequest request) {
        ObjectNode body = mapper.toRequest(request);
        body.put("anthropic_version", BEDROCK_ANTHROPIC_VERSION);
        return body;
    }

    private ObjectNode toTitanRequest(ChatCompletionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        String prompt = request.getMessages().stream()
                .map(message -> capitalize(message.getRole()) + ": " + message.getText())
                .collect(Collectors.joining("\n")) + "\nAssistant:";
        body.put("inputText", prompt);
        ObjectNode config = body.putObject("textGenerationConfig");
        config.put("maxTokenCount", request.getMaxTokens() != null
                ? request.getMaxTokens() : ClaudeMessagesMapper.DEFAULT_MAX_TOKENS);
        if (request.getTemperature() != null) {
            config.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            config.put("topP", request.getTopP());
        }
        if (request.getStop() != null && !request.getStop().isEmpty()) {
            ArrayNode stop = config.putArray("stopSequences");
            request.getStop().forEach(stop::add);
        }
        return body;
    }

    private ChatCompletionResponse fromTitanResponse(JsonNode response, String requestedModel) {
        JsonNode result = response.path("results").path(0);
        String finishReason = "LENGTH".equals(result.path("completionReason").asText()) ? "length" : "stop";
        return ChatCompletionResponse.builder()
                .id(ChunkFactory.newId())
                .object(ChatCompletionResponse.OBJECT)
                .created(Instant.now().getEpochSecond())
                .model(requestedModel)
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(Message.builder()
                                .role(Message.ROLE_ASSISTANT)
                                .content(MessageContent.text(result.path("outputText").asText("").trim()))
                                .build())
                        .finishReason(finishReason)
                        .build()))
                .usage(Usage.of(response.path("inputTextTokenCount").asInt(0), result.path("tokenCount").asInt(0)))
                .build();
    }

    private static String capitalize(String role) {
        return Character.toUpperCase(role.charAt(0)) + role.substring(1);
    }
}
