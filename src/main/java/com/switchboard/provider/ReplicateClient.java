package com.switchboard.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.capability.Operation;
import com.switchboard.config.SwitchboardProperties;
import com.switchboard.job.JobBackend;
import com.switchboard.job.JobOutputExtractor;
import com.switchboard.job.JobRequest;
import com.switchboard.job.JobStatus;
import com.switchboard.job.PredictionJob;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.Choice;
import com.switchboard.model.ImageGenerationRequest;
import com.switchboard.model.ImageGenerationResponse;
import com.switchboard.model.Message;
import com.switchboard.model.MessageContent;
import com.switchboard.model.Usage;
import com.switchboard.resilience.CancellationToken;
import com.switchboard.streaming.ChunkFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Replicate predictions API ({@code Authorization: Token <key>}).
 *
 * <p>Every operation is an asynchronous prediction: chat, streaming chat and image generation
 * all run through the {@link com.switchboard.job.JobPollingEngine}.
 * A model given as {@code owner/name} uses the model predictions endpoint; {@code owner/name:version}
 * or a bare version id is submitted to {@code /predictions} with the version in the body.
 */
@Slf4j
@Component
public class ReplicateClient extends AbstractProviderClient implements JobBackend {

    public static final String NAME = "replicate";

    private static final String DEFAULT_BASE_URL = "https://api.replicate.com/v1";
    private static final String JOB_OPERATION = "job";

    @Autowired
    public ReplicateClient(WebClient webClient, SwitchboardProperties properties, ClientSupport support) {
        this(ProviderSettings.of(properties, NAME), webClient, support);
    }

    public ReplicateClient(ProviderSettings settings, WebClient webClient, ClientSupport support) {
        super(settings, AuthScheme.token(), webClient, support);
    }

    @Override
    protected boolean matchesModel(String model) {
        // owner/name or owner/name:version
        return !model.startsWith("models/")
                && model.matches("[a-z0-9][a-z0-9_.-]*/[a-z0-9][a-z0-9_.-]*(:[a-f0-9]+)?");
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    protected List<String> defaultModels() {
        return List.of("meta/meta-llama-3-70b-instruct", "black-forest-labs/flux-schnell", "stability-ai/sdxl");
    }

    // ---------------------------------------------------------------- unified operations

    @Override
    protected Mono<ChatCompletionResponse> doChatCompletion(ChatCompletionRequest request,
                                                            CancellationToken cancellation) {
        JobRequest job = new JobRequest(request.getModel(), toChatInput(request));
        return support.getJobEngine().run(this, job, result -> toChatResponse(result, request.getModel()),
                cancellation);
    }

    @Override
    protected Flux<ChatCompletionChunk> doStreamChatCompletion(ChatCompletionRequest request,
                                                               CancellationToken cancellation) {
        JobRequest job = new JobRequest(request.getModel(), toChatInput(request));
        return support.getJobEngine().stream(this, job, result -> toChatResponse(result, request.getModel()),
                cancellation);
    }

    @Override
    protected Mono<ImageGenerationResponse> doCreateImage(ImageGenerationRequest request,
                                                          CancellationToken cancellation) {
        JobRequest job = new JobRequest(request.getModel(), toImageInput(request));
        return support.getJobEngine().run(this, job, result -> ImageGenerationResponse.builder()
                .created(Instant.now().getEpochSecond())
                .data(JobOutputExtractor.extractStrings(result.getOutput()).stream()
                        .map(url -> ImageGenerationResponse.ImageData.builder().url(url).build())
                        .toList())
                .build(), cancellation);
    }

    @Override
    protected Mono<Void> doVerifyAuthentication(CancellationToken cancellation) {
        return withRetry(get("/account").retrieve().toBodilessEntity(), Operation.VERIFY_AUTHENTICATION,
                cancellation).then();
    }

    // ---------------------------------------------------------------- job backend

    @Override
    public Mono<PredictionJob> submit(JobRequest request) {
        String model = request.model();
        ObjectNode body = objectMapper.createObjectNode();
        String path;
        if (model.contains("/") && !model.contains(":")) {
            path = "/models/" + model + "/predictions";
        } else {
            path = "/predictions";
            body.put("version", model.contains(":") ? model.substring(model.indexOf(':') + 1) : model);
        }
        body.set("input", request.input());

        Mono<PredictionJob> call = post(path)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::toJob);
        return withRetry(call, JOB_OPERATION, CancellationToken.NONE);
    }

    @Override
    public Mono<PredictionJob> poll(String jobId) {
        Mono<PredictionJob> call = get("/predictions/" + jobId)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::toJob)
                .doOnNext(job -> log.debug("Replicate job {} status {}", job.getId(), job.getStatus()));
        return withRetry(call, JOB_OPERATION, CancellationToken.NONE);
    }

    @Override
    public Mono<Void> cancel(String jobId) {
        return post("/predictions/" + jobId + "/cancel")
                .retrieve()
                .toBodilessEntity()
                .then();
    }

    PredictionJob toJob(JsonNode node) {
        JsonNode error = node.path("error");
        return PredictionJob.builder()
                .id(node.path("id").asText())
                .status(JobStatus.fromWire(node.path("status").asText(null)))
                .input(node.get("input"))
                .output(node.get("output"))
                .error(error.isMissingNode() || error.isNull() ? null
                        : error.isTextual() ? error.asText() : error.toString())
                .createdAt(parseInstant(node.path("created_at").asText(null)))
                .build();
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable created_at '{}'", value);
            return null;
        }
    }

    // ---------------------------------------------------------------- wire mapping

    ObjectNode toChatInput(ChatCompletionRequest request) {
        ObjectNode input = objectMapper.createObjectNode();
        if (request.getModel().toLowerCase().contains("llama")) {
            String system = request.getMessages().stream()
                    .filter(message -> Message.ROLE_SYSTEM.equals(message.getRole()))
                    .map(Message::getText)
                    .findFirst()
                    .orElse(null);
            ArrayNode messages = input.putArray("messages");
            request.getMessages().stream()
                    .filter(message -> !Message.ROLE_SYSTEM.equals(message.getRole()))
                    .forEach(message -> messages.addObject()
                            .put("role", message.getRole())
                            .put("content", message.getText()));
            if (system != null && !system.isEmpty()) {
                input.put("system_prompt", system);
            }
            // most llama models on Replicate still require a prompt; give them the last user turn
            input.put("prompt", lastUserText(request));
        } else {
            input.put("prompt", formatPrompt(request.getMessages()));
        }

        if (request.getTemperature() != null) {
            input.put("temperature", request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            input.put("max_length", request.getMaxTokens());
            input.put("max_new_tokens", request.getMaxTokens());
        }
        if (request.getTopP() != null) {
            input.put("top_p", request.getTopP());
        }
        if (request.getTopK() != null) {
            input.put("top_k", request.getTopK());
        }
        if (request.getStop() != null && !request.getStop().isEmpty()) {
            input.put("stop_sequences", String.join(",", request.getStop()));
        }
        return input;
    }

    static String formatPrompt(List<Message> messages) {
        StringBuilder prompt = new StringBuilder();
        for (Message message : messages) {
            switch (message.getRole()) {
                case Message.ROLE_SYSTEM -> prompt.append("System: ").append(message.getText()).append("\n\n");
                case Message.ROLE_USER -> prompt.append("User: ").append(message.getText()).append('\n');
                case Message.ROLE_ASSISTANT -> prompt.append("Assistant: ").append(message.getText()).append('\n');
                default -> prompt.append("Tool: ").append(message.getText()).append('\n');
            }
        }
        return prompt.append("Assistant: ").toString();
    }

    private static String lastUserText(ChatCompletionRequest request) {
        List<Message> messages = request.getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (Message.ROLE_USER.equals(messages.get(i).getRole())) {
                return messages.get(i).getText();
            }
        }
        return "";
    }

    ObjectNode toImageInput(ImageGenerationRequest request) {
        ObjectNode input = objectMapper.createObjectNode();
        input.put("prompt", request.getPrompt());
        if (request.getSize() != null) {
            String[] dimensions = request.getSize().toLowerCase().split("x");
            if (dimensions.length == 2 && dimensions[0].matches("\\d+") && dimensions[1].matches("\\d+")) {
                input.put("width", Integer.parseInt(dimensions[0]));
                input.put("height", Integer.parseInt(dimensions[1]));
            }
        }
        if (request.getQuality() != null) {
            input.put("quality", request.getQuality());
        }
        if (request.getStyle() != null) {
            input.put("style", request.getStyle());
        }
        if (request.getN() != null && request.getN() > 1) {
            input.put("num_outputs", request.getN());
        }
        return input;
    }

    ChatCompletionResponse toChatResponse(PredictionJob job, String model) {
        String text = JobOutputExtractor.extractText(job.getOutput());
        String promptText = job.getInput() != null ? job.getInput().toString() : "";
        return ChatCompletionResponse.builder()
                .id(job.getId() != null ? "chatcmpl-" + job.getId() : ChunkFactory.newId())
                .object(ChatCompletionResponse.OBJECT)
                .created(job.getCreatedAt() != null ? job.getCreatedAt().getEpochSecond()
                        : Instant.now().getEpochSecond())
                .model(model)
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(Message.builder()
                                .role(Message.ROLE_ASSISTANT)
                                .content(MessageContent.text(text))
                                .build())
                        .finishReason("stop")
                        .build()))
                .usage(Usage.of(estimateTokens(promptText), estimateTokens(text)))
                .build();
    }
}
