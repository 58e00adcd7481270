package com.switchboard.controller;

import com.switchboard.exception.RequestValidationException;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.EmbeddingRequest;
import com.switchboard.model.EmbeddingResponse;
import com.switchboard.model.ImageGenerationRequest;
import com.switchboard.model.ImageGenerationResponse;
import com.switchboard.model.SpeechRequest;
import com.switchboard.resilience.CancellationToken;
import com.switchboard.service.ProviderService;
import com.switchboard.service.StreamingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * OpenAI-compatible endpoints. A client disconnect cancels the upstream work through a per-request token.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class ChatController {

    private final ProviderService providerService;
    private final StreamingService streamingService;

    public ChatController(ProviderService providerService, StreamingService streamingService) {
        this.providerService = providerService;
        this.streamingService = streamingService;
    }

    /**
     * Chat completions. Supports both regular JSON responses and SSE streaming.
     */
    @PostMapping(value = "/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<?>> createChatCompletion(@RequestBody ChatCompletionRequest request) {
        log.info("Received chat completion request for model: {}, stream: {}",
                request.getModel(), request.getStream());

        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            return Mono.error(new RequestValidationException("Messages cannot be empty"));
        }

        CancellationToken cancellation = CancellationToken.create();
        if (request.isStreaming()) {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.TEXT_EVENT_STREAM);
            headers.setCacheControl("no-cache");
            ResponseEntity<?> response = ResponseEntity.ok()
                    .headers(headers)
                    .body(streamingService.toServerSentEvents(
                            providerService.streamChatCompletion(request, cancellation)
                                    .doOnCancel(cancellation::cancel)));
            return Mono.just(response);
        }

        return providerService.createChatCompletion(request, cancellation)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .doOnCancel(cancellation::cancel);
    }

    @PostMapping(value = "/embeddings", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<EmbeddingResponse> createEmbedding(@RequestBody EmbeddingRequest request) {
        CancellationToken cancellation = CancellationToken.create();
        return providerService.createEmbedding(request, cancellation)
                .doOnCancel(cancellation::cancel);
    }

    @PostMapping(value = "/images/generations", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ImageGenerationResponse> createImage(@RequestBody ImageGenerationRequest request) {
        CancellationToken cancellation = CancellationToken.create();
        return providerService.createImage(request, cancellation)
                .doOnCancel(cancellation::cancel);
    }

    @PostMapping(value = "/audio/speech", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<byte[]>> createSpeech(@RequestBody SpeechRequest request) {
        CancellationToken cancellation = CancellationToken.create();
        return providerService.createSpeech(request, cancellation)
                .map(audio -> ResponseEntity.ok()
                        .contentType(audioType(request.getResponseFormat()))
                        .body(audio))
                .doOnCancel(cancellation::cancel);
    }

    @GetMapping("/models")
    public Mono<Map<String, Object>> listModels() {
        CancellationToken cancellation = CancellationToken.create();
        return providerService.listModels(cancellation)
                .map(models -> Map.<String, Object>of("object", "list", "data", models))
                .doOnCancel(cancellation::cancel);
    }

    static MediaType audioType(String format) {
        if (format == null) {
            return MediaType.parseMediaType("audio/mpeg");
        }
        return switch (format) {
            case "wav" -> MediaType.parseMediaType("audio/wav");
            case "opus" -> MediaType.parseMediaType("audio/ogg");
            case "aac" -> MediaType.parseMediaType("audio/aac");
            case "flac" -> MediaType.parseMediaType("audio/flac");
            case "pcm" -> MediaType.parseMediaType("audio/pcm");
            default -> MediaType.parseMediaType("audio/mpeg");
        };
    }
}
