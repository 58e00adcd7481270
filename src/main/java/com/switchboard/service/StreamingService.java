package com.switchboard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.exception.GatewayErrors;
import com.switchboard.exception.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Formats canonical chunk streams as OpenAI-style server-sent events.
 */
@Slf4j
@Service
public class StreamingService {

    static final String DONE = "[DONE]";

    private final ObjectMapper objectMapper;

    public StreamingService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * One {@code data:} event per element followed by {@code data: [DONE]}.
     * A failure mid-stream becomes a final error event instead of a truncated response.
     */
    public Flux<ServerSentEvent<String>> toServerSentEvents(Flux<?> chunks) {
        return chunks
                .map(chunk -> event(serialize(chunk)))
                .concatWith(Flux.just(event(DONE)))
                .onErrorResume(error -> {
                    GatewayException failure = GatewayErrors.classify(error);
                    log.warn("Stream ended with {}: {}", failure.getKind(), failure.getMessage());
                    return Flux.just(event(serialize(Map.of("error", errorBody(failure)))));
                });
    }

    /**
     * OpenAI-style error object, shared with the HTTP error responses.
     */
    public static Map<String, Object> errorBody(GatewayException failure) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", failure.getKind().type());
        error.put("message", failure.getRawMessage());
        if (failure.getProvider() != null) {
            error.put("provider", failure.getProvider());
        }
        if (failure.getOperation() != null) {
            error.put("operation", failure.getOperation());
        }
        return error;
    }

    private static ServerSentEvent<String> event(String data) {
        return ServerSentEvent.builder(data).build();
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize stream event", e);
        }
    }
}
