package com.switchboard.controller;

import com.switchboard.config.CacheConfiguration;
import com.switchboard.service.ProviderService;
import com.switchboard.service.RecordingProviderClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

class ProviderControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ProviderService providerService = new ProviderService(
                List.of(new RecordingProviderClient("openai", "gpt", true),
                        new RecordingProviderClient("gemini", "gemini", false)),
                new ConcurrentMapCacheManager(CacheConfiguration.MODELS_CACHE));
        client = WebTestClient.bindToController(new ProviderController(providerService))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testListProviders() {
        client.get().uri("/v1/providers")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].name").isEqualTo("openai")
                .jsonPath("$[1].enabled").isEqualTo(false);
    }

    @Test
    void testCapabilities() {
        client.get().uri("/v1/providers/openai/capabilities?model=gpt-4o")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.chat").isEqualTo(true)
                .jsonPath("$.embeddings").isEqualTo(false);
    }

    @Test
    void testUnknownProvider() {
        client.get().uri("/v1/providers/acme/capabilities?model=x")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error");
    }

    @Test
    void testProviderModels() {
        client.get().uri("/v1/providers/openai/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo("gpt-large");
    }

    @Test
    void testVerifyReportsFailureInBody() {
        client.post().uri("/v1/providers/gemini/verify")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.message").isEqualTo("Invalid API key");
    }
}
