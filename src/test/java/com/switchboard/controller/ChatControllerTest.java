package com.switchboard.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.config.CacheConfiguration;
import com.switchboard.config.JacksonConfiguration;
import com.switchboard.service.ProviderService;
import com.switchboard.service.RecordingProviderClient;
import com.switchboard.service.StreamingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatControllerTest {

    private RecordingProviderClient openai;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        openai = new RecordingProviderClient("openai", "gpt", true);
        ProviderService providerService = new ProviderService(List.of(openai),
                new ConcurrentMapCacheManager(CacheConfiguration.MODELS_CACHE));
        StreamingService streamingService = new StreamingService(JacksonConfiguration.configure(new ObjectMapper()));
        client = WebTestClient.bindToController(new ChatController(providerService, streamingService))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testChatCompletion() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("chat.completion")
                .jsonPath("$.choices[0].message.content").isEqualTo("from openai")
                .jsonPath("$.usage.total_tokens").isEqualTo(3);

        assertEquals(List.of("gpt-4o"), openai.requestedModels);
    }

    @Test
    void testStreamingChatCompletion() {
        String body = client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o\",\"stream\":true,"
                        + "\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertNotNull(body);
        assertTrue(body.contains("\"content\":\"Hi\""));
        assertTrue(body.contains("\"finish_reason\":\"stop\""));
        assertTrue(body.trim().endsWith("[DONE]"));
    }

    @Test
    void testEmptyMessagesRejected() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o\",\"messages\":[]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error");
    }

    @Test
    void testUnroutableModel() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"mistral-large\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.message").value(message ->
                        assertTrue(message.toString().contains("mistral-large")));
    }

    @Test
    void testUnsupportedOperationStatus() {
        client.post().uri("/v1/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o\",\"input\":[\"text\"]}")
                .exchange()
                .expectStatus().isEqualTo(501)
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("unsupported_operation")
                .jsonPath("$.error.provider").isEqualTo("openai");
    }

    @Test
    void testSpeechReturnsAudio() {
        byte[] audio = client.post().uri("/v1/audio/speech")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o-mini-tts\",\"input\":\"hello\",\"voice\":\"alloy\","
                        + "\"response_format\":\"wav\"}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType("audio/wav")
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();

        assertArrayEquals(new byte[]{7, 7}, audio);
    }

    @Test
    void testListModels() {
        client.get().uri("/v1/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("list")
                .jsonPath("$.data[0].id").isEqualTo("gpt-large")
                .jsonPath("$.data[0].provider").isEqualTo("openai");
    }

    @Test
    void testAudioTypeMapping() {
        assertEquals("audio/mpeg", ChatController.audioType(null).toString());
        assertEquals("audio/ogg", ChatController.audioType("opus").toString());
        assertEquals("audio/mpeg", ChatController.audioType("mp3").toString());
    }
}
