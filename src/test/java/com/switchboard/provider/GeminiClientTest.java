package com.switchboard.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.EmbeddingRequest;
import com.switchboard.model.EmbeddingResponse;
import com.switchboard.model.Message;
import com.switchboard.resilience.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeminiClientTest {

    private StubExchange upstream;
    private GeminiClient client;

    @BeforeEach
    void setUp() {
        upstream = new StubExchange();
        client = new GeminiClient(ProviderTestSupport.settings("gemini", "gk-test"), upstream.webClient(),
                ProviderTestSupport.clientSupport());
    }

    @Test
    void testChatCompletionUsesQueryKeyAndRoles() throws Exception {
        upstream.json(HttpStatus.OK, "{\"candidates\":[{\"content\":{\"role\":\"model\","
                + "\"parts\":[{\"text\":\"Hi \"},{\"text\":\"there\"}]},\"finishReason\":\"STOP\"}],"
                + "\"usageMetadata\":{\"promptTokenCount\":4,\"candidatesTokenCount\":2,\"totalTokenCount\":6}}");
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model("gemini-1.5-flash")
                .messages(List.of(
                        Message.of(Message.ROLE_SYSTEM, "Be brief."),
                        Message.of(Message.ROLE_USER, "Hello"),
                        Message.of(Message.ROLE_ASSISTANT, "Hi"),
                        Message.of(Message.ROLE_USER, "Again")))
                .maxTokens(64)
                .build();

        ChatCompletionResponse response = client.createChatCompletion(request, CancellationToken.NONE)
                .block(Duration.ofSeconds(5));

        assertNotNull(response);
        assertEquals("Hi there", response.getChoices().get(0).getMessage().getText());
        assertEquals("stop", response.getChoices().get(0).getFinishReason());
        assertEquals(6, response.getUsage().getTotalTokens());

        String url = upstream.request(0).url().toString();
        assertTrue(url.startsWith("https://generativelanguage.googleapis.com/v1beta/models/gemini-1.5-flash:generateContent"));
        assertTrue(url.contains("key=gk-test"));
        assertNull(upstream.request(0).headers().getFirst(HttpHeaders.AUTHORIZATION));

        JsonNode body = ProviderTestSupport.MAPPER.readTree(upstream.body(0));
        assertEquals("Be brief.", body.path("systemInstruction").path("parts").path(0).path("text").asText());
        assertEquals(3, body.path("contents").size());
        assertEquals("model", body.path("contents").path(1).path("role").asText());
        assertEquals(64, body.path("generationConfig").path("maxOutputTokens").asInt());
    }

    @Test
    void testFunctionCallResponse() {
        upstream.json(HttpStatus.OK, "{\"candidates\":[{\"content\":{\"parts\":["
                + "{\"functionCall\":{\"name\":\"get_time\",\"args\":{\"tz\":\"UTC\"}}}]},\"finishReason\":\"STOP\"}]}");

        ChatCompletionResponse response = client.createChatCompletion(
                ProviderTestSupport.chat("gemini-1.5-pro", "time?"), CancellationToken.NONE)
                .block(Duration.ofSeconds(5));

        assertNotNull(response);
        assertEquals("tool_calls", response.getChoices().get(0).getFinishReason());
        assertEquals("get_time", response.getChoices().get(0).getMessage().getToolCalls().get(0)
                .getFunction().getName());
    }

    @Test
    void testSafetyStopMapsToContentFilter() {
        assertEquals("content_filter", GeminiClient.mapFinishReason("SAFETY"));
        assertEquals("length", GeminiClient.mapFinishReason("MAX_TOKENS"));
        assertEquals("stop", GeminiClient.mapFinishReason(null));
    }

    @Test
    void testStreaming() {
        upstream.sse("data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"One \"}]}}]}\n\n"
                + "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"two\"}]},\"finishReason\":\"MAX_TOKENS\"}],"
                + "\"usageMetadata\":{\"promptTokenCount\":3,\"candidatesTokenCount\":2}}\n\n");

        List<ChatCompletionChunk> chunks = client.streamChatCompletion(
                        ProviderTestSupport.chat("gemini-1.5-flash", "count"), CancellationToken.NONE)
                .collectList()
                .block(Duration.ofSeconds(5));

        assertNotNull(chunks);
        assertTrue(upstream.request(0).url().toString().contains(":streamGenerateContent?alt=sse"));
        ChatCompletionChunk last = chunks.get(chunks.size() - 1);
        assertEquals("length", last.firstChoice().getFinishReason());
        assertEquals(5, last.getUsage().getTotalTokens());
        assertEquals(Message.ROLE_ASSISTANT, chunks.get(0).firstChoice().getDelta().getRole());
    }

    @Test
    void testBatchEmbedding() {
        upstream.json(HttpStatus.OK, "{\"embeddings\":[{\"values\":[0.5,0.25]},{\"values\":[1.0]}]}");
        EmbeddingRequest request = EmbeddingRequest.builder()
                .model("text-embedding-004")
                .input(List.of("first text", "second"))
                .build();

        EmbeddingResponse response = client.createEmbedding(request, CancellationToken.NONE)
                .block(Duration.ofSeconds(5));

        assertNotNull(response);
        assertEquals(2, response.getData().size());
        assertEquals(1, response.getData().get(1).getIndex());
        assertEquals(List.of(0.5, 0.25), response.getData().get(0).getEmbedding());
        assertTrue(upstream.request(0).url().toString().contains("text-embedding-004:batchEmbedContents"));
    }
}
