package com.switchboard.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.switchboard.exception.CommunicationException;
import com.switchboard.exception.ConfigurationException;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.EmbeddingRequest;
import com.switchboard.model.EmbeddingResponse;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.resilience.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BedrockClientTest {

    private BedrockRuntimeAsyncClient sdk;
    private BedrockClient client;

    @BeforeEach
    void setUp() {
        sdk = mock(BedrockRuntimeAsyncClient.class);
        ProviderSettings settings = ProviderSettings.enabled("bedrock", ProviderCredentials.builder()
                .apiKey("AKIAEXAMPLE")
                .secret("secret")
                .region("eu-west-1")
                .build());
        client = new BedrockClient(settings, sdk, ProviderTestSupport.clientSupport());
    }

    private static CompletableFuture<InvokeModelResponse> answer(String json) {
        return CompletableFuture.completedFuture(InvokeModelResponse.builder()
                .body(SdkBytes.fromUtf8String(json))
                .contentType("application/json")
                .build());
    }

    @Test
    void testClaudeAliasIsResolvedAndMapped() throws Exception {
        when(sdk.invokeModel(any(InvokeModelRequest.class))).thenReturn(answer(
                "{\"id\":\"msg_b\",\"content\":[{\"type\":\"text\",\"text\":\"Hello from Bedrock\"}],"
                        + "\"stop_reason\":\"end_turn\",\"usage\":{\"input_tokens\":6,\"output_tokens\":4}}"));

        ChatCompletionResponse response = client.createChatCompletion(
                ProviderTestSupport.chat("claude-3-haiku", "hi"), CancellationToken.NONE)
                .block(Duration.ofSeconds(5));

        assertNotNull(response);
        assertEquals("Hello from Bedrock", response.getChoices().get(0).getMessage().getText());
        assertEquals("claude-3-haiku", response.getModel());
        assertEquals(10, response.getUsage().getTotalTokens());

        ArgumentCaptor<InvokeModelRequest> captor = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(sdk).invokeModel(captor.capture());
        assertEquals("anthropic.claude-3-haiku-20240307-v1:0", captor.getValue().modelId());
        JsonNode body = ProviderTestSupport.MAPPER.readTree(captor.getValue().body().asUtf8String());
        assertEquals("bedrock-2023-05-31", body.path("anthropic_version").asText());
        assertFalse(body.has("model"));
    }

    @Test
    void testTitanTextModel() throws Exception {
        when(sdk.invokeModel(any(InvokeModelRequest.class))).thenReturn(answer(
                "{\"inputTextTokenCount\":5,\"results\":[{\"outputText\":\" Sure. \",\"tokenCount\":2,"
                        + "\"completionReason\":\"LENGTH\"}]}"));

        ChatCompletionResponse response = client.createChatCompletion(
                ProviderTestSupport.chat("amazon.titan-text-express-v1", "go"), CancellationToken.NONE)
                .block(Duration.ofSeconds(5));

        assertNotNull(response);
        assertEquals("Sure.", response.getChoices().get(0).getMessage().getText());
        assertEquals("length", response.getChoices().get(0).getFinishReason());
        assertEquals(7, response.getUsage().getTotalTokens());

        ArgumentCaptor<InvokeModelRequest> captor = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(sdk).invokeModel(captor.capture());
        JsonNode body = ProviderTestSupport.MAPPER.readTree(captor.getValue().body().asUtf8String());
        assertTrue(body.path("inputText").asText().endsWith("Assistant:"));
    }

    @Test
    void testStreamIsSynthesized() {
        when(sdk.invokeModel(any(InvokeModelRequest.class))).thenReturn(answer(
                "{\"content\":[{\"type\":\"text\",\"text\":\"The quick brown fox jumps\"}],"
                        + "\"stop_reason\":\"end_turn\"}"));

        List<ChatCompletionChunk> chunks = client.streamChatCompletion(
                        ProviderTestSupport.chat("claude-3-haiku", "fox"), CancellationToken.NONE)
                .collectList()
                .block(Duration.ofSeconds(5));

        assertNotNull(chunks);
        assertEquals("The quick brown fox jumps", chunks.stream()
                .map(chunk -> chunk.firstChoice().getDelta().getContent())
                .filter(content -> content != null)
                .collect(Collectors.joining()));
        assertEquals(5, chunks.size());
        assertEquals("stop", chunks.get(4).firstChoice().getFinishReason());
    }

    @Test
    void testEmbeddingsInvokeOncePerInput() {
        when(sdk.invokeModel(any(InvokeModelRequest.class)))
                .thenReturn(answer("{\"embedding\":[0.1,0.2],\"inputTextTokenCount\":3}"))
                .thenReturn(answer("{\"embedding\":[0.3],\"inputTextTokenCount\":2}"));
        EmbeddingRequest request = EmbeddingRequest.builder()
                .model("titan-embed-text")
                .input(List.of("a", "b"))
                .build();

        EmbeddingResponse response = client.createEmbedding(request, CancellationToken.NONE)
                .block(Duration.ofSeconds(5));

        assertNotNull(response);
        assertEquals(2, response.getData().size());
        assertEquals(List.of(0.3), response.getData().get(1).getEmbedding());
        assertEquals(5, response.getUsage().getPromptTokens());
        verify(sdk, times(2)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void testThrottlingIsRetried() {
        AwsServiceException throttled = AwsServiceException.builder().statusCode(429).message("slow down").build();
        when(sdk.invokeModel(any(InvokeModelRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(throttled))
                .thenReturn(answer("{\"content\":[{\"type\":\"text\",\"text\":\"ok\"}]}"));

        ChatCompletionResponse response = client.createChatCompletion(
                ProviderTestSupport.chat("claude-3-haiku", "hi"), CancellationToken.NONE)
                .block(Duration.ofSeconds(5));

        assertNotNull(response);
        assertEquals("ok", response.getChoices().get(0).getMessage().getText());
        verify(sdk, times(2)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void testAccessDeniedIsNotRetried() {
        AwsServiceException denied = AwsServiceException.builder().statusCode(403).message("denied").build();
        when(sdk.invokeModel(any(InvokeModelRequest.class))).thenReturn(CompletableFuture.failedFuture(denied));

        StepVerifier.create(client.createChatCompletion(ProviderTestSupport.chat("claude-3-haiku", "hi"),
                        CancellationToken.NONE))
                .expectErrorSatisfies(error -> {
                    CommunicationException failure = assertInstanceOf(CommunicationException.class, error);
                    assertEquals(403, failure.getStatusCode());
                })
                .verify(Duration.ofSeconds(5));
        verify(sdk, times(1)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void testCombinedKeyFormatIsAccepted() {
        ProviderSettings combined = ProviderSettings.enabled("bedrock",
                ProviderCredentials.builder().apiKey("AKIA:SECRET").build());

        assertDoesNotThrow(() -> new BedrockClient(combined, sdk, ProviderTestSupport.clientSupport()));
    }

    @Test
    void testMissingSecretIsConfigurationError() {
        ProviderSettings incomplete = ProviderSettings.enabled("bedrock",
                ProviderCredentials.builder().apiKey("AKIAONLY").build());

        assertThrows(ConfigurationException.class,
                () -> new BedrockClient(incomplete, sdk, ProviderTestSupport.clientSupport()));
    }

    @Test
    void testModelResolution() {
        assertEquals("amazon.titan-text-express-v1", BedrockClient.resolveModelId("titan-text-express"));
        assertEquals("anthropic.custom", BedrockClient.resolveModelId("anthropic.custom"));
        assertTrue(client.supports("claude-3-opus"));
        assertFalse(client.supports("gpt-4o"));
    }
}
