package com.switchboard.streaming;

import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.Choice;
import com.switchboard.model.Message;
import com.switchboard.model.MessageContent;
import com.switchboard.model.ToolCall;
import com.switchboard.model.Usage;
import com.switchboard.resilience.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticChunkerTest {

    private SyntheticChunker chunker;

    @BeforeEach
    void setUp() {
        chunker = new SyntheticChunker(8, Duration.ZERO);
    }

    private static ChatCompletionResponse response(String content, String finishReason) {
        return ChatCompletionResponse.builder()
                .id("chatcmpl-abc")
                .object(ChatCompletionResponse.OBJECT)
                .created(1700000000L)
                .model("claude-3-haiku")
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(Message.of(Message.ROLE_ASSISTANT, content))
                        .finishReason(finishReason)
                        .build()))
                .usage(Usage.of(12, 5))
                .build();
    }

    @Test
    void testSplitPrefersWordBoundaries() {
        assertEquals(List.of("The quick ", "brown fox ", "jumps"), chunker.split("The quick brown fox jumps"));
    }

    @Test
    void testSplitIsLosslessAndDeterministic() {
        String content = "Determinism matters: the same text must always yield the same pieces, every time.";

        List<String> first = chunker.split(content);
        List<String> second = chunker.split(content);

        assertEquals(first, second);
        assertEquals(content, String.join("", first));
        assertTrue(first.stream().allMatch(piece -> piece.length() <= 8 + 3));
    }

    @Test
    void testSplitKeepsSurrogatePairsTogether() {
        String content = "Ok 1234\uD83D\uDE00abcdefg";

        List<String> pieces = chunker.split(content);

        assertEquals("Ok 1234\uD83D\uDE00", pieces.get(0));
        assertEquals(content, String.join("", pieces));
        for (String piece : pieces) {
            byte[] utf8 = piece.getBytes(StandardCharsets.UTF_8);
            assertEquals(piece, new String(utf8, StandardCharsets.UTF_8));
        }
    }

    @Test
    void testSplitOfEmptyContent() {
        assertTrue(chunker.split("").isEmpty());
        assertTrue(chunker.split(null).isEmpty());
    }

    @Test
    void testChunkResponseShape() {
        List<ChatCompletionChunk> chunks = chunker.chunkResponse(response("The quick brown fox jumps", "length"),
                false);

        assertEquals(5, chunks.size());
        assertEquals(Message.ROLE_ASSISTANT, chunks.get(0).firstChoice().getDelta().getRole());
        assertEquals("The quick ", chunks.get(1).firstChoice().getDelta().getContent());
        assertNull(chunks.get(1).firstChoice().getDelta().getRole());
        ChatCompletionChunk last = chunks.get(4);
        assertEquals("length", last.firstChoice().getFinishReason());
        assertEquals(17, last.getUsage().getTotalTokens());
        assertTrue(chunks.stream().allMatch(chunk -> "chatcmpl-abc".equals(chunk.getId())));
        assertTrue(chunks.stream().allMatch(chunk -> chunk.getCreated() == 1700000000L));
    }

    @Test
    void testRoleChunkOmittedWhenAlreadySent() {
        List<ChatCompletionChunk> chunks = chunker.chunkResponse(response("hi", null), true);

        assertEquals(2, chunks.size());
        assertEquals("hi", chunks.get(0).firstChoice().getDelta().getContent());
        assertEquals("stop", chunks.get(1).firstChoice().getFinishReason());
    }

    @Test
    void testToolCallsAreIndexed() {
        Message message = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(MessageContent.text(""))
                .toolCalls(List.of(
                        ToolCall.builder().id("a").type("function")
                                .function(new ToolCall.FunctionCall("f", "{}")).build(),
                        ToolCall.builder().id("b").type("function")
                                .function(new ToolCall.FunctionCall("g", "{}")).build()))
                .build();
        ChatCompletionResponse response = response("", "tool_calls").toBuilder()
                .choices(List.of(Choice.builder().index(0).message(message).finishReason("tool_calls").build()))
                .build();

        List<ChatCompletionChunk> chunks = chunker.chunkResponse(response, false);

        assertEquals(3, chunks.size());
        List<ToolCall> calls = chunks.get(1).firstChoice().getDelta().getToolCalls();
        assertEquals(0, calls.get(0).getIndex());
        assertEquals(1, calls.get(1).getIndex());
        assertEquals("tool_calls", chunks.get(2).firstChoice().getFinishReason());
    }

    @Test
    void testStreamPacesChunks() {
        SyntheticChunker paced = new SyntheticChunker(8, Duration.ofMillis(20));

        StepVerifier.withVirtualTime(() -> paced.stream(response("abc", "stop"), false, CancellationToken.NONE))
                .expectSubscription()
                .thenAwait(Duration.ofMillis(20))
                .expectNextCount(1)
                .thenAwait(Duration.ofMillis(40))
                .expectNextCount(2)
                .verifyComplete();
    }
}
