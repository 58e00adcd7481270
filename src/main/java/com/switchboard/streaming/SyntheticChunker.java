package com.switchboard.streaming;

import com.switchboard.config.SwitchboardProperties;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.model.Choice;
import com.switchboard.model.Message;
import com.switchboard.model.ToolCall;
import com.switchboard.resilience.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Streams a complete response for providers that cannot stream natively.
 * Deterministic: the same text always produces the same chunks.
 */
@Slf4j
@Component
public class SyntheticChunker {

    // how far past the chunk size we look for whitespace
    private static final int BOUNDARY_LOOKAHEAD = 3;

    private final int chunkSize;
    private final Duration chunkDelay;

    @Autowired
    public SyntheticChunker(SwitchboardProperties properties) {
        this(properties.getStreaming().getChunkSize(), properties.getStreaming().getChunkDelay());
    }

    public SyntheticChunker(int chunkSize, Duration chunkDelay) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
        this.chunkDelay = chunkDelay;
    }

    /**
     * Role chunk (unless already sent), content chunks, then the terminal chunk.
     *
     * @param roleAlreadySent true when the caller emitted the role chunk itself
     */
    public Flux<ChatCompletionChunk> stream(ChatCompletionResponse response, boolean roleAlreadySent,
                                            CancellationToken cancellation) {
        List<ChatCompletionChunk> chunks = chunkResponse(response, roleAlreadySent);
        Flux<ChatCompletionChunk> flux = Flux.fromIterable(chunks);
        if (!chunkDelay.isZero()) {
            flux = flux.delayElements(chunkDelay);
        }
        return cancellation.guard(flux, "synthetic stream")
                .doOnComplete(() -> log.debug("Synthetic stream completed for response {}", response.getId()));
    }

    List<ChatCompletionChunk> chunkResponse(ChatCompletionResponse response, boolean roleAlreadySent) {
        ChunkFactory factory = new ChunkFactory(
                response.getId() != null ? response.getId() : ChunkFactory.newId(),
                response.getCreated() != null ? response.getCreated() : 0L,
                response.getModel());
        List<ChatCompletionChunk> chunks = new ArrayList<>();
        if (!roleAlreadySent) {
            chunks.add(factory.role());
        }

        Choice choice = response.getChoices() == null || response.getChoices().isEmpty()
                ? null : response.getChoices().get(0);
        Message message = choice != null ? choice.getMessage() : null;
        String content = message != null ? message.getText() : "";

        for (String piece : split(content)) {
            chunks.add(factory.content(piece, false));
        }
        List<ToolCall> toolCalls = message != null ? message.getToolCalls() : null;
        if (toolCalls != null && !toolCalls.isEmpty()) {
            chunks.add(factory.toolCalls(indexed(toolCalls), false));
        }

        String finishReason = choice != null && choice.getFinishReason() != null ? choice.getFinishReason() : "stop";
        chunks.add(factory.terminal(finishReason, response.getUsage()));
        return chunks;
    }

    /**
     * Split into pieces of {@code chunkSize} characters, extending a piece to just past the
     * next whitespace when one appears within the following few characters.
     */
    public List<String> split(String content) {
        List<String> pieces = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return pieces;
        }

        int pos = 0;
        while (pos < content.length()) {
            int endPos = Math.min(pos + chunkSize, content.length());
            if (endPos < content.length()) {
                for (int i = endPos; i < Math.min(endPos + BOUNDARY_LOOKAHEAD, content.length()); i++) {
                    if (Character.isWhitespace(content.charAt(i))) {
                        endPos = i + 1;
                        break;
                    }
                }
            }
            if (endPos < content.length() && Character.isHighSurrogate(content.charAt(endPos - 1))) {
                // keep surrogate pairs together
                endPos++;
            }
            pieces.add(content.substring(pos, endPos));
            pos = endPos;
        }
        return pieces;
    }

    private static List<ToolCall> indexed(List<ToolCall> toolCalls) {
        List<ToolCall> result = new ArrayList<>(toolCalls.size());
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall call = toolCalls.get(i);
            result.add(ToolCall.builder()
                    .index(i)
                    .id(call.getId())
                    .type(call.getType())
                    .function(call.getFunction())
                    .build());
        }
        return result;
    }
}
