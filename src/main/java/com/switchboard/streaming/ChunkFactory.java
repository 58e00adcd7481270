package com.switchboard.streaming;

import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.Delta;
import com.switchboard.model.Message;
import com.switchboard.model.ToolCall;
import com.switchboard.model.Usage;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Builds chunks that share one id, timestamp and model.
 */
public final class ChunkFactory {

    private final String id;
    private final long created;
    private final String model;

    public ChunkFactory(String id, long created, String model) {
        this.id = id;
        this.created = created;
        this.model = model;
    }

    public static ChunkFactory create(String id, String model) {
        return new ChunkFactory(id != null ? id : newId(), Instant.now().getEpochSecond(), model);
    }

    public static String newId() {
        return "chatcmpl-" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    public ChatCompletionChunk role() {
        return chunk(Delta.builder().role(Message.ROLE_ASSISTANT).build(), null, null);
    }

    public ChatCompletionChunk content(String text, boolean withRole) {
        return chunk(Delta.builder()
                .role(withRole ? Message.ROLE_ASSISTANT : null)
                .content(text)
                .build(), null, null);
    }

    public ChatCompletionChunk toolCalls(List<ToolCall> toolCalls, boolean withRole) {
        return chunk(Delta.builder()
                .role(withRole ? Message.ROLE_ASSISTANT : null)
                .toolCalls(toolCalls)
                .build(), null, null);
    }

    public ChatCompletionChunk terminal(String finishReason, Usage usage) {
        return chunk(Delta.empty(), finishReason != null ? finishReason : "stop", usage);
    }

    public String getId() {
        return id;
    }

    private ChatCompletionChunk chunk(Delta delta, String finishReason, Usage usage) {
        return ChatCompletionChunk.builder()
                .id(id)
                .object(ChatCompletionChunk.OBJECT)
                .created(created)
                .model(model)
                .choices(List.of(ChatCompletionChunk.ChunkChoice.builder()
                        .index(0)
                        .delta(delta)
                        .finishReason(finishReason)
                        .build()))
                .usage(usage)
                .build();
    }
}
