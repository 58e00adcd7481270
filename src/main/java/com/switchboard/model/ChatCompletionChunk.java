package com.switchboard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Streaming chat completion chunk, sent as one SSE event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionChunk {

    public static final String OBJECT = "chat.completion.chunk";

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    private String object;

    @JsonProperty("created")
    private Long created;

    @JsonProperty("model")
    private String model;

    @JsonProperty("choices")
    private List<ChunkChoice> choices;

    @JsonProperty("usage")
    private Usage usage;

    /**
     * First choice, which is the only one the gateway ever emits.
     */
    @JsonIgnore
    public ChunkChoice firstChoice() {
        return choices == null || choices.isEmpty() ? null : choices.get(0);
    }

    @JsonIgnore
    public boolean isTerminal() {
        ChunkChoice choice = firstChoice();
        return choice != null && choice.getFinishReason() != null;
    }

    /**
     * Choice for streaming chunk with delta instead of message.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChunkChoice {

        @JsonProperty("index")
        private Integer index;

        @JsonProperty("delta")
        private Delta delta;

        @JsonProperty("finish_reason")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String finishReason; // null until final chunk
    }
}
