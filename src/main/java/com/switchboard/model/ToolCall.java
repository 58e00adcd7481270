package com.switchboard.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tool call issued by the assistant. In streaming deltas only {@code index} is guaranteed;
 * id, name and argument fragments arrive incrementally.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCall {

    @JsonProperty("index")
    private Integer index;

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private String type; // "function"

    @JsonProperty("function")
    private FunctionCall function;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FunctionCall {

        @JsonProperty("name")
        private String name;

        @JsonProperty("arguments")
        private String arguments;
    }
}
