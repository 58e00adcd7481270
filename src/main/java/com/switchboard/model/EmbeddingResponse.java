package com.switchboard.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmbeddingResponse {

    @JsonProperty("object")
    @Builder.Default
    private String object = "list";

    @JsonProperty("data")
    private List<EmbeddingData> data;

    @JsonProperty("model")
    private String model;

    @JsonProperty("usage")
    private Usage usage;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EmbeddingData {

        @JsonProperty("object")
        @Builder.Default
        private String object = "embedding";

        @JsonProperty("index")
        private Integer index;

        @JsonProperty("embedding")
        private List<Double> embedding;
    }
}
