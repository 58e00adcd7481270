package com.switchboard.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelInfo {

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    @Builder.Default
    private String object = "model";

    @JsonProperty("created")
    private Long created;

    @JsonProperty("owned_by")
    private String ownedBy;

    @JsonProperty("provider")
    private String provider;

    public static ModelInfo of(String id, String provider) {
        return ModelInfo.builder().id(id).ownedBy(provider).provider(provider).build();
    }
}
