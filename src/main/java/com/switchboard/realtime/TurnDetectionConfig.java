package com.switchboard.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Server-side voice activity detection settings. A session without one relies on explicit
 * response requests after input is committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TurnDetectionConfig {

    @Builder.Default
    private String type = "server_vad";

    private Double threshold;

    @JsonProperty("prefix_padding_ms")
    private Integer prefixPaddingMs;

    @JsonProperty("silence_duration_ms")
    private Integer silenceDurationMs;

    public static TurnDetectionConfig serverVad() {
        return TurnDetectionConfig.builder().build();
    }
}
