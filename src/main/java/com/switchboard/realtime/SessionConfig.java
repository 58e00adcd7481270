package com.switchboard.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.switchboard.model.ToolDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Provider-neutral realtime session configuration.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionConfig {

    private String model;
    private String voice;
    private String language;
    private String instructions;

    @Builder.Default
    @JsonProperty("input_audio_format")
    private RealtimeAudioFormat inputFormat = RealtimeAudioFormat.PCM16;

    @Builder.Default
    @JsonProperty("output_audio_format")
    private RealtimeAudioFormat outputFormat = RealtimeAudioFormat.PCM16;

    @JsonProperty("turn_detection")
    private TurnDetectionConfig turnDetection;

    private List<ToolDefinition> tools;
    private Double temperature;

    /** Output modalities, for example {@code ["audio", "text"]}. */
    private List<String> modalities;

    public boolean hasTurnDetection() {
        return turnDetection != null;
    }

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}
