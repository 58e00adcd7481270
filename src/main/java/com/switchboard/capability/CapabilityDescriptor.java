package com.switchboard.capability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.switchboard.config.SwitchboardProperties;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable feature flags and token limits for one provider/model pair.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CapabilityDescriptor {

    boolean chat;
    boolean streaming;
    boolean vision;
    boolean functionCalling;
    boolean embeddings;
    boolean imageGeneration;
    boolean videoGeneration;
    boolean textToSpeech;
    boolean realtimeAudio;
    Integer maxInputTokens;
    Integer maxOutputTokens;

    public static CapabilityDescriptor from(SwitchboardProperties.CapabilityEntry entry) {
        return CapabilityDescriptor.builder()
                .chat(entry.isChat())
                .streaming(entry.isStreaming())
                .vision(entry.isVision())
                .functionCalling(entry.isFunctionCalling())
                .embeddings(entry.isEmbeddings())
                .imageGeneration(entry.isImageGeneration())
                .videoGeneration(entry.isVideoGeneration())
                .textToSpeech(entry.isTextToSpeech())
                .realtimeAudio(entry.isRealtimeAudio())
                .maxInputTokens(entry.getMaxInputTokens())
                .maxOutputTokens(entry.getMaxOutputTokens())
                .build();
    }

    public boolean supports(Operation operation) {
        switch (operation) {
            case CHAT:
                return chat;
            case STREAMING_CHAT:
                return chat && streaming;
            case EMBEDDING:
                return embeddings;
            case IMAGE_GENERATION:
                return imageGeneration;
            case VIDEO_GENERATION:
                return videoGeneration;
            case TEXT_TO_SPEECH:
                return textToSpeech;
            case REALTIME_AUDIO:
                return realtimeAudio;
            default:
                // listing models and verifying credentials work for every model
                return true;
        }
    }
}
