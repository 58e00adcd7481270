package com.switchboard.capability;

/**
 * Unified operations a provider client can be asked to perform.
 */
public enum Operation {

    CHAT("chat"),
    STREAMING_CHAT("stream"),
    EMBEDDING("embedding"),
    IMAGE_GENERATION("image"),
    VIDEO_GENERATION("video"),
    TEXT_TO_SPEECH("speech"),
    REALTIME_AUDIO("realtime"),
    LIST_MODELS("models"),
    VERIFY_AUTHENTICATION("verify");

    private final String label;

    Operation(String label) {
        this.label = label;
    }

    /**
     * Short name used in logs and error tags.
     */
    public String label() {
        return label;
    }
}
