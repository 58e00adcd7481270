package com.switchboard.job;

import java.util.Locale;

/**
 * Lifecycle of an upstream prediction job.
 */
public enum JobStatus {

    STARTING,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }

    /**
     * Parse an upstream status string. Unknown or missing values count as still processing.
     */
    public static JobStatus fromWire(String value) {
        if (value == null) {
            return PROCESSING;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "starting", "queued", "pending" -> STARTING;
            case "succeeded", "successful", "completed" -> SUCCEEDED;
            case "failed", "error" -> FAILED;
            case "canceled", "cancelled" -> CANCELED;
            default -> PROCESSING;
        };
    }
}
