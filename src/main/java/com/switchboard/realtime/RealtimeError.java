package com.switchboard.realtime;

/**
 * Provider error translated into the unified realtime vocabulary.
 *
 * @param terminal the session cannot continue and will be closed
 */
public record RealtimeError(String code, String message, ErrorSeverity severity, boolean terminal) {
}
