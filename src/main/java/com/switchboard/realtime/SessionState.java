package com.switchboard.realtime;

/**
 * Lifecycle of a realtime session. Transitions only move forward.
 */
public enum SessionState {
    CONNECTING,
    CONNECTED,
    ACTIVE,
    CLOSING,
    CLOSED;

    public boolean canSend() {
        return this == CONNECTED || this == ACTIVE;
    }
}
