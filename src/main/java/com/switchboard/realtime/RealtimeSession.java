package com.switchboard.realtime;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A realtime conversation with one provider over one WebSocket.
 */
@Getter
public class RealtimeSession {

    private final String id;
    private final String provider;
    private final Instant createdAt = Instant.now();

    private volatile SessionConfig config;

    @Getter(AccessLevel.NONE)
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);

    @Getter(AccessLevel.PACKAGE)
    private final RealtimeTranslator translator;

    @Getter(AccessLevel.PACKAGE)
    private volatile RealtimeConnection connection;

    RealtimeSession(String id, String provider, SessionConfig config, RealtimeTranslator translator) {
        this.id = id;
        this.provider = provider;
        this.config = config;
        this.translator = translator;
    }

    public SessionState getState() {
        return state.get();
    }

    void attach(RealtimeConnection connection) {
        this.connection = connection;
    }

    void updateConfig(SessionConfig config) {
        this.config = config;
    }

    boolean transition(SessionState from, SessionState to) {
        return state.compareAndSet(from, to);
    }

    /**
     * Advance to {@code target} unless the session is already at or past it.
     *
     * @return the state before the call
     */
    SessionState advanceTo(SessionState target) {
        return state.getAndUpdate(current -> current.ordinal() < target.ordinal() ? target : current);
    }

    @Override
    public String toString() {
        return "RealtimeSession(" + id + ", " + provider + ", " + state.get() + ")";
    }
}
