package com.switchboard.realtime;

import com.switchboard.exception.CommunicationException;
import com.switchboard.exception.GatewayErrors;
import com.switchboard.exception.RequestValidationException;
import com.switchboard.realtime.RealtimeMessage.AudioFrame;
import com.switchboard.realtime.RealtimeMessage.ErrorMessage;
import com.switchboard.resilience.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Send and receive sides of one realtime session.
 *
 * <p>{@link #receive()} is lazy and single-use. It ends when the provider closes or drops the socket, after a
 * terminal provider error (in each case the session is closed) or when the cancellation token fires (the session is closed and the
 * sequence fails with {@link com.switchboard.exception.RequestCanceledException}).
 */
@Slf4j
public class RealtimeDuplexStream {

    private final RealtimeSession session;
    private final RealtimeSessionManager manager;
    private final CancellationToken cancellation;
    private final AtomicBoolean inputComplete = new AtomicBoolean();

    RealtimeDuplexStream(RealtimeSession session, RealtimeSessionManager manager, CancellationToken cancellation) {
        this.session = session;
        this.manager = manager;
        this.cancellation = cancellation;
    }

    public RealtimeSession getSession() {
        return session;
    }

    public Mono<Void> send(AudioFrame frame) {
        return sendMessage(frame);
    }

    /**
     * Text input, function responses and response requests, or audio.
     */
    public Mono<Void> sendMessage(RealtimeMessage message) {
        return cancellation.guard(Mono.defer(() -> {
            if (inputComplete.get()) {
                return Mono.error(new RequestValidationException("Input for realtime session " + session.getId()
                        + " is already complete", session.getProvider(), RealtimeSessionManager.OPERATION, null));
            }
            if (!session.getState().canSend()) {
                return Mono.error(RealtimeSessionManager.notOpen(session));
            }
            String frame = session.getTranslator().toProviderWire(message);
            if (session.transition(SessionState.CONNECTED, SessionState.ACTIVE)) {
                log.debug("Realtime session {} active", session.getId());
            }
            return session.getConnection().send(frame);
        }), "Realtime send");
    }

    public Flux<RealtimeMessage> receive() {
        Flux<RealtimeMessage> messages = session.getConnection().receive()
                .concatMapIterable(this::translate)
                .doOnNext(this::logError)
                .takeUntil(RealtimeDuplexStream::isTerminalError)
                .concatWith(Mono.defer(() -> manager.closeSession(session)).then(Mono.empty()))
                .onErrorResume(error -> manager.closeSession(session)
                        .then(Mono.error(GatewayErrors.wrap(error, session.getProvider(),
                                RealtimeSessionManager.OPERATION))))
                .doOnCancel(() -> {
                    if (cancellation.isCancellationRequested()) {
                        manager.closeSession(session).subscribe();
                    }
                });
        return cancellation.guard(messages, "Realtime receive");
    }

    /**
     * End the input side. The provider is told no more audio is coming; receiving continues.
     */
    public Mono<Void> complete() {
        return Mono.defer(() -> {
            if (!inputComplete.compareAndSet(false, true) || !session.getState().canSend()) {
                return Mono.empty();
            }
            return Flux.fromIterable(session.getTranslator().endOfInput(session.getConfig()))
                    .concatMap(frame -> session.getConnection().send(frame))
                    .then();
        });
    }

    private List<RealtimeMessage> translate(String frame) {
        try {
            return session.getTranslator().fromProviderWire(frame);
        } catch (CommunicationException e) {
            log.warn("Dropping undecodable frame on realtime session {}: {}", session.getId(), e.getRawMessage());
            return List.of(new ErrorMessage(
                    new RealtimeError("malformed_frame", e.getRawMessage(), ErrorSeverity.ERROR, false)));
        }
    }

    private void logError(RealtimeMessage message) {
        if (message instanceof ErrorMessage error) {
            RealtimeError detail = error.error();
            if (detail.severity() == ErrorSeverity.WARNING) {
                log.warn("Realtime session {} warning {}: {}", session.getId(), detail.code(), detail.message());
            } else {
                log.error("Realtime session {} {} error {}: {} (terminal={})", session.getId(), detail.severity(),
                        detail.code(), detail.message(), detail.terminal());
            }
        }
    }

    private static boolean isTerminalError(RealtimeMessage message) {
        return message instanceof ErrorMessage error && error.error().terminal();
    }
}
