package com.switchboard.resilience;

import com.switchboard.exception.RequestCanceledException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Caller-owned cancellation signal shared by every long-running operation
 * (streaming reads, poll loops, realtime receive loops).
 *
 * <p>Guarded publishers stop at the next suspension point once {@link #cancel()} is called,
 * cancel their upstream subscription (which releases sockets) and terminate with
 * {@link RequestCanceledException}.
 */
public final class CancellationToken {

    /** Token that never fires. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final Sinks.One<Boolean> signal = Sinks.one();
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    public void cancel() {
        if (!cancellable || cancelled) {
            return;
        }
        cancelled = true;
        signal.tryEmitValue(Boolean.TRUE);
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * Completes when the token fires; never completes for {@link #NONE}.
     */
    public Mono<Void> whenCancelled() {
        return cancellable ? signal.asMono().then() : Mono.never();
    }

    public void throwIfCancellationRequested(String what) {
        if (cancelled) {
            throw canceled(what);
        }
    }

    public <T> Mono<T> guard(Mono<T> source, String what) {
        if (!cancellable) {
            return source;
        }
        return Mono.defer(() -> {
            if (cancelled) {
                return Mono.error(canceled(what));
            }
            return source
                    .takeUntilOther(signal.asMono())
                    .switchIfEmpty(Mono.defer(() -> cancelled ? Mono.error(canceled(what)) : Mono.empty()));
        });
    }

    public <T> Flux<T> guard(Flux<T> source, String what) {
        if (!cancellable) {
            return source;
        }
        return Flux.defer(() -> {
            if (cancelled) {
                return Flux.error(canceled(what));
            }
            return source
                    .takeUntilOther(signal.asMono())
                    .concatWith(Mono.defer(() -> cancelled ? Mono.error(canceled(what)) : Mono.empty()));
        });
    }

    private static RequestCanceledException canceled(String what) {
        return new RequestCanceledException(what + " was canceled by the caller");
    }
}
