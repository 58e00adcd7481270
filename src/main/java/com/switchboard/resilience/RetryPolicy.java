package com.switchboard.resilience;

import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.CommunicationException;
import com.switchboard.exception.GatewayErrors;
import com.switchboard.exception.GatewayException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded retry with decorrelated-jitter backoff, wrapped around every outbound call.
 *
 * <p>Only transient communication failures (transport errors, 5xx, 429) are retried.
 * Each retry waits {@code min(maxDelay, random(baseDelay, previousDelay * 3))}, so concurrent
 * callers spread out instead of retrying in lockstep. The policy holds no per-call state.
 */
@Component
public class RetryPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final RetryListener listener;
    private final Random random;

    @Autowired
    public RetryPolicy(SwitchboardProperties properties, RetryListener listener) {
        this(properties.getResilience().getMaxRetries(),
                properties.getResilience().getBaseDelay(),
                properties.getResilience().getMaxDelay(),
                listener,
                new Random());
    }

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, RetryListener listener, Random random) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.listener = listener;
        this.random = random;
    }

    /**
     * Execute a single-response operation. Failures surface as taxonomy exceptions tagged with
     * provider and operation.
     */
    public <T> Mono<T> execute(Mono<T> operation, String provider, String operationName,
                               CancellationToken cancellation) {
        return Mono.defer(() -> operation)
                .onErrorMap(error -> !(error instanceof GatewayException), GatewayErrors::classify)
                .retryWhen(retrySpec(provider, operationName, cancellation))
                .onErrorMap(error -> GatewayErrors.wrap(error, provider, operationName));
    }

    /**
     * Execute a streaming operation. Only the opening of the stream is retried: once an element
     * has been delivered a failure ends the stream, since delivered chunks cannot be taken back.
     */
    public <T> Flux<T> executeStream(Flux<T> operation, String provider, String operationName,
                                     CancellationToken cancellation) {
        return Flux.defer(() -> {
            AtomicBoolean delivered = new AtomicBoolean(false);
            return Flux.defer(() -> operation)
                    .doOnNext(element -> delivered.set(true))
                    .onErrorMap(error -> !(error instanceof GatewayException), GatewayErrors::classify)
                    .retryWhen(retrySpec(provider, operationName, cancellation, delivered))
                    .onErrorMap(error -> GatewayErrors.wrap(error, provider, operationName));
        });
    }

    public boolean isRetryable(Throwable error, CancellationToken cancellation) {
        if (cancellation.isCancellationRequested()) {
            return false;
        }
        return error instanceof CommunicationException communication && communication.isTransient();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    Duration nextDelay(Duration previous) {
        long base = baseDelay.toMillis();
        long upper = Math.max(base, previous.toMillis() * 3);
        long candidate = upper > base ? base + (long) (random.nextDouble() * (upper - base)) : base;
        return Duration.ofMillis(Math.min(maxDelay.toMillis(), candidate));
    }

    private Retry retrySpec(String provider, String operationName, CancellationToken cancellation) {
        return retrySpec(provider, operationName, cancellation, new AtomicBoolean(false));
    }

    private Retry retrySpec(String provider, String operationName, CancellationToken cancellation,
                            AtomicBoolean delivered) {
        return Retry.from(signals -> {
            // state lives per subscription, so independent calls never share a backoff sequence
            AtomicReference<Duration> previous = new AtomicReference<>(baseDelay);
            return signals.concatMap(signal -> {
                Throwable failure = signal.failure();
                long attempt = signal.totalRetries() + 1;
                if (delivered.get() || attempt > maxRetries || !isRetryable(failure, cancellation)) {
                    return Mono.error(failure);
                }
                Duration delay = nextDelay(previous.get());
                previous.set(delay);
                listener.onRetry(new RetryAttempt(provider, operationName, attempt, delay, failure));
                return cancellation.guard(Mono.delay(delay), operationName + " retry backoff");
            });
        });
    }
}
