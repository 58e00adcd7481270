package com.switchboard.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default retry sink: one warn line per retry.
 */
@Slf4j
@Component
public class LoggingRetryListener implements RetryListener {

    @Override
    public void onRetry(RetryAttempt attempt) {
        log.warn("Retrying {} {} (attempt {}) in {} ms: {}",
                attempt.provider(),
                attempt.operation(),
                attempt.attempt(),
                attempt.delay().toMillis(),
                attempt.cause().getMessage());
    }
}
