package com.switchboard.resilience;

/**
 * Receives one callback per scheduled retry.
 */
@FunctionalInterface
public interface RetryListener {

    void onRetry(RetryAttempt attempt);
}
