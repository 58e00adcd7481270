package com.switchboard.resilience;

import java.time.Duration;

/**
 * One scheduled retry, reported for observability.
 *
 * @param attempt retry number, starting at 1 for the second call
 */
public record RetryAttempt(String provider, String operation, long attempt, Duration delay, Throwable cause) {
}
