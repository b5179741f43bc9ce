package org.springaicommunity.loyalty.collector;

import java.time.Duration;
import java.time.Instant;

/**
 * A failed attempt that is about to be retried.
 *
 * @param operation description of the operation being retried
 * @param attempt the 1-based number of the attempt that failed
 * @param lastError the failure of that attempt
 * @param nextEligibleAt earliest time the next attempt may start
 * @param delay the backoff chosen before the next attempt
 */
public record RetryAttempt(String operation, int attempt, Throwable lastError, Instant nextEligibleAt,
		Duration delay) {
}
