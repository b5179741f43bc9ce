package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * Runs an operation with bounded retries and exponential backoff.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Exponential backoff ({@code baseDelay * 2^(attempt-1)}) plus random jitter for
 * transient errors (network, 429, 5xx)</li>
 * <li>Honors a server-supplied {@code Retry-After} hint when it is longer than the
 * computed backoff</li>
 * <li>Fails fast on client errors (4xx other than 429) and unparseable pages</li>
 * <li>Checks a {@link CancellationSignal} before every attempt</li>
 * </ul>
 *
 * <p>
 * A policy holds no per-call state, so one instance can be shared by any number of
 * threads.
 *
 * <pre>
 * {@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(3)
 *     .baseDelay(Duration.ofSeconds(2))
 *     .build();
 *
 * String body = policy.execute("GET customers", () -> client.fetchPage(cursor));
 * }
 * </pre>
 */
public final class RetryPolicy {

	private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	private static final int MAX_BACKOFF_SHIFT = 20;

	private final int maxAttempts;

	private final Duration baseDelay;

	private final Duration maxJitter;

	private final Sleeper sleeper;

	private final @Nullable CancellationSignal cancellation;

	private final Consumer<RetryAttempt> listener;

	private final Clock clock;

	private RetryPolicy(Builder builder) {
		this.maxAttempts = builder.maxAttempts;
		this.baseDelay = builder.baseDelay;
		this.maxJitter = builder.maxJitter;
		this.cancellation = builder.cancellation;
		this.sleeper = builder.sleeper != null ? builder.sleeper
				: (builder.cancellation != null ? builder.cancellation : Sleeper.system());
		this.listener = builder.listener;
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Execute the operation, retrying transient failures.
	 * @param operation description used in logs and in the terminal failure
	 * @param action the operation to run
	 * @param <T> result type
	 * @return the result of the first successful attempt
	 * @throws RetryExhaustedException if every attempt failed with a retryable error
	 * @throws PipelineCancelledException if cancelled before or between attempts
	 * @throws RuntimeException the original error if it is not retryable
	 */
	public <T> T execute(String operation, RetryableOperation<T> action) {
		Exception lastError = null;

		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			if (cancellation != null) {
				cancellation.throwIfCancelled(operation);
			}
			try {
				return action.call();
			}
			catch (PipelineCancelledException e) {
				throw e;
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new PipelineCancelledException(operation + " interrupted", e);
			}
			catch (Exception e) {
				lastError = e;

				if (!isRetryable(e)) {
					logger.warn("{} failed with a non-retryable error: {}", operation, e.getMessage());
					throw asUnchecked(e);
				}

				if (attempt < maxAttempts) {
					Duration delay = computeDelay(attempt, e);
					logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", operation, attempt, maxAttempts,
							e.getMessage(), delay.toMillis());
					listener.accept(new RetryAttempt(operation, attempt, e, clock.instant().plus(delay), delay));
					pause(operation, delay);
				}
			}
		}

		logger.error("{} failed after {} attempts", operation, maxAttempts);
		throw new RetryExhaustedException(operation, maxAttempts, lastError);
	}

	/**
	 * Classify a failure. Network failures, 429 and 5xx responses are transient; anything
	 * else, including unparseable pages and client errors, is not.
	 * @param error the failure
	 * @return true if another attempt may succeed
	 */
	public static boolean isRetryable(Throwable error) {
		if (error instanceof RemoteServiceException remote) {
			return remote.isRetryable();
		}
		return error instanceof IOException || error instanceof UncheckedIOException;
	}

	/**
	 * Backoff before the attempt following {@code failedAttempt}: exponential delay plus
	 * jitter, or the server's retry-after hint when that is longer.
	 */
	Duration computeDelay(int failedAttempt, Throwable error) {
		int shift = Math.min(failedAttempt - 1, MAX_BACKOFF_SHIFT);
		Duration delay = baseDelay.multipliedBy(1L << shift);
		if (!maxJitter.isZero()) {
			delay = delay.plusMillis(ThreadLocalRandom.current().nextLong(maxJitter.toMillis() + 1));
		}

		if (error instanceof RemoteServiceException remote && remote.getRetryAfter() != null) {
			Duration hint = remote.getRetryAfter();
			if (hint.compareTo(delay) > 0) {
				logger.info("Server asked to retry after {}s", hint.toSeconds());
				return hint;
			}
		}
		return delay;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	private void pause(String operation, Duration delay) {
		try {
			sleeper.sleep(delay);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PipelineCancelledException(operation + " interrupted during backoff", e);
		}
	}

	private static RuntimeException asUnchecked(Exception e) {
		if (e instanceof RuntimeException runtime) {
			return runtime;
		}
		return new CollectorException(e.getMessage() != null ? e.getMessage() : e.getClass().getName(), e);
	}

	/**
	 * An operation that may fail with any exception.
	 *
	 * @param <T> result type
	 */
	@FunctionalInterface
	public interface RetryableOperation<T> {

		T call() throws Exception;

	}

	/**
	 * Builder for {@link RetryPolicy}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>maxAttempts: 3</li>
	 * <li>baseDelay: 2 seconds</li>
	 * <li>maxJitter: 250 milliseconds</li>
	 * </ul>
	 */
	public static class Builder {

		private int maxAttempts = 3;

		private Duration baseDelay = Duration.ofSeconds(2);

		private Duration maxJitter = Duration.ofMillis(250);

		private @Nullable Sleeper sleeper;

		private @Nullable CancellationSignal cancellation;

		private Consumer<RetryAttempt> listener = attempt -> {
		};

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Total number of attempts, including the first one.
		 * @param maxAttempts attempt count (default: 3)
		 * @return this builder
		 */
		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		/**
		 * Delay before the second attempt; doubles for each further attempt.
		 * @param baseDelay base delay (default: 2 seconds)
		 * @return this builder
		 */
		public Builder baseDelay(Duration baseDelay) {
			this.baseDelay = baseDelay;
			return this;
		}

		/**
		 * Upper bound of the random jitter added to every backoff.
		 * @param maxJitter maximum jitter (default: 250ms, zero disables jitter)
		 * @return this builder
		 */
		public Builder maxJitter(Duration maxJitter) {
			this.maxJitter = maxJitter;
			return this;
		}

		/**
		 * Sleeper used for backoff. Defaults to the cancellation signal when one is set,
		 * otherwise to {@link Sleeper#system()}.
		 * @param sleeper backoff sleeper
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		public Builder cancellation(@Nullable CancellationSignal cancellation) {
			this.cancellation = cancellation;
			return this;
		}

		/**
		 * Callback invoked for every failed attempt that will be retried.
		 * @param listener retry listener
		 * @return this builder
		 */
		public Builder listener(Consumer<RetryAttempt> listener) {
			this.listener = listener;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the policy.
		 * @return configured RetryPolicy
		 * @throws IllegalStateException if a setting is out of range
		 */
		public RetryPolicy build() {
			if (maxAttempts < 1) {
				throw new IllegalStateException("maxAttempts must be at least 1");
			}
			if (baseDelay.isNegative()) {
				throw new IllegalStateException("baseDelay must not be negative");
			}
			if (maxJitter.isNegative()) {
				throw new IllegalStateException("maxJitter must not be negative");
			}
			return new RetryPolicy(this);
		}

	}

}
