package org.springaicommunity.loyalty.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Token bucket {@link RateLimiter} supporting fractional rates such as 4.5 requests per
 * second.
 *
 * <p>
 * The bucket holds at most one permit, so {@code N} acquisitions always span at least
 * {@code (N - 1) / rate} seconds. A caller reserves its permit under the lock, possibly
 * driving the bucket into debt, and then sleeps outside the lock until the debt is
 * repaid. Reservations are granted in lock order, which is what guarantees progress for
 * every caller.
 */
public final class TokenBucketRateLimiter implements RateLimiter {

	private static final Logger logger = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

	private static final double MAX_PERMITS = 1.0;

	private static final double NANOS_PER_SECOND = 1_000_000_000d;

	private final double permitsPerSecond;

	private final LongSupplier nanoClock;

	private final Sleeper sleeper;

	private final ReentrantLock lock = new ReentrantLock();

	// guarded by lock
	private double storedPermits = MAX_PERMITS;

	// guarded by lock
	private long lastRefillNanos;

	public TokenBucketRateLimiter(double permitsPerSecond) {
		this(permitsPerSecond, System::nanoTime, Sleeper.system());
	}

	TokenBucketRateLimiter(double permitsPerSecond, LongSupplier nanoClock, Sleeper sleeper) {
		if (!(permitsPerSecond > 0) || Double.isInfinite(permitsPerSecond)) {
			throw new IllegalArgumentException("permitsPerSecond must be a positive finite number: " + permitsPerSecond);
		}
		this.permitsPerSecond = permitsPerSecond;
		this.nanoClock = nanoClock;
		this.sleeper = sleeper;
		this.lastRefillNanos = nanoClock.getAsLong();
	}

	@Override
	public void acquire() {
		long waitNanos = reserve();
		if (waitNanos <= 0) {
			return;
		}
		logger.trace("Rate limit: waiting {}ms for a permit", waitNanos / 1_000_000);
		try {
			sleeper.sleep(Duration.ofNanos(waitNanos));
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PipelineCancelledException("Interrupted while waiting for a rate limit permit", e);
		}
	}

	public double getPermitsPerSecond() {
		return permitsPerSecond;
	}

	/**
	 * Refill, take one permit and return how long the caller must wait before using it.
	 */
	private long reserve() {
		lock.lock();
		try {
			long now = nanoClock.getAsLong();
			long elapsed = Math.max(0, now - lastRefillNanos);
			storedPermits = Math.min(MAX_PERMITS, storedPermits + elapsed * permitsPerSecond / NANOS_PER_SECOND);
			lastRefillNanos = now;

			storedPermits -= 1.0;
			if (storedPermits >= 0) {
				return 0;
			}
			return (long) Math.ceil(-storedPermits * NANOS_PER_SECOND / permitsPerSecond);
		}
		finally {
			lock.unlock();
		}
	}

}
