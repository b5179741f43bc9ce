package org.springaicommunity.loyalty.collector;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread for a given duration. Abstracted so that rate limiting and
 * backoff can be tested against a virtual clock.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleep for at least the given duration.
	 * @param duration how long to block
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	void sleep(Duration duration) throws InterruptedException;

	/**
	 * A sleeper backed by the system clock. Never returns early, even when the underlying
	 * sleep rounds to whole milliseconds.
	 * @return system sleeper
	 */
	static Sleeper system() {
		return duration -> {
			long deadline = System.nanoTime() + duration.toNanos();
			long remaining = duration.toNanos();
			while (remaining > 0) {
				TimeUnit.NANOSECONDS.sleep(remaining);
				remaining = deadline - System.nanoTime();
			}
		};
	}

}
