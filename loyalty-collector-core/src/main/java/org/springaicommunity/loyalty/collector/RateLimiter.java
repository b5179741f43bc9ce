package org.springaicommunity.loyalty.collector;

/**
 * Caps the sustained rate of calls against a remote service.
 *
 * <p>
 * Implementations are shared between threads. Callers are not served in FIFO order, but
 * every caller eventually acquires.
 */
public interface RateLimiter {

	/**
	 * Block until the caller may issue one request. Never fails for rate reasons, only
	 * delays.
	 * @throws PipelineCancelledException if the thread is interrupted while waiting
	 */
	void acquire();

	/**
	 * A limiter that never waits.
	 * @return unlimited rate limiter
	 */
	static RateLimiter unlimited() {
		return () -> {
		};
	}

}
