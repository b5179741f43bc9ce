package org.springaicommunity.loyalty.collector;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag shared by the fetch path and the upload workers.
 *
 * <p>
 * Checked before each fetch and before each upload attempt. As a {@link Sleeper} it wakes
 * up as soon as {@link #cancel()} is called, so backoff sleeps do not delay shutdown.
 */
public final class CancellationSignal implements Sleeper {

	private final CountDownLatch cancelled = new CountDownLatch(1);

	/**
	 * Request cancellation. Idempotent.
	 */
	public void cancel() {
		cancelled.countDown();
	}

	public boolean isCancelled() {
		return cancelled.getCount() == 0;
	}

	/**
	 * Throw if cancellation has been requested.
	 * @param nextStep description of what was about to happen, used in the message
	 * @throws PipelineCancelledException if cancelled
	 */
	public void throwIfCancelled(String nextStep) {
		if (isCancelled()) {
			throw new PipelineCancelledException("Export cancelled before " + nextStep);
		}
	}

	@Override
	public void sleep(Duration duration) throws InterruptedException {
		if (cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
			throw new PipelineCancelledException("Export cancelled during backoff");
		}
	}

}
