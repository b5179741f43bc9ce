package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;

/**
 * Raised at a suspension point once the export has been cancelled, either through a
 * {@link CancellationSignal} or by interrupting the waiting thread.
 */
public class PipelineCancelledException extends CollectorException {

	public PipelineCancelledException(String message) {
		super(message);
	}

	public PipelineCancelledException(String message, @Nullable Throwable cause) {
		super(message, cause);
	}

}
