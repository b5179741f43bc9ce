package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;

/**
 * Base class for all failures raised by the export pipeline.
 */
public class CollectorException extends RuntimeException {

	public CollectorException(String message) {
		super(message);
	}

	public CollectorException(String message, @Nullable Throwable cause) {
		super(message, cause);
	}

}
