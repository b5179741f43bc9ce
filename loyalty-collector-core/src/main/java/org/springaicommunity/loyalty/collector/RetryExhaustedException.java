package org.springaicommunity.loyalty.collector;

/**
 * Terminal failure of an operation after all configured attempts failed. The last error
 * is available as the {@link #getCause() cause}.
 */
public class RetryExhaustedException extends CollectorException {

	private final String operation;

	private final int attempts;

	public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
		super(operation + " failed after " + attempts + " attempts: " + lastError.getMessage(), lastError);
		this.operation = operation;
		this.attempts = attempts;
	}

	public String getOperation() {
		return operation;
	}

	public int getAttempts() {
		return attempts;
	}

}
