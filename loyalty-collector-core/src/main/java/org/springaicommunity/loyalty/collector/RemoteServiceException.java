package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Failure talking to the source API or the destination store.
 *
 * <p>
 * Carries the HTTP status code and an optional server-supplied retry-after hint so that
 * {@link RetryPolicy} can classify the failure. A status code of {@code -1} means the
 * request never produced a response (timeout, connection reset, DNS failure).
 */
public class RemoteServiceException extends CollectorException {

	private static final int MAX_BODY_LENGTH = 500;

	private final int statusCode;

	private final @Nullable String responseBody;

	private final @Nullable String endpoint;

	private final @Nullable Duration retryAfter;

	public RemoteServiceException(String message, int statusCode, @Nullable String responseBody,
			@Nullable String endpoint, @Nullable Duration retryAfter) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = truncate(responseBody);
		this.endpoint = endpoint;
		this.retryAfter = retryAfter;
	}

	public RemoteServiceException(String message, @Nullable String endpoint, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.endpoint = endpoint;
		this.retryAfter = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

	public @Nullable String getEndpoint() {
		return endpoint;
	}

	public @Nullable Duration getRetryAfter() {
		return retryAfter;
	}

	/**
	 * Returns true if the request never got a response.
	 */
	public boolean isNetworkError() {
		return statusCode == -1;
	}

	public boolean isRateLimitError() {
		return statusCode == 429;
	}

	/**
	 * Network errors, 429 and 5xx are transient; every other status is fatal for the
	 * owning operation.
	 */
	public boolean isRetryable() {
		return isNetworkError() || isRateLimitError() || statusCode >= 500;
	}

	private static @Nullable String truncate(@Nullable String body) {
		if (body == null || body.length() <= MAX_BODY_LENGTH) {
			return body;
		}
		return body.substring(0, MAX_BODY_LENGTH) + "...";
	}

}
