package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Request execution and status mapping shared by the HTTP clients.
 */
final class HttpSupport {

	private static final Logger logger = LoggerFactory.getLogger(HttpSupport.class);

	private HttpSupport() {
	}

	static HttpClient newClient(Duration connectTimeout) {
		return HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	/**
	 * Send the request. Transport failures become a {@link RemoteServiceException} with
	 * status {@code -1}; interruption becomes a {@link PipelineCancelledException}.
	 */
	static HttpResponse<String> send(HttpClient httpClient, HttpRequest request) {
		String endpoint = describe(request);
		try {
			return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			logger.debug("{} failed: {}", endpoint, e.toString());
			throw new RemoteServiceException("HTTP request failed: " + e, endpoint, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PipelineCancelledException(endpoint + " interrupted", e);
		}
	}

	/**
	 * Map a non-2xx response to a {@link RemoteServiceException}.
	 * @param response the response
	 * @param serviceName name used in messages, e.g. "Yotpo"
	 * @return the response body if the status is 2xx
	 */
	static String ensureSuccess(HttpResponse<String> response, String serviceName) {
		int statusCode = response.statusCode();
		if (statusCode >= 200 && statusCode < 300) {
			return response.body();
		}

		String endpoint = describe(response.request());
		String body = response.body();
		if (statusCode == 401) {
			throw new RemoteServiceException(serviceName + " rejected the credentials (401)", statusCode, body,
					endpoint, null);
		}
		else if (statusCode == 403) {
			throw new RemoteServiceException(serviceName + " denied access (403)", statusCode, body, endpoint, null);
		}
		else if (statusCode == 404) {
			throw new RemoteServiceException("Not found: " + endpoint, statusCode, body, endpoint, null);
		}
		else if (statusCode == 429) {
			Duration retryAfter = parseRetryAfter(response, Clock.systemUTC());
			throw new RemoteServiceException(serviceName + " rate limit hit (429)"
					+ (retryAfter != null ? ", retry after " + retryAfter.toSeconds() + "s" : ""), statusCode, body,
					endpoint, retryAfter);
		}
		else if (statusCode >= 500) {
			throw new RemoteServiceException(serviceName + " server error: " + statusCode, statusCode, body, endpoint,
					parseRetryAfter(response, Clock.systemUTC()));
		}
		else {
			throw new RemoteServiceException(serviceName + " API error: " + statusCode, statusCode, body, endpoint,
					null);
		}
	}

	/**
	 * Parse a {@code Retry-After} header given either as delta seconds or as an HTTP date.
	 * @return the hint, or {@code null} if absent or unparseable
	 */
	static @Nullable Duration parseRetryAfter(HttpResponse<?> response, Clock clock) {
		return response.headers().firstValue("Retry-After").map(v -> parseRetryAfter(v.trim(), clock)).orElse(null);
	}

	static @Nullable Duration parseRetryAfter(String value, Clock clock) {
		if (value.matches("\\d{1,18}")) {
			return Duration.ofSeconds(Long.parseLong(value));
		}
		try {
			ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
			Duration delta = Duration.between(clock.instant(), at.toInstant());
			return delta.isNegative() ? Duration.ZERO : delta;
		}
		catch (DateTimeParseException e) {
			logger.debug("Ignoring unparseable Retry-After header: {}", value);
			return null;
		}
	}

	static String describe(HttpRequest request) {
		return request.method() + " " + request.uri().getScheme() + "://" + request.uri().getAuthority()
				+ request.uri().getRawPath();
	}

}
