package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;

/**
 * Interface for the paginated source API.
 *
 * <p>
 * Keeps transport and authentication out of the {@link Paginator}, enabling testability
 * and alternative sources.
 */
public interface SourceClient {

	/**
	 * Fetch one raw page.
	 * @param cursor continuation cursor, or {@code null} for the first page
	 * @return the response body
	 * @throws RemoteServiceException if the request fails
	 * @throws PageParseException if the response is not a usable page
	 */
	String fetchPage(@Nullable String cursor);

}
