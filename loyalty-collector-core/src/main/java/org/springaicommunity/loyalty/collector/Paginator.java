package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, forward-only sequence of {@link Page}s read from a {@link SourceClient}.
 *
 * <p>
 * Every request waits for the {@link RateLimiter} and runs under the {@link RetryPolicy}.
 * Each page's cursor comes from the previous response, so pages are always fetched one
 * after the other. The sequence ends at the first page without a new cursor. A terminal
 * failure ends it as well and is rethrown to the caller; pages already returned stay
 * valid.
 *
 * <p>
 * Instances are single-use. To read again, possibly from a stored cursor, build a new
 * paginator.
 */
public class Paginator implements Iterator<Page> {

	private static final Logger logger = LoggerFactory.getLogger(Paginator.class);

	private final SourceClient source;

	private final RateLimiter rateLimiter;

	private final RetryPolicy retryPolicy;

	private final ObjectMapper objectMapper;

	private final String recordsField;

	private final JsonPointer nextCursorPointer;

	private final CancellationSignal cancellation;

	private @Nullable String cursor;

	private boolean exhausted;

	private int pagesFetched;

	private long recordsFetched;

	private Paginator(Builder builder) {
		this.source = builder.source;
		this.rateLimiter = builder.rateLimiter;
		this.retryPolicy = builder.retryPolicy;
		this.objectMapper = builder.objectMapper;
		this.recordsField = builder.recordsField;
		this.nextCursorPointer = JsonPointer.compile(builder.nextCursorPointer);
		this.cancellation = builder.cancellation;
		this.cursor = builder.startCursor;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public boolean hasNext() {
		return !exhausted;
	}

	/**
	 * Fetch the next page.
	 * @return the next page
	 * @throws NoSuchElementException if the sequence has ended
	 * @throws RetryExhaustedException if the page could not be fetched
	 * @throws PageParseException if the response is not a valid page
	 * @throws PipelineCancelledException if the export was cancelled
	 */
	@Override
	public Page next() {
		if (exhausted) {
			throw new NoSuchElementException("Pagination already reached the end of the stream");
		}

		String requestCursor = cursor;
		int pageNumber = pagesFetched + 1;
		Page page;
		try {
			cancellation.throwIfCancelled("fetching page " + pageNumber);
			String body = retryPolicy.execute(describe(pageNumber, requestCursor), () -> {
				rateLimiter.acquire();
				return source.fetchPage(requestCursor);
			});
			page = parse(requestCursor, body);
		}
		catch (RuntimeException e) {
			exhausted = true;
			throw e;
		}

		pagesFetched++;
		recordsFetched += page.size();
		logger.info("Page {}: {} records (total: {})", pageNumber, page.size(), recordsFetched);

		if (page.isLast()) {
			exhausted = true;
			if (page.nextCursor() != null && page.nextCursor().equals(requestCursor)) {
				logger.warn("Page {} returned its own cursor as next cursor, treating it as end of stream",
						pageNumber);
			}
			else {
				logger.info("No more pages available");
			}
		}
		else {
			cursor = page.nextCursor();
		}
		return page;
	}

	/**
	 * Cursor of the next page to fetch. After a failure this is the cursor of the page
	 * that failed, so a new paginator started from it resumes without duplicates.
	 * @return current cursor, {@code null} at the beginning of the stream
	 */
	public @Nullable String currentCursor() {
		return cursor;
	}

	public int pagesFetched() {
		return pagesFetched;
	}

	public long recordsFetched() {
		return recordsFetched;
	}

	Page parse(@Nullable String requestCursor, String body) {
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new PageParseException("Malformed page payload for cursor " + requestCursor + ": "
					+ e.getOriginalMessage(), e);
		}

		if (root == null || !root.isObject()) {
			throw new PageParseException("Page payload for cursor " + requestCursor + " is not a JSON object");
		}

		JsonNode items = root.get(recordsField);
		if (items == null || !items.isArray()) {
			throw new PageParseException("Page payload for cursor " + requestCursor + " has no '" + recordsField
					+ "' array");
		}

		List<JsonNode> records = new ArrayList<>(items.size());
		items.forEach(records::add);

		JsonNode next = root.at(nextCursorPointer);
		String nextCursor = next.isValueNode() && !next.isNull() ? next.asText() : null;

		return new Page(requestCursor, records, nextCursor);
	}

	private static String describe(int pageNumber, @Nullable String cursor) {
		return "Fetch page " + pageNumber + (cursor != null ? " (cursor " + cursor + ")" : "");
	}

	/**
	 * Builder for {@link Paginator}.
	 *
	 * <p>
	 * Defaults match the Yotpo customers endpoint: records under {@code customers}, next
	 * cursor at {@code /pagination/next_page_info}, no rate limit, start of stream.
	 */
	public static class Builder {

		private SourceClient source;

		private RateLimiter rateLimiter = RateLimiter.unlimited();

		private RetryPolicy retryPolicy;

		private ObjectMapper objectMapper;

		private String recordsField = "customers";

		private String nextCursorPointer = "/pagination/next_page_info";

		private @Nullable String startCursor;

		private CancellationSignal cancellation = new CancellationSignal();

		private Builder() {
		}

		public Builder source(SourceClient source) {
			this.source = source;
			return this;
		}

		public Builder rateLimiter(RateLimiter rateLimiter) {
			this.rateLimiter = rateLimiter;
			return this;
		}

		public Builder retryPolicy(RetryPolicy retryPolicy) {
			this.retryPolicy = retryPolicy;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Name of the top-level array holding the records.
		 * @param recordsField field name (default: customers)
		 * @return this builder
		 */
		public Builder recordsField(String recordsField) {
			this.recordsField = recordsField;
			return this;
		}

		/**
		 * JSON pointer to the next cursor within a page.
		 * @param nextCursorPointer pointer expression (default:
		 * /pagination/next_page_info)
		 * @return this builder
		 */
		public Builder nextCursorPointer(String nextCursorPointer) {
			this.nextCursorPointer = nextCursorPointer;
			return this;
		}

		/**
		 * Cursor of the first page to fetch.
		 * @param startCursor cursor, or {@code null} for the beginning of the stream
		 * @return this builder
		 */
		public Builder startCursor(@Nullable String startCursor) {
			this.startCursor = startCursor;
			return this;
		}

		public Builder cancellation(CancellationSignal cancellation) {
			this.cancellation = cancellation;
			return this;
		}

		public Paginator build() {
			if (source == null) {
				throw new IllegalStateException("A SourceClient is required. Call source() first.");
			}
			if (retryPolicy == null) {
				throw new IllegalStateException("A RetryPolicy is required. Call retryPolicy() first.");
			}
			if (objectMapper == null) {
				throw new IllegalStateException("An ObjectMapper is required. Call objectMapper() first.");
			}
			return new Paginator(this);
		}

	}

}
