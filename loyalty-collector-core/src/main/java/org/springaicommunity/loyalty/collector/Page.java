package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One response of the paginated source API.
 *
 * @param cursor the cursor this page was requested with, {@code null} for the first page
 * @param records raw records in the order the API returned them
 * @param nextCursor cursor of the following page, {@code null} at end of stream
 */
public record Page(@Nullable String cursor, List<JsonNode> records, @Nullable String nextCursor) {

	public Page {
		records = List.copyOf(records);
	}

	/**
	 * A page is the last one when it carries no next cursor, or when the next cursor
	 * repeats its own cursor (which would otherwise loop forever). An empty page with a
	 * fresh cursor is not the last page.
	 * @return true if no further page should be requested
	 */
	public boolean isLast() {
		return nextCursor == null || nextCursor.isBlank() || nextCursor.equals(cursor);
	}

	public int size() {
		return records.size();
	}

}
