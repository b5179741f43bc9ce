package org.springaicommunity.loyalty.collector;

import java.util.List;

/**
 * A sealed, immutable group of records uploaded in one call.
 *
 * @param batchNumber 1-based position in seal order
 * @param records records in arrival order
 * @param ingestedAt ingestion time in Unix seconds assigned when the batch was sealed
 */
public record Batch(int batchNumber, List<IngestedRecord> records, long ingestedAt) {

	public Batch {
		records = List.copyOf(records);
	}

	public int size() {
		return records.size();
	}

}
