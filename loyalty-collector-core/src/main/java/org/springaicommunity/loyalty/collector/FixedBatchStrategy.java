package org.springaicommunity.loyalty.collector;

import java.util.ArrayList;
import java.util.List;

/**
 * Takes up to {@code maxBatchSize} items from the head of the pending list.
 *
 * @param <T> the type of items being batched
 */
public class FixedBatchStrategy<T> implements BatchStrategy<T> {

	@Override
	public List<T> createBatch(List<T> pendingItems, int maxBatchSize) {
		if (maxBatchSize <= 0) {
			throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
		}
		if (pendingItems.isEmpty()) {
			return new ArrayList<>();
		}

		int batchSize = Math.min(maxBatchSize, pendingItems.size());
		List<T> batch = new ArrayList<>(pendingItems.subList(0, batchSize));
		pendingItems.subList(0, batchSize).clear();
		return batch;
	}

}
