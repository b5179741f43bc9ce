package org.springaicommunity.loyalty.collector;

import java.util.List;

/**
 * Strategy interface for cutting batches from pending items.
 *
 * @param <T> the type of items being batched
 */
public interface BatchStrategy<T> {

	/**
	 * Create a batch from pending items. Items included in the batch are removed from the
	 * pendingItems list; the relative order of all items is preserved.
	 * @param pendingItems mutable list of pending items (will be modified)
	 * @param maxBatchSize maximum number of items to include in the batch
	 * @return list of items for the current batch
	 */
	List<T> createBatch(List<T> pendingItems, int maxBatchSize);

}
