package org.springaicommunity.loyalty.collector;

/**
 * Interface for the analytics store that receives the batches.
 */
public interface DestinationStore {

	/**
	 * Append one batch. Must not partially apply a batch that then reports failure.
	 * @param batch sealed batch
	 * @throws RemoteServiceException if the store rejects or cannot be reached
	 */
	void importBatch(Batch batch);

}
