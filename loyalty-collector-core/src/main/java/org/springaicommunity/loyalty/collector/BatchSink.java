package org.springaicommunity.loyalty.collector;

/**
 * Receives sealed batches. May block to apply backpressure.
 */
@FunctionalInterface
public interface BatchSink {

	void accept(Batch batch);

}
