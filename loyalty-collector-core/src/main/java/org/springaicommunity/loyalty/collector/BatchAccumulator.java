package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups records into batches of at most {@code maxBatchSize} and hands each sealed batch
 * to a {@link BatchSink}.
 *
 * <p>
 * Records keep their arrival order within and across batches. All records of a batch get
 * the same ingestion timestamp, taken when the batch is sealed. Used by a single thread.
 */
public class BatchAccumulator {

	private static final Logger logger = LoggerFactory.getLogger(BatchAccumulator.class);

	private final int maxBatchSize;

	private final BatchStrategy<JsonNode> batchStrategy;

	private final BatchSink sink;

	private final Clock clock;

	private final List<JsonNode> pending = new ArrayList<>();

	private int batchesSealed;

	private long recordsAccepted;

	private boolean finished;

	public BatchAccumulator(int maxBatchSize, BatchStrategy<JsonNode> batchStrategy, BatchSink sink, Clock clock) {
		if (maxBatchSize <= 0) {
			throw new IllegalArgumentException("Batch size must be positive: " + maxBatchSize);
		}
		this.maxBatchSize = maxBatchSize;
		this.batchStrategy = batchStrategy;
		this.sink = sink;
		this.clock = clock;
	}

	/**
	 * Append a record, sealing the open batch once it is full.
	 * @param record raw record
	 */
	public void add(JsonNode record) {
		if (finished) {
			throw new IllegalStateException("Accumulator already finished");
		}
		pending.add(record);
		recordsAccepted++;
		if (pending.size() >= maxBatchSize) {
			seal();
		}
	}

	public void addAll(List<JsonNode> records) {
		for (JsonNode record : records) {
			add(record);
		}
	}

	/**
	 * Seal whatever is left as a final, possibly smaller batch. Does nothing for an empty
	 * remainder. Safe to call more than once.
	 */
	public void finish() {
		if (finished) {
			return;
		}
		finished = true;
		if (!pending.isEmpty()) {
			logger.info("Sealing final batch with {} records", pending.size());
			seal();
		}
	}

	public int batchesSealed() {
		return batchesSealed;
	}

	public long recordsAccepted() {
		return recordsAccepted;
	}

	private void seal() {
		List<JsonNode> payloads = batchStrategy.createBatch(pending, maxBatchSize);
		long ingestedAt = clock.instant().getEpochSecond();

		List<IngestedRecord> records = new ArrayList<>(payloads.size());
		for (JsonNode payload : payloads) {
			records.add(new IngestedRecord(payload, ingestedAt));
		}

		Batch batch = new Batch(++batchesSealed, records, ingestedAt);
		logger.info("Submitting batch {} with {} records for upload", batch.batchNumber(), batch.size());
		sink.accept(batch);
	}

}
