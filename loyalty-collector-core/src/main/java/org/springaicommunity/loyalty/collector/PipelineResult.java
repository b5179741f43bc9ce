package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one export run.
 *
 * <p>
 * A non-empty failure list is a partial success: those batches were read from the source
 * but never written. Deciding whether to re-run is up to the caller.
 *
 * @param pagesFetched pages successfully read from the source
 * @param recordsFetched records contained in those pages
 * @param batchesSealed batches handed to the upload pool
 * @param batchesUploaded batches written to the destination store
 * @param recordsUploaded records contained in the uploaded batches
 * @param failures batches that were not written, ordered by batch number
 * @param cancelled true if the run was cancelled before the source was exhausted
 * @param sourceExhausted true if pagination reached the end of the stream
 * @param resumeCursor cursor of the first page not read, when the source was not
 * exhausted ({@code null} if that is the first page)
 * @param elapsed wall-clock duration of the run
 */
public record PipelineResult(int pagesFetched, long recordsFetched, int batchesSealed, int batchesUploaded,
		long recordsUploaded, List<BatchFailure> failures, boolean cancelled, boolean sourceExhausted,
		@Nullable String resumeCursor, Duration elapsed) {

	public PipelineResult {
		failures = List.copyOf(failures);
	}

	/**
	 * Returns true if the whole stream was read and every batch was uploaded.
	 */
	public boolean isComplete() {
		return sourceExhausted && !cancelled && failures.isEmpty();
	}

	/**
	 * Records that were read but are held by failed batches.
	 */
	public long recordsFailed() {
		return failures.stream().mapToLong(BatchFailure::recordCount).sum();
	}

}
