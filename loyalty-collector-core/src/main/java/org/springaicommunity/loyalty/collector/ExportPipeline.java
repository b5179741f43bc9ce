package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Streams every page of the source into the destination store.
 *
 * <p>
 * One thread (the caller's) drives the {@link Paginator} and the
 * {@link BatchAccumulator}; the {@link UploadPool} uploads sealed batches in parallel. The
 * run ends once pagination is over and every batch has been attempted:
 * <ul>
 * <li>Upload failures are isolated per batch and reported in the
 * {@link PipelineResult}.</li>
 * <li>A fetch failure stops pagination. Records already read are still sealed and
 * uploaded, then a {@link FetchFailedException} carrying the partial result is
 * thrown.</li>
 * <li>Cancellation stops pagination and new uploads; in-flight uploads finish and the
 * result is returned with {@code cancelled = true}.</li>
 * </ul>
 *
 * <p>
 * Use {@link ExportPipelineBuilder} to create instances. A pipeline may be run more than
 * once; each run uses a fresh paginator and upload pool. The {@link CancellationSignal}
 * cannot be reset, so once a run has ended cancelled the pipeline refuses further runs
 * and a new one must be built.
 */
public class ExportPipeline {

	private static final Logger logger = LoggerFactory.getLogger(ExportPipeline.class);

	private final SourceClient source;

	private final DestinationStore destination;

	private final ObjectMapper objectMapper;

	private final ExportProperties properties;

	private final RateLimiter fetchRateLimiter;

	private final RateLimiter uploadRateLimiter;

	private final RetryPolicy fetchRetryPolicy;

	private final RetryPolicy uploadRetryPolicy;

	private final CancellationSignal cancellation;

	private final Clock clock;

	private volatile boolean endedCancelled;

	ExportPipeline(SourceClient source, DestinationStore destination, ObjectMapper objectMapper,
			ExportProperties properties, RateLimiter fetchRateLimiter, RateLimiter uploadRateLimiter,
			RetryPolicy fetchRetryPolicy, RetryPolicy uploadRetryPolicy, CancellationSignal cancellation,
			Clock clock) {
		this.source = source;
		this.destination = destination;
		this.objectMapper = objectMapper;
		this.properties = properties;
		this.fetchRateLimiter = fetchRateLimiter;
		this.uploadRateLimiter = uploadRateLimiter;
		this.fetchRetryPolicy = fetchRetryPolicy;
		this.uploadRetryPolicy = uploadRetryPolicy;
		this.cancellation = cancellation;
		this.clock = clock;
	}

	/**
	 * Export from the beginning of the stream.
	 * @return aggregate result
	 * @throws FetchFailedException if the source could not be read to the end
	 */
	public PipelineResult run() {
		return run(null);
	}

	/**
	 * Export starting at the given cursor.
	 * @param startCursor cursor of the first page, or {@code null} for the beginning
	 * @return aggregate result
	 * @throws FetchFailedException if the source could not be read to the end
	 * @throws IllegalStateException if an earlier run of this pipeline was cancelled
	 */
	public PipelineResult run(@Nullable String startCursor) {
		if (endedCancelled) {
			throw new IllegalStateException("Export pipeline was cancelled; build a new pipeline to export again");
		}
		long startNanos = System.nanoTime();
		logger.info("Starting export: {} req/s, batch size {}, {} upload workers, queue capacity {}",
				properties.getRequestsPerSecond(), properties.getBatchSize(), properties.getUploadWorkers(),
				properties.getUploadQueueCapacity());
		if (startCursor != null) {
			logger.info("Starting from cursor {}", startCursor);
		}

		Paginator paginator = Paginator.builder()
			.source(source)
			.rateLimiter(fetchRateLimiter)
			.retryPolicy(fetchRetryPolicy)
			.objectMapper(objectMapper)
			.recordsField(properties.getRecordsField())
			.nextCursorPointer(properties.getNextCursorPointer())
			.startCursor(startCursor)
			.cancellation(cancellation)
			.build();

		UploadPool uploadPool = new UploadPool(destination, uploadRetryPolicy, uploadRateLimiter, cancellation,
				properties.getUploadWorkers(), properties.getUploadQueueCapacity());
		uploadPool.start();

		BatchAccumulator accumulator = new BatchAccumulator(properties.getBatchSize(), new FixedBatchStrategy<>(),
				uploadPool, clock);

		RuntimeException fetchFailure = null;
		boolean exhausted = false;
		try {
			while (paginator.hasNext()) {
				Page page = paginator.next();
				accumulator.addAll(page.records());
			}
			exhausted = true;
		}
		catch (PipelineCancelledException e) {
			logger.warn("Export cancelled: {}", e.getMessage());
			cancellation.cancel();
		}
		catch (RuntimeException e) {
			fetchFailure = e;
			logger.error("Fetch failed after {} pages: {}", paginator.pagesFetched(), e.getMessage());
		}
		sealRemainder(accumulator);

		List<BatchFailure> failures = uploadPool.awaitCompletion();

		PipelineResult result = new PipelineResult(paginator.pagesFetched(), paginator.recordsFetched(),
				accumulator.batchesSealed(), uploadPool.batchesUploaded(), uploadPool.recordsUploaded(), failures,
				cancellation.isCancelled(), exhausted, exhausted ? null : paginator.currentCursor(),
				Duration.ofNanos(System.nanoTime() - startNanos));
		endedCancelled = result.cancelled();
		logSummary(result);

		if (fetchFailure != null) {
			throw new FetchFailedException("Export aborted after " + result.pagesFetched() + " pages: "
					+ fetchFailure.getMessage(), result, fetchFailure);
		}
		return result;
	}

	/**
	 * Request cancellation of a running export. The pipeline cannot be run again after a
	 * cancelled run.
	 */
	public void cancel() {
		cancellation.cancel();
	}

	/**
	 * Records read so far must reach the pool even when fetching stopped early; a batch
	 * that cannot be queued is already recorded as failed by the pool.
	 */
	private void sealRemainder(BatchAccumulator accumulator) {
		try {
			accumulator.finish();
		}
		catch (PipelineCancelledException e) {
			logger.warn("Final batch not queued: {}", e.getMessage());
			cancellation.cancel();
		}
	}

	private void logSummary(PipelineResult result) {
		logger.info("Processing completed in {}s:", String.format("%.2f", result.elapsed().toMillis() / 1000.0));
		logger.info("- Pages processed: {}", result.pagesFetched());
		logger.info("- Total records: {}", result.recordsFetched());
		logger.info("- Batches uploaded: {}/{}", result.batchesUploaded(), result.batchesSealed());
		if (!result.failures().isEmpty()) {
			logger.warn("- Failed batches: {} ({} records)", result.failures().size(), result.recordsFailed());
			for (BatchFailure failure : result.failures()) {
				logger.warn("  batch {}: {}", failure.batchNumber(), failure.errorMessage());
			}
		}
		if (result.cancelled()) {
			logger.warn("Export was cancelled before the source was exhausted");
		}
	}

}
