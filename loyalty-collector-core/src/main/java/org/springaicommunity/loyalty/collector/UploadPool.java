package org.springaicommunity.loyalty.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed pool of upload workers fed through a bounded queue.
 *
 * <p>
 * {@link #submit(Batch)} blocks while the queue is full, which throttles the producer.
 * Each worker uploads one batch at a time under the {@link RetryPolicy}; a batch that
 * still fails is recorded as a {@link BatchFailure} and the worker moves on to the next
 * one. Once cancelled, no new upload is started: batches that are submitted or still
 * queued are recorded as cancelled failures, so every submitted record ends up either
 * uploaded or in a failure entry. An {@link Error} thrown by the store fails its batch and
 * cancels the export.
 */
public class UploadPool implements BatchSink {

	private static final Logger logger = LoggerFactory.getLogger(UploadPool.class);

	private static final Batch END_OF_STREAM = new Batch(-1, List.of(), 0);

	private static final long STOP_GRACE_SECONDS = 10;

	private final DestinationStore store;

	private final RetryPolicy retryPolicy;

	private final RateLimiter rateLimiter;

	private final CancellationSignal cancellation;

	private final int workerCount;

	private final BlockingQueue<Batch> queue;

	private final Queue<BatchFailure> failures = new ConcurrentLinkedQueue<>();

	private final AtomicInteger batchesSubmitted = new AtomicInteger();

	private final AtomicInteger batchesUploaded = new AtomicInteger();

	private final AtomicLong recordsUploaded = new AtomicLong();

	private ExecutorService workers;

	private boolean inputClosed;

	public UploadPool(DestinationStore store, RetryPolicy retryPolicy, RateLimiter rateLimiter,
			CancellationSignal cancellation, int workerCount, int queueCapacity) {
		if (workerCount <= 0) {
			throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
		}
		if (queueCapacity <= 0) {
			throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
		}
		this.store = store;
		this.retryPolicy = retryPolicy;
		this.rateLimiter = rateLimiter;
		this.cancellation = cancellation;
		this.workerCount = workerCount;
		this.queue = new ArrayBlockingQueue<>(queueCapacity);
	}

	/**
	 * Start the workers. Must be called once before the first {@link #submit(Batch)}.
	 */
	public synchronized void start() {
		if (workers != null) {
			throw new IllegalStateException("Upload pool already started");
		}
		AtomicInteger threadIndex = new AtomicInteger();
		workers = Executors.newFixedThreadPool(workerCount, r -> {
			Thread t = new Thread(r, "upload-worker-" + threadIndex.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
		for (int i = 0; i < workerCount; i++) {
			workers.submit(this::workerLoop);
		}
		logger.debug("Started {} upload workers (queue capacity {})", workerCount, queue.remainingCapacity());
	}

	@Override
	public void accept(Batch batch) {
		submit(batch);
	}

	/**
	 * Queue a sealed batch for upload, blocking while the queue is full.
	 * @param batch the batch
	 * @throws PipelineCancelledException if interrupted while waiting for queue space;
	 * the batch is recorded as failed
	 */
	public void submit(Batch batch) {
		if (workers == null) {
			throw new IllegalStateException("Upload pool not started");
		}
		if (inputClosed) {
			throw new IllegalStateException("Upload pool no longer accepts batches");
		}

		batchesSubmitted.incrementAndGet();
		if (cancellation.isCancelled()) {
			recordFailure(batch, new PipelineCancelledException("Batch " + batch.batchNumber() + " not started"));
			return;
		}

		try {
			if (queue.remainingCapacity() == 0) {
				logger.info("Upload queue full ({} batches), waiting...", queue.size());
			}
			queue.put(batch);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			PipelineCancelledException cancelled = new PipelineCancelledException(
					"Interrupted while queueing batch " + batch.batchNumber(), e);
			recordFailure(batch, cancelled);
			throw cancelled;
		}
	}

	/**
	 * Signal that no more batches will be submitted and block until every queued batch
	 * has been attempted.
	 * @return all batch failures ordered by batch number; empty means full success
	 */
	public List<BatchFailure> awaitCompletion() {
		if (workers == null) {
			throw new IllegalStateException("Upload pool not started");
		}
		if (!inputClosed) {
			inputClosed = true;
			logger.info("Waiting for all uploads to complete...");
			try {
				for (int i = 0; i < workerCount; i++) {
					queue.put(END_OF_STREAM);
				}
				workers.shutdown();
				while (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
					logger.info("Still uploading: {} batches queued", queue.size());
				}
			}
			catch (InterruptedException e) {
				logger.warn("Interrupted while waiting for uploads, stopping workers");
				workers.shutdownNow();
				awaitWorkersStopped();
				Thread.currentThread().interrupt();
			}
			drainUnstarted();
		}

		List<BatchFailure> result = new ArrayList<>(failures);
		result.sort(Comparator.comparingInt(BatchFailure::batchNumber));
		return result;
	}

	public int batchesSubmitted() {
		return batchesSubmitted.get();
	}

	public int batchesUploaded() {
		return batchesUploaded.get();
	}

	public long recordsUploaded() {
		return recordsUploaded.get();
	}

	private void workerLoop() {
		while (true) {
			Batch batch;
			try {
				batch = queue.take();
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
			if (batch == END_OF_STREAM) {
				return;
			}
			upload(batch);
		}
	}

	private void upload(Batch batch) {
		if (cancellation.isCancelled()) {
			recordFailure(batch, new PipelineCancelledException("Batch " + batch.batchNumber() + " not started"));
			return;
		}

		String operation = "Upload batch " + batch.batchNumber() + " (" + batch.size() + " records)";
		long start = System.currentTimeMillis();
		try {
			retryPolicy.execute(operation, () -> {
				rateLimiter.acquire();
				store.importBatch(batch);
				return null;
			});
			batchesUploaded.incrementAndGet();
			recordsUploaded.addAndGet(batch.size());
			logger.info("Successfully uploaded batch {} ({} records) in {}ms", batch.batchNumber(), batch.size(),
					System.currentTimeMillis() - start);
		}
		catch (RuntimeException e) {
			recordFailure(batch, e);
		}
		catch (Error e) {
			// The worker keeps draining so queued batches are still accounted for
			recordFailure(batch, e);
			logger.error("Fatal error while uploading batch {}, cancelling the export", batch.batchNumber(), e);
			cancellation.cancel();
		}
	}

	/**
	 * In-flight uploads record their own outcome once interrupted; wait for that before
	 * the queue is drained.
	 */
	private void awaitWorkersStopped() {
		try {
			if (!workers.awaitTermination(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
				logger.warn("Upload workers still running {}s after being stopped", STOP_GRACE_SECONDS);
			}
		}
		catch (InterruptedException e) {
			logger.warn("Interrupted again while stopping upload workers");
		}
	}

	private void drainUnstarted() {
		List<Batch> leftovers = new ArrayList<>();
		queue.drainTo(leftovers);
		for (Batch batch : leftovers) {
			if (batch != END_OF_STREAM) {
				recordFailure(batch, new PipelineCancelledException("Batch " + batch.batchNumber() + " not started"));
			}
		}
	}

	private void recordFailure(Batch batch, Throwable error) {
		failures.add(new BatchFailure(batch.batchNumber(), batch.size(), error));
		if (error instanceof PipelineCancelledException) {
			logger.warn("Batch {} ({} records) skipped: {}", batch.batchNumber(), batch.size(), error.getMessage());
		}
		else {
			logger.error("Failed to upload batch {} ({} records): {}", batch.batchNumber(), batch.size(),
					error.getMessage());
		}
	}

}
