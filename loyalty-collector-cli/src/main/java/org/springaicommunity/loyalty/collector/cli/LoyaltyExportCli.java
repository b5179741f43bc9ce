package org.springaicommunity.loyalty.collector.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.loyalty.collector.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Loyalty Collector CLI Application
 *
 * Plain Java command-line application exporting Yotpo loyalty customer profiles into a
 * Treasure Data table. No Spring dependencies - uses ExportPipelineBuilder for wiring.
 *
 * Usage: java -jar loyalty-collector-cli.jar [OPTIONS]
 *
 * Environment Variables: YOTPO_CLIENT_SECRET, YOTPO_STORE_ID, TD_API_KEY
 *
 * Exit codes: 0 when every record was uploaded, 2 when some batches failed or the export
 * was cancelled, 1 on a fatal error or invalid arguments.
 */
public class LoyaltyExportCli {

	private static final Logger logger = LoggerFactory.getLogger(LoyaltyExportCli.class);

	static final int EXIT_SUCCESS = 0;

	static final int EXIT_FATAL = 1;

	static final int EXIT_PARTIAL = 2;

	private static final long SHUTDOWN_GRACE_SECONDS = 30;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != EXIT_SUCCESS) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Export failed: {}", e.getMessage());
			System.exit(EXIT_FATAL);
		}
	}

	public static int run(String[] args) {
		ExportProperties properties = new ExportProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_SUCCESS;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		argumentParser.validateEnvironment(config);
		config.applyTo(properties);

		CancellationSignal cancellation = new CancellationSignal();
		ExportPipelineBuilder builder = ExportPipelineBuilder.create()
			.properties(properties)
			.credentialsFromEnv()
			.cancellation(cancellation);
		return run(config, builder, cancellation);
	}

	/**
	 * Run the export with a prepared builder. A shutdown hook cancels the export on
	 * SIGINT/SIGTERM and gives in-flight uploads time to finish.
	 */
	static int run(ParsedConfiguration config, ExportPipelineBuilder builder, CancellationSignal cancellation) {
		logConfiguration(config);
		ExportPipeline pipeline = builder.cancellation(cancellation).build();

		CountDownLatch finished = new CountDownLatch(1);
		Thread shutdownHook = new Thread(() -> awaitGracefulStop(cancellation, finished), "export-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);
		try {
			PipelineResult result = pipeline.run(config.startCursor);
			logResults(result);
			return exitCodeFor(result);
		}
		catch (FetchFailedException e) {
			logger.error("Export failed: {}", e.getMessage());
			logResults(e.getPartialResult());
			return EXIT_FATAL;
		}
		finally {
			finished.countDown();
			removeShutdownHook(shutdownHook);
		}
	}

	static int exitCodeFor(PipelineResult result) {
		return result.isComplete() ? EXIT_SUCCESS : EXIT_PARTIAL;
	}

	private static void awaitGracefulStop(CancellationSignal cancellation, CountDownLatch finished) {
		if (finished.getCount() == 0) {
			return;
		}
		logger.warn("Shutdown requested, cancelling export and waiting for in-flight uploads...");
		cancellation.cancel();
		try {
			if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
				logger.warn("Uploads still running after {}s, exiting anyway", SHUTDOWN_GRACE_SECONDS);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static void removeShutdownHook(Thread shutdownHook) {
		try {
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
		}
		catch (IllegalStateException e) {
			logger.debug("JVM already shutting down, hook stays registered");
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Store id: {}", config.storeId != null ? config.storeId : "(from environment)");
		logger.info("  Destination: {}/{}.{}", config.destinationEndpoint, config.database, config.table);
		logger.info("  Requests per second: {}", config.requestsPerSecond);
		logger.info("  Upload requests per second: {}",
				config.uploadRequestsPerSecond > 0 ? config.uploadRequestsPerSecond : "unlimited");
		logger.info("  Batch size: {}", config.batchSize);
		logger.info("  Upload workers: {}", config.uploadWorkers);
		logger.info("  Queue capacity: {}", config.uploadQueueCapacity);
		logger.info("  Max attempts: {}", config.maxAttempts);
		logger.info("  Retry delay: {}ms", config.retryDelayMs);
		logger.info("  Timeout: {}s", config.timeoutSeconds);
		logger.info("  Start cursor: {}", config.startCursor != null ? config.startCursor : "(first page)");
	}

	private static void logResults(PipelineResult result) {
		if (result.isComplete()) {
			logger.info("Export completed successfully!");
		}
		else {
			logger.warn("Export finished with problems");
		}
		logger.info("Records fetched: {}", result.recordsFetched());
		logger.info("Records uploaded: {}", result.recordsUploaded());
		if (!result.failures().isEmpty()) {
			logger.warn("Records in failed batches: {}", result.recordsFailed());
		}
		if (!result.sourceExhausted() && result.resumeCursor() != null) {
			logger.info("To continue from the first unread page, run with --cursor {}", result.resumeCursor());
		}
	}

}
