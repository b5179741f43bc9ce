package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Builder for creating an {@link ExportPipeline} without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Credentials from .env or the environment
 * ExportPipeline pipeline = ExportPipelineBuilder.create()
 *     .credentialsFromEnv()
 *     .build();
 *
 * // With custom configuration
 * ExportProperties props = new ExportProperties();
 * props.setBatchSize(50_000);
 * props.setUploadWorkers(4);
 *
 * ExportPipeline pipeline = ExportPipelineBuilder.create()
 *     .storeId("store-123")
 *     .sourceSecret("secret")
 *     .destinationApiKey("td-key")
 *     .properties(props)
 *     .build();
 *
 * PipelineResult result = pipeline.run();
 *
 * // For testing with in-memory collaborators
 * ExportPipeline testPipeline = ExportPipelineBuilder.create()
 *     .sourceClient(fakeSource)
 *     .destinationStore(fakeStore)
 *     .build();
 * }
 * </pre>
 */
public class ExportPipelineBuilder {

	static final String SOURCE_SECRET_ENV = "YOTPO_CLIENT_SECRET";

	static final String STORE_ID_ENV = "YOTPO_STORE_ID";

	static final String DESTINATION_API_KEY_ENV = "TD_API_KEY";

	private ExportProperties properties;

	private @Nullable String sourceSecret;

	private @Nullable String destinationApiKey;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable SourceClient sourceClient;

	private @Nullable DestinationStore destinationStore;

	private @Nullable CancellationSignal cancellation;

	private @Nullable Clock clock;

	private Consumer<RetryAttempt> retryListener = attempt -> {
	};

	private ExportPipelineBuilder() {
		this.properties = new ExportProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ExportPipelineBuilder
	 */
	public static ExportPipelineBuilder create() {
		return new ExportPipelineBuilder();
	}

	/**
	 * Set export properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ExportPipelineBuilder properties(@Nullable ExportProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set the source store id. Shortcut for {@link ExportProperties#setStoreId(String)}.
	 * @param storeId store identifier
	 * @return this builder
	 */
	public ExportPipelineBuilder storeId(String storeId) {
		this.properties.setStoreId(storeId);
		return this;
	}

	/**
	 * Set the secret exchanged for a source API access token.
	 * @param secret client secret
	 * @return this builder
	 */
	public ExportPipelineBuilder sourceSecret(String secret) {
		this.sourceSecret = secret;
		return this;
	}

	/**
	 * Set the API key of the destination store.
	 * @param apiKey destination API key
	 * @return this builder
	 */
	public ExportPipelineBuilder destinationApiKey(String apiKey) {
		this.destinationApiKey = apiKey;
		return this;
	}

	/**
	 * Read credentials from {@code YOTPO_CLIENT_SECRET}, {@code TD_API_KEY} and, unless a
	 * store id is already configured, {@code YOTPO_STORE_ID}.
	 * @return this builder
	 * @throws IllegalStateException if a variable is missing
	 */
	public ExportPipelineBuilder credentialsFromEnv() {
		this.sourceSecret = EnvironmentSupport.require(SOURCE_SECRET_ENV);
		this.destinationApiKey = EnvironmentSupport.require(DESTINATION_API_KEY_ENV);
		if (isBlank(properties.getStoreId())) {
			properties.setStoreId(EnvironmentSupport.require(STORE_ID_ENV));
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ExportPipelineBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom SourceClient. When set, source credentials are not required.
	 * @param sourceClient custom source (null to use the HTTP client)
	 * @return this builder
	 */
	public ExportPipelineBuilder sourceClient(@Nullable SourceClient sourceClient) {
		this.sourceClient = sourceClient;
		return this;
	}

	/**
	 * Set a custom DestinationStore. When set, the destination API key is not required.
	 * @param destinationStore custom store (null to use the HTTP client)
	 * @return this builder
	 */
	public ExportPipelineBuilder destinationStore(@Nullable DestinationStore destinationStore) {
		this.destinationStore = destinationStore;
		return this;
	}

	/**
	 * Share a cancellation signal with the caller, e.g. a shutdown hook.
	 * @param cancellation signal (null to create a private one)
	 * @return this builder
	 */
	public ExportPipelineBuilder cancellation(@Nullable CancellationSignal cancellation) {
		this.cancellation = cancellation;
		return this;
	}

	/**
	 * Clock used for ingestion timestamps.
	 * @param clock clock (null for the system UTC clock)
	 * @return this builder
	 */
	public ExportPipelineBuilder clock(@Nullable Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Observe every retried fetch or upload attempt.
	 * @param retryListener listener
	 * @return this builder
	 */
	public ExportPipelineBuilder retryListener(Consumer<RetryAttempt> retryListener) {
		this.retryListener = retryListener;
		return this;
	}

	/**
	 * Build the pipeline.
	 * @return configured ExportPipeline
	 * @throws IllegalStateException if credentials are missing or properties are invalid
	 */
	public ExportPipeline build() {
		validateProperties();
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		CancellationSignal signal = this.cancellation != null ? this.cancellation : new CancellationSignal();

		SourceClient source = this.sourceClient != null ? this.sourceClient : buildSourceClient(mapper);
		DestinationStore destination = this.destinationStore != null ? this.destinationStore
				: buildDestinationStore(mapper);

		RateLimiter fetchLimiter = new TokenBucketRateLimiter(properties.getRequestsPerSecond());
		RateLimiter uploadLimiter = properties.getUploadRequestsPerSecond() > 0
				? new TokenBucketRateLimiter(properties.getUploadRequestsPerSecond()) : RateLimiter.unlimited();

		return new ExportPipeline(source, destination, mapper, properties, fetchLimiter, uploadLimiter,
				buildRetryPolicy(signal), buildRetryPolicy(signal), signal,
				this.clock != null ? this.clock : Clock.systemUTC());
	}

	private SourceClient buildSourceClient(ObjectMapper mapper) {
		if (isBlank(properties.getStoreId())) {
			throw new IllegalStateException("Source store id is required. Call storeId() or credentialsFromEnv() first.");
		}
		if (isBlank(sourceSecret)) {
			throw new IllegalStateException(
					"Source secret is required. Call sourceSecret() or credentialsFromEnv() first.");
		}
		return new YotpoHttpClient(properties, properties.getStoreId(), sourceSecret, mapper);
	}

	private DestinationStore buildDestinationStore(ObjectMapper mapper) {
		if (isBlank(destinationApiKey)) {
			throw new IllegalStateException(
					"Destination API key is required. Call destinationApiKey() or credentialsFromEnv() first.");
		}
		return new TreasureDataClient(properties, destinationApiKey, mapper);
	}

	private RetryPolicy buildRetryPolicy(CancellationSignal signal) {
		return RetryPolicy.builder()
			.maxAttempts(properties.getMaxAttempts())
			.baseDelay(Duration.ofMillis(properties.getRetryDelayMs()))
			.maxJitter(Duration.ofMillis(properties.getMaxJitterMs()))
			.cancellation(signal)
			.listener(retryListener)
			.build();
	}

	private void validateProperties() {
		if (!(properties.getRequestsPerSecond() > 0)) {
			throw new IllegalStateException("requestsPerSecond must be positive: " + properties.getRequestsPerSecond());
		}
		if (properties.getBatchSize() <= 0) {
			throw new IllegalStateException("batchSize must be positive: " + properties.getBatchSize());
		}
		if (properties.getUploadWorkers() <= 0) {
			throw new IllegalStateException("uploadWorkers must be positive: " + properties.getUploadWorkers());
		}
		if (properties.getUploadQueueCapacity() <= 0) {
			throw new IllegalStateException(
					"uploadQueueCapacity must be positive: " + properties.getUploadQueueCapacity());
		}
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.trim().isEmpty();
	}

}
