package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration exposing the export pipeline and its collaborators as beans.
 *
 * <p>
 * Credentials come from {@code YOTPO_CLIENT_SECRET}, {@code YOTPO_STORE_ID} and
 * {@code TD_API_KEY}; tuning values from {@code loyalty.export.*} with the same defaults
 * as {@link ExportProperties}.
 */
@Configuration
public class LoyaltyExportConfig {

	@Value("${YOTPO_CLIENT_SECRET}")
	private String sourceSecret;

	@Value("${YOTPO_STORE_ID}")
	private String storeId;

	@Value("${TD_API_KEY}")
	private String destinationApiKey;

	@Value("${loyalty.export.requests-per-second:4.5}")
	private double requestsPerSecond;

	@Value("${loyalty.export.batch-size:100000}")
	private int batchSize;

	@Value("${loyalty.export.upload-workers:2}")
	private int uploadWorkers;

	@Value("${loyalty.export.upload-queue-capacity:2}")
	private int uploadQueueCapacity;

	@Value("${loyalty.export.max-attempts:3}")
	private int maxAttempts;

	@Value("${loyalty.export.database:raw_us_mavi}")
	private String database;

	@Value("${loyalty.export.table:yotpo_customers}")
	private String table;

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public ExportProperties exportProperties() {
		ExportProperties properties = new ExportProperties();
		properties.setStoreId(storeId);
		properties.setRequestsPerSecond(requestsPerSecond);
		properties.setBatchSize(batchSize);
		properties.setUploadWorkers(uploadWorkers);
		properties.setUploadQueueCapacity(uploadQueueCapacity);
		properties.setMaxAttempts(maxAttempts);
		properties.setDatabase(database);
		properties.setTable(table);
		return properties;
	}

	@Bean
	public CancellationSignal cancellationSignal() {
		return new CancellationSignal();
	}

	/**
	 * Shares the context's {@link CancellationSignal}; after a cancelled run this bean
	 * refuses further runs.
	 */
	@Bean
	public ExportPipeline exportPipeline(ExportProperties exportProperties, ObjectMapper objectMapper,
			CancellationSignal cancellationSignal) {
		return ExportPipelineBuilder.create()
			.properties(exportProperties)
			.sourceSecret(sourceSecret)
			.destinationApiKey(destinationApiKey)
			.objectMapper(objectMapper)
			.cancellation(cancellationSignal)
			.build();
	}

}
