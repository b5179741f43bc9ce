package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Rate limiting
	public double requestsPerSecond;

	public double uploadRequestsPerSecond;

	// Batching and upload concurrency
	public int batchSize;

	public int uploadWorkers;

	public int uploadQueueCapacity;

	// Retry and timeouts
	public int maxAttempts;

	public long retryDelayMs;

	public int timeoutSeconds;

	// Source and destination
	public @Nullable String storeId;

	public String destinationEndpoint;

	public String database;

	public String table;

	// Cursor of the first page; null starts at the beginning of the stream
	public @Nullable String startCursor = null;

	public boolean helpRequested = false;

	public ParsedConfiguration(ExportProperties defaultProperties) {
		this.requestsPerSecond = defaultProperties.getRequestsPerSecond();
		this.uploadRequestsPerSecond = defaultProperties.getUploadRequestsPerSecond();
		this.batchSize = defaultProperties.getBatchSize();
		this.uploadWorkers = defaultProperties.getUploadWorkers();
		this.uploadQueueCapacity = defaultProperties.getUploadQueueCapacity();
		this.maxAttempts = defaultProperties.getMaxAttempts();
		this.retryDelayMs = defaultProperties.getRetryDelayMs();
		this.timeoutSeconds = defaultProperties.getRequestTimeoutSeconds();
		this.storeId = defaultProperties.getStoreId();
		this.destinationEndpoint = defaultProperties.getDestinationEndpoint();
		this.database = defaultProperties.getDatabase();
		this.table = defaultProperties.getTable();
	}

	/**
	 * Copy the parsed values onto the given properties.
	 * @param properties properties to update
	 * @return the same properties instance
	 */
	public ExportProperties applyTo(ExportProperties properties) {
		properties.setRequestsPerSecond(requestsPerSecond);
		properties.setUploadRequestsPerSecond(uploadRequestsPerSecond);
		properties.setBatchSize(batchSize);
		properties.setUploadWorkers(uploadWorkers);
		properties.setUploadQueueCapacity(uploadQueueCapacity);
		properties.setMaxAttempts(maxAttempts);
		properties.setRetryDelayMs(retryDelayMs);
		properties.setRequestTimeoutSeconds(timeoutSeconds);
		properties.setStoreId(storeId);
		properties.setDestinationEndpoint(destinationEndpoint);
		properties.setDatabase(database);
		properties.setTable(table);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "requestsPerSecond=" + requestsPerSecond + ", uploadRequestsPerSecond="
				+ uploadRequestsPerSecond + ", batchSize=" + batchSize + ", uploadWorkers=" + uploadWorkers
				+ ", uploadQueueCapacity=" + uploadQueueCapacity + ", maxAttempts=" + maxAttempts + ", retryDelayMs="
				+ retryDelayMs + ", timeoutSeconds=" + timeoutSeconds + ", storeId='" + storeId + '\''
				+ ", destinationEndpoint='" + destinationEndpoint + '\'' + ", database='" + database + '\''
				+ ", table='" + table + '\'' + ", startCursor='" + startCursor + '\'' + ", helpRequested="
				+ helpRequested + '}';
	}

}
