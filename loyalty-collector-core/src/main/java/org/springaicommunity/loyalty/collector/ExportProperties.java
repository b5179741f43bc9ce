package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;

/**
 * Configuration properties for a loyalty profile export.
 *
 * <p>
 * Properties can be set directly via setters, through {@link ArgumentParser}, or passed
 * to {@link ExportPipelineBuilder}. Defaults target the Yotpo core v3 customers endpoint
 * (5 requests per second hard limit) and a Treasure Data table holding the raw JSON.
 * Credentials are not part of the properties; they are passed to the builder.
 */
public class ExportProperties {

	/**
	 * Sustained request ceiling for the source API (requests per second).
	 */
	private double requestsPerSecond = 4.5;

	/**
	 * Request ceiling for the destination store (requests per second). Zero or less
	 * disables upload rate limiting.
	 */
	private double uploadRequestsPerSecond = 0;

	/**
	 * Maximum number of records per uploaded batch.
	 */
	private int batchSize = 100_000;

	/**
	 * Number of concurrent upload workers.
	 */
	private int uploadWorkers = 2;

	/**
	 * Number of sealed batches that may wait for a free worker before fetching blocks.
	 */
	private int uploadQueueCapacity = 2;

	/**
	 * Total attempts per request or upload, including the first one.
	 */
	private int maxAttempts = 3;

	/**
	 * Base backoff in milliseconds; doubles for every further attempt.
	 */
	private long retryDelayMs = 2000;

	/**
	 * Upper bound of the random jitter added to each backoff, in milliseconds.
	 */
	private long maxJitterMs = 250;

	/**
	 * Connect and request timeout for both remote services, in seconds.
	 */
	private int requestTimeoutSeconds = 30;

	/**
	 * Base URL of the source API.
	 */
	private String sourceBaseUrl = "https://api.yotpo.com/core/v3";

	/**
	 * Store identifier in the source API.
	 */
	private @Nullable String storeId;

	/**
	 * Page size requested on the first page.
	 */
	private int pageLimit = 100;

	/**
	 * Name of the array holding the records in a page.
	 */
	private String recordsField = "customers";

	/**
	 * JSON pointer to the next cursor in a page.
	 */
	private String nextCursorPointer = "/pagination/next_page_info";

	/**
	 * Base URL of the destination import endpoint.
	 */
	private String destinationEndpoint = "https://us01.records.in.treasuredata.com";

	/**
	 * Destination database.
	 */
	private String database = "raw_us_mavi";

	/**
	 * Destination table.
	 */
	private String table = "yotpo_customers";

	/**
	 * Column receiving the raw record serialized as compact JSON.
	 */
	private String payloadField = "json_response";

	/**
	 * Column receiving the ingestion time in Unix seconds.
	 */
	private String timeField = "time";

	public double getRequestsPerSecond() {
		return requestsPerSecond;
	}

	public void setRequestsPerSecond(double requestsPerSecond) {
		this.requestsPerSecond = requestsPerSecond;
	}

	public double getUploadRequestsPerSecond() {
		return uploadRequestsPerSecond;
	}

	public void setUploadRequestsPerSecond(double uploadRequestsPerSecond) {
		this.uploadRequestsPerSecond = uploadRequestsPerSecond;
	}

	public int getBatchSize() {
		return batchSize;
	}

	public void setBatchSize(int batchSize) {
		this.batchSize = batchSize;
	}

	public int getUploadWorkers() {
		return uploadWorkers;
	}

	public void setUploadWorkers(int uploadWorkers) {
		this.uploadWorkers = uploadWorkers;
	}

	public int getUploadQueueCapacity() {
		return uploadQueueCapacity;
	}

	public void setUploadQueueCapacity(int uploadQueueCapacity) {
		this.uploadQueueCapacity = uploadQueueCapacity;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	public long getRetryDelayMs() {
		return retryDelayMs;
	}

	public void setRetryDelayMs(long retryDelayMs) {
		this.retryDelayMs = retryDelayMs;
	}

	public long getMaxJitterMs() {
		return maxJitterMs;
	}

	public void setMaxJitterMs(long maxJitterMs) {
		this.maxJitterMs = maxJitterMs;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public String getSourceBaseUrl() {
		return sourceBaseUrl;
	}

	public void setSourceBaseUrl(String sourceBaseUrl) {
		this.sourceBaseUrl = sourceBaseUrl;
	}

	public @Nullable String getStoreId() {
		return storeId;
	}

	public void setStoreId(@Nullable String storeId) {
		this.storeId = storeId;
	}

	public int getPageLimit() {
		return pageLimit;
	}

	public void setPageLimit(int pageLimit) {
		this.pageLimit = pageLimit;
	}

	public String getRecordsField() {
		return recordsField;
	}

	public void setRecordsField(String recordsField) {
		this.recordsField = recordsField;
	}

	public String getNextCursorPointer() {
		return nextCursorPointer;
	}

	public void setNextCursorPointer(String nextCursorPointer) {
		this.nextCursorPointer = nextCursorPointer;
	}

	public String getDestinationEndpoint() {
		return destinationEndpoint;
	}

	public void setDestinationEndpoint(String destinationEndpoint) {
		this.destinationEndpoint = destinationEndpoint;
	}

	public String getDatabase() {
		return database;
	}

	public void setDatabase(String database) {
		this.database = database;
	}

	public String getTable() {
		return table;
	}

	public void setTable(String table) {
		this.table = table;
	}

	public String getPayloadField() {
		return payloadField;
	}

	public void setPayloadField(String payloadField) {
		this.payloadField = payloadField;
	}

	public String getTimeField() {
		return timeField;
	}

	public void setTimeField(String timeField) {
		this.timeField = timeField;
	}

	@Override
	public String toString() {
		return "ExportProperties{" + "requestsPerSecond=" + requestsPerSecond + ", uploadRequestsPerSecond="
				+ uploadRequestsPerSecond + ", batchSize=" + batchSize + ", uploadWorkers=" + uploadWorkers
				+ ", uploadQueueCapacity=" + uploadQueueCapacity + ", maxAttempts=" + maxAttempts + ", retryDelayMs="
				+ retryDelayMs + ", storeId='" + storeId + '\'' + ", database='" + database + '\'' + ", table='"
				+ table + '\'' + '}';
	}

}
