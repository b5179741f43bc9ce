package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link DestinationStore} writing to the Treasure Data JSON import endpoint.
 *
 * <p>
 * Each record becomes one row: the raw payload serialized as compact JSON plus the
 * batch's ingestion time. A batch is sent in a single request, so the store either
 * accepts all of it or reports a failure.
 */
public class TreasureDataClient implements DestinationStore {

	private static final Logger logger = LoggerFactory.getLogger(TreasureDataClient.class);

	private static final String SERVICE_NAME = "Treasure Data";

	static final String CONTENT_TYPE = "application/vnd.treasuredata.v1+json";

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final URI importUri;

	private final String apiKey;

	private final String payloadField;

	private final String timeField;

	private final Duration requestTimeout;

	public TreasureDataClient(ExportProperties properties, String apiKey, ObjectMapper objectMapper) {
		this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
		this.httpClient = HttpSupport.newClient(requestTimeout);
		this.objectMapper = objectMapper;
		String endpoint = properties.getDestinationEndpoint();
		if (endpoint.endsWith("/")) {
			endpoint = endpoint.substring(0, endpoint.length() - 1);
		}
		this.importUri = URI.create(endpoint + "/" + encode(properties.getDatabase()) + "/"
				+ encode(properties.getTable()));
		this.apiKey = apiKey;
		this.payloadField = properties.getPayloadField();
		this.timeField = properties.getTimeField();
	}

	@Override
	public void importBatch(Batch batch) {
		if (batch.records().isEmpty()) {
			logger.warn("Batch {}: no records to upload", batch.batchNumber());
			return;
		}

		String body = toRequestBody(batch);
		logger.debug("POST {} batch {} ({} records, {} bytes)", importUri, batch.batchNumber(), batch.size(),
				body.length());

		HttpRequest request = HttpRequest.newBuilder()
			.uri(importUri)
			.timeout(requestTimeout)
			.header("Authorization", "TD1 " + apiKey)
			.header("Content-Type", CONTENT_TYPE)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		HttpSupport.ensureSuccess(HttpSupport.send(httpClient, request), SERVICE_NAME);
	}

	String toRequestBody(Batch batch) {
		ObjectNode root = objectMapper.createObjectNode();
		ArrayNode rows = root.putArray("records");
		try {
			for (IngestedRecord record : batch.records()) {
				rows.addObject()
					.put(payloadField, objectMapper.writeValueAsString(record.payload()))
					.put(timeField, record.ingestedAt());
			}
			return objectMapper.writeValueAsString(root);
		}
		catch (JsonProcessingException e) {
			throw new CollectorException("Failed to serialize batch " + batch.batchNumber(), e);
		}
	}

	URI getImportUri() {
		return importUri;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

}
