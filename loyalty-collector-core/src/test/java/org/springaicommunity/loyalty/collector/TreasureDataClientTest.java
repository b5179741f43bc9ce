package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TreasureDataClient} against an in-process HTTP server.
 */
@DisplayName("TreasureDataClient Tests")
class TreasureDataClientTest {

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private HttpServer server;

	private final List<String> paths = new CopyOnWriteArrayList<>();

	private final List<Headers> headers = new CopyOnWriteArrayList<>();

	private final List<String> bodies = new CopyOnWriteArrayList<>();

	private final AtomicInteger status = new AtomicInteger(200);

	private ExportProperties properties;

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/", exchange -> {
			paths.add(exchange.getRequestURI().getRawPath());
			headers.add(exchange.getRequestHeaders());
			bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
			if (status.get() == 503) {
				exchange.getResponseHeaders().add("Retry-After", "3");
			}
			byte[] response = "{}".getBytes(StandardCharsets.UTF_8);
			exchange.sendResponseHeaders(status.get(), response.length);
			exchange.getResponseBody().write(response);
			exchange.close();
		});
		server.start();

		properties = new ExportProperties();
		properties.setDestinationEndpoint("http://127.0.0.1:" + server.getAddress().getPort() + "/");
		properties.setDatabase("raw_us_mavi");
		properties.setTable("yotpo_customers");
		properties.setRequestTimeoutSeconds(5);
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	private Batch batch(int size) {
		List<IngestedRecord> records = new CopyOnWriteArrayList<>();
		for (int i = 0; i < size; i++) {
			records.add(new IngestedRecord(objectMapper.createObjectNode()
				.put("id", i)
				.put("email", "customer" + i + "@example.com")
				.set("loyalty", objectMapper.createObjectNode().put("points", 10 * i)), 1_714_557_600L));
		}
		return new Batch(1, records, 1_714_557_600L);
	}

	@Test
	@DisplayName("Should post the batch to database/table with the import headers")
	void shouldPostBatchWithHeaders() {
		new TreasureDataClient(properties, "td-key", objectMapper).importBatch(batch(2));

		assertThat(paths).containsExactly("/raw_us_mavi/yotpo_customers");
		assertThat(headers.get(0).getFirst("Authorization")).isEqualTo("TD1 td-key");
		assertThat(headers.get(0).getFirst("Content-Type")).isEqualTo(TreasureDataClient.CONTENT_TYPE);
	}

	@Test
	@DisplayName("Each record should become a row with compact JSON and the ingestion time")
	void shouldSerializeRows() throws Exception {
		new TreasureDataClient(properties, "td-key", objectMapper).importBatch(batch(2));

		JsonNode body = objectMapper.readTree(bodies.get(0));
		JsonNode rows = body.get("records");
		assertThat(rows).hasSize(2);
		assertThat(rows.get(1).get("time").asLong()).isEqualTo(1_714_557_600L);
		String payload = rows.get(1).get("json_response").asText();
		assertThat(payload).isEqualTo("{\"id\":1,\"email\":\"customer1@example.com\",\"loyalty\":{\"points\":10}}");
	}

	@Test
	@DisplayName("Should use configured column names")
	void shouldUseConfiguredColumns() throws Exception {
		properties.setPayloadField("raw");
		properties.setTimeField("ingested_at");

		new TreasureDataClient(properties, "td-key", objectMapper).importBatch(batch(1));

		JsonNode row = objectMapper.readTree(bodies.get(0)).get("records").get(0);
		assertThat(row.has("raw")).isTrue();
		assertThat(row.has("ingested_at")).isTrue();
		assertThat(row.has("json_response")).isFalse();
	}

	@Test
	@DisplayName("An empty batch should not be sent")
	void emptyBatchShouldNotBeSent() {
		new TreasureDataClient(properties, "td-key", objectMapper).importBatch(new Batch(1, List.of(), 0));

		assertThat(paths).isEmpty();
	}

	@Test
	@DisplayName("A 503 should be retryable with its Retry-After hint")
	void unavailableShouldBeRetryable() {
		status.set(503);
		TreasureDataClient client = new TreasureDataClient(properties, "td-key", objectMapper);

		assertThatThrownBy(() -> client.importBatch(batch(1))).isInstanceOfSatisfying(RemoteServiceException.class,
				e -> {
					assertThat(e.getStatusCode()).isEqualTo(503);
					assertThat(e.isRetryable()).isTrue();
					assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(3));
					assertThat(e.getEndpoint()).contains("/raw_us_mavi/yotpo_customers");
				});
	}

	@Test
	@DisplayName("A 401 should not be retryable")
	void unauthorizedShouldNotBeRetryable() {
		status.set(401);
		TreasureDataClient client = new TreasureDataClient(properties, "bad-key", objectMapper);

		assertThatThrownBy(() -> client.importBatch(batch(1))).isInstanceOfSatisfying(RemoteServiceException.class,
				e -> assertThat(e.isRetryable()).isFalse());
	}

	@Test
	@DisplayName("Should encode database and table names in the path")
	void shouldEncodePathSegments() {
		properties.setTable("customers export");

		TreasureDataClient client = new TreasureDataClient(properties, "td-key", objectMapper);

		assertThat(client.getImportUri().getRawPath()).isEqualTo("/raw_us_mavi/customers+export");
	}

}
