package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the configuration support classes using plain JUnit. The Spring wiring is
 * covered by {@link LoyaltyExportConfigTest}.
 */
@DisplayName("ConfigurationSupport Tests")
class ConfigurationSupportTest {

	@Nested
	@DisplayName("ExportProperties Tests - Plain JUnit")
	class ExportPropertiesTest {

		private ExportProperties properties;

		@BeforeEach
		void setUp() {
			properties = new ExportProperties();
		}

		@Test
		@DisplayName("Should have correct default properties")
		void shouldHaveCorrectDefaultProperties() {
			assertThat(properties.getRequestsPerSecond()).isEqualTo(4.5);
			assertThat(properties.getUploadRequestsPerSecond()).isZero();
			assertThat(properties.getBatchSize()).isEqualTo(100_000);
			assertThat(properties.getUploadWorkers()).isEqualTo(2);
			assertThat(properties.getUploadQueueCapacity()).isEqualTo(2);
			assertThat(properties.getMaxAttempts()).isEqualTo(3);
			assertThat(properties.getRetryDelayMs()).isEqualTo(2000);
			assertThat(properties.getRequestTimeoutSeconds()).isEqualTo(30);
			assertThat(properties.getPageLimit()).isEqualTo(100);
			assertThat(properties.getStoreId()).isNull();
		}

		@Test
		@DisplayName("Should target the customers endpoint and the raw JSON table")
		void shouldHaveSourceAndDestinationDefaults() {
			assertThat(properties.getSourceBaseUrl()).isEqualTo("https://api.yotpo.com/core/v3");
			assertThat(properties.getRecordsField()).isEqualTo("customers");
			assertThat(properties.getNextCursorPointer()).isEqualTo("/pagination/next_page_info");
			assertThat(properties.getDestinationEndpoint()).isEqualTo("https://us01.records.in.treasuredata.com");
			assertThat(properties.getDatabase()).isEqualTo("raw_us_mavi");
			assertThat(properties.getTable()).isEqualTo("yotpo_customers");
			assertThat(properties.getPayloadField()).isEqualTo("json_response");
			assertThat(properties.getTimeField()).isEqualTo("time");
		}

		@Test
		@DisplayName("toString should include the store and table")
		void toStringShouldShowIdentifiers() {
			properties.setStoreId("store-1");

			assertThat(properties.toString()).contains("store-1").contains("yotpo_customers");
		}

	}

	@Nested
	@DisplayName("ParsedConfiguration Tests")
	class ParsedConfigurationTest {

		@Test
		@DisplayName("applyTo should copy every parsed value onto the properties")
		void applyToShouldCopyValues() {
			ParsedConfiguration config = new ParsedConfiguration(new ExportProperties());
			config.requestsPerSecond = 2.0;
			config.uploadRequestsPerSecond = 8.0;
			config.batchSize = 10;
			config.uploadWorkers = 3;
			config.uploadQueueCapacity = 5;
			config.maxAttempts = 4;
			config.retryDelayMs = 50;
			config.timeoutSeconds = 9;
			config.storeId = "store-2";
			config.destinationEndpoint = "http://localhost:9000";
			config.database = "sandbox";
			config.table = "customers";

			ExportProperties target = new ExportProperties();
			assertThat(config.applyTo(target)).isSameAs(target);

			assertThat(target.getRequestsPerSecond()).isEqualTo(2.0);
			assertThat(target.getUploadRequestsPerSecond()).isEqualTo(8.0);
			assertThat(target.getBatchSize()).isEqualTo(10);
			assertThat(target.getUploadWorkers()).isEqualTo(3);
			assertThat(target.getUploadQueueCapacity()).isEqualTo(5);
			assertThat(target.getMaxAttempts()).isEqualTo(4);
			assertThat(target.getRetryDelayMs()).isEqualTo(50);
			assertThat(target.getRequestTimeoutSeconds()).isEqualTo(9);
			assertThat(target.getStoreId()).isEqualTo("store-2");
			assertThat(target.getDestinationEndpoint()).isEqualTo("http://localhost:9000");
			assertThat(target.getDatabase()).isEqualTo("sandbox");
			assertThat(target.getTable()).isEqualTo("customers");
		}

		@Test
		@DisplayName("applyTo should leave properties without an option untouched")
		void applyToShouldKeepOtherProperties() {
			ExportProperties target = new ExportProperties();
			target.setPayloadField("raw");

			new ParsedConfiguration(new ExportProperties()).applyTo(target);

			assertThat(target.getPayloadField()).isEqualTo("raw");
		}

	}

	@Nested
	@DisplayName("ObjectMapperFactory Tests")
	class ObjectMapperFactoryTest {

		private final ObjectMapper mapper = ObjectMapperFactory.create();

		@Test
		@DisplayName("Should write dates as ISO-8601 strings")
		void shouldWriteIsoDates() throws JsonProcessingException {
			String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2024-05-01T10:00:00Z")));

			assertThat(json).isEqualTo("{\"at\":\"2024-05-01T10:00:00Z\"}");
		}

		@Test
		@DisplayName("Should reject trailing content after the root value")
		void shouldRejectTrailingTokens() {
			assertThatThrownBy(() -> mapper.readValue("{\"customers\":[]} {}", JsonNode.class))
				.isInstanceOf(JsonProcessingException.class);
		}

	}

}
