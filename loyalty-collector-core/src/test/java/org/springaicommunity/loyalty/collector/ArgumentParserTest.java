package org.springaicommunity.loyalty.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for ArgumentParser using plain JUnit only. NO Spring context and no credentials,
 * so nothing here can start a real export.
 */
@DisplayName("ArgumentParser Tests - Plain JUnit Only")
class ArgumentParserTest {

	private ExportProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new ExportProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Basic Argument Parsing Tests")
	class BasicArgumentParsingTest {

		@Test
		@DisplayName("No arguments should yield the defaults")
		void shouldUseDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[0]);

			assertThat(config.requestsPerSecond).isEqualTo(4.5);
			assertThat(config.uploadRequestsPerSecond).isZero();
			assertThat(config.batchSize).isEqualTo(100_000);
			assertThat(config.uploadWorkers).isEqualTo(2);
			assertThat(config.uploadQueueCapacity).isEqualTo(2);
			assertThat(config.maxAttempts).isEqualTo(3);
			assertThat(config.retryDelayMs).isEqualTo(2000);
			assertThat(config.database).isEqualTo("raw_us_mavi");
			assertThat(config.table).isEqualTo("yotpo_customers");
			assertThat(config.startCursor).isNull();
			assertThat(config.helpRequested).isFalse();
		}

		@Test
		@DisplayName("Should parse short and long sizing options")
		void shouldParseSizingOptions() {
			String[] args = { "-b", "500", "--workers", "4", "-q", "8" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.batchSize).isEqualTo(500);
			assertThat(config.uploadWorkers).isEqualTo(4);
			assertThat(config.uploadQueueCapacity).isEqualTo(8);
		}

		@Test
		@DisplayName("Should parse rate and retry options")
		void shouldParseRateAndRetryOptions() {
			String[] args = { "--rps", "2.5", "--upload-rps", "10", "--max-attempts", "5", "--retry-delay-ms", "0",
					"--timeout", "60" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.requestsPerSecond).isEqualTo(2.5);
			assertThat(config.uploadRequestsPerSecond).isEqualTo(10.0);
			assertThat(config.maxAttempts).isEqualTo(5);
			assertThat(config.retryDelayMs).isZero();
			assertThat(config.timeoutSeconds).isEqualTo(60);
		}

		@Test
		@DisplayName("Should parse source and destination options")
		void shouldParseSourceAndDestination() {
			String[] args = { "--store-id", "store-9", "--endpoint", "http://localhost:8080", "--database", "sandbox",
					"--table", "customers_test", "--cursor", "eyJsYXN0X2lkIjo0Mn0" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.storeId).isEqualTo("store-9");
			assertThat(config.destinationEndpoint).isEqualTo("http://localhost:8080");
			assertThat(config.database).isEqualTo("sandbox");
			assertThat(config.table).isEqualTo("customers_test");
			assertThat(config.startCursor).isEqualTo("eyJsYXN0X2lkIjo0Mn0");
		}

		@Test
		@DisplayName("Defaults should follow the supplied properties")
		void shouldFollowSuppliedDefaults() {
			ExportProperties custom = new ExportProperties();
			custom.setBatchSize(42);
			custom.setTable("other");

			ParsedConfiguration config = new ArgumentParser(custom).parseAndValidate(new String[0]);

			assertThat(config.batchSize).isEqualTo(42);
			assertThat(config.table).isEqualTo("other");
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@ParameterizedTest
		@ValueSource(strings = { "0", "-1" })
		@DisplayName("Should reject non-positive batch sizes")
		void shouldRejectNonPositiveBatchSize(String value) {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--batch-size", value }))
				.withMessageContaining("Batch size must be positive");
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-2", "NaN", "Infinity" })
		@DisplayName("Should reject rates that are not positive finite numbers")
		void shouldRejectInvalidRate(String value) {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--rps", value }))
				.withMessageContaining("Requests per second");
		}

		@Test
		@DisplayName("A zero upload rate should mean unlimited and be accepted")
		void zeroUploadRateShouldBeAccepted() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "--upload-rps", "0" });

			assertThat(config.uploadRequestsPerSecond).isZero();
		}

		@Test
		@DisplayName("Should report every problem at once")
		void shouldCollectAllErrors() {
			String[] args = { "-w", "0", "--max-attempts", "0", "--retry-delay-ms", "-5", "--table", " " };

			assertThatIllegalArgumentException().isThrownBy(() -> argumentParser.parseAndValidate(args))
				.withMessageStartingWith("Configuration validation failed:")
				.withMessageContaining("Worker count must be positive")
				.withMessageContaining("Max attempts must be positive")
				.withMessageContaining("Retry delay must not be negative")
				.withMessageContaining("Table cannot be empty");
		}

		@Test
		@DisplayName("Should reject endpoints that are not http(s) URLs")
		void shouldRejectInvalidEndpoint() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--endpoint", "ftp://example.com" }))
				.withMessageContaining("Endpoint must be an http(s) URL");
		}

		@Test
		@DisplayName("Should reject non-numeric values")
		void shouldRejectNonNumericValues() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--workers", "many" }))
				.withMessage("Invalid worker count 'many': must be an integer");
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--rps", "fast" }))
				.withMessage("Invalid requests per second 'fast': must be a number");
		}

		@Test
		@DisplayName("Should reject a missing option value")
		void shouldRejectMissingValue() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--cursor" }))
				.withMessage("Missing value for cursor option");
		}

		@Test
		@DisplayName("Should reject unknown options and stray arguments")
		void shouldRejectUnknownArguments() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--dry-run" }))
				.withMessage("Unknown option: --dry-run");
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "customers" }))
				.withMessage("Unexpected argument: customers");
		}

	}

	@Nested
	@DisplayName("Help and Environment Tests")
	class HelpAndEnvironmentTest {

		@Test
		@DisplayName("Should detect help anywhere in the arguments")
		void shouldDetectHelp() {
			assertThat(argumentParser.isHelpRequested(new String[] { "-b", "10", "-h" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "--help" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "-b", "10" })).isFalse();
			assertThat(argumentParser.parseAndValidate(new String[] { "--help" }).helpRequested).isTrue();
		}

		@Test
		@DisplayName("Help text should list options, variables and exit codes with current defaults")
		void helpTextShouldDescribeUsage() {
			defaultProperties.setBatchSize(1234);

			String help = argumentParser.generateHelpText();

			assertThat(help).contains("Usage: loyalty-collector")
				.contains("--batch-size")
				.contains("(default: 1234)")
				.contains("--upload-rps")
				.contains("--cursor")
				.contains("YOTPO_CLIENT_SECRET")
				.contains("TD_API_KEY")
				.contains("EXIT CODES")
				.contains("2  partial success");
		}

		@Test
		@DisplayName("Missing credentials should be reported together")
		void missingCredentialsShouldBeReported() {
			assumeTrue(EnvironmentSupport.get(ExportPipelineBuilder.SOURCE_SECRET_ENV) == null
					&& EnvironmentSupport.get(ExportPipelineBuilder.DESTINATION_API_KEY_ENV) == null
					&& EnvironmentSupport.get(ExportPipelineBuilder.STORE_ID_ENV) == null,
					"Credentials are configured in this environment");
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[0]);

			assertThatIllegalStateException().isThrownBy(() -> argumentParser.validateEnvironment(config))
				.withMessageContaining("YOTPO_CLIENT_SECRET")
				.withMessageContaining("TD_API_KEY")
				.withMessageContaining("YOTPO_STORE_ID (or --store-id)");
		}

		@Test
		@DisplayName("A store id option should satisfy the store id requirement")
		void storeIdOptionShouldSatisfyRequirement() {
			assumeTrue(EnvironmentSupport.get(ExportPipelineBuilder.SOURCE_SECRET_ENV) == null,
					"Credentials are configured in this environment");
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "--store-id", "store-9" });

			assertThatIllegalStateException().isThrownBy(() -> argumentParser.validateEnvironment(config))
				.withMessageNotContaining("YOTPO_STORE_ID");
		}

	}

}
