package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the loyalty profile export. Pure Java implementation
 * with no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private final ExportProperties defaultProperties;

	public ArgumentParser(ExportProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-b", "--batch-size":
					config.batchSize = parseInt(getRequiredValue(args, i, "batch-size"), "batch size");
					i++; // Skip next argument since we consumed it
					break;

				case "-w", "--workers":
					config.uploadWorkers = parseInt(getRequiredValue(args, i, "workers"), "worker count");
					i++;
					break;

				case "-q", "--queue-capacity":
					config.uploadQueueCapacity = parseInt(getRequiredValue(args, i, "queue-capacity"),
							"queue capacity");
					i++;
					break;

				case "--rps":
					config.requestsPerSecond = parseDouble(getRequiredValue(args, i, "rps"), "requests per second");
					i++;
					break;

				case "--upload-rps":
					config.uploadRequestsPerSecond = parseDouble(getRequiredValue(args, i, "upload-rps"),
							"upload requests per second");
					i++;
					break;

				case "--max-attempts":
					config.maxAttempts = parseInt(getRequiredValue(args, i, "max-attempts"), "max attempts");
					i++;
					break;

				case "--retry-delay-ms":
					config.retryDelayMs = parseInt(getRequiredValue(args, i, "retry-delay-ms"), "retry delay");
					i++;
					break;

				case "--timeout":
					config.timeoutSeconds = parseInt(getRequiredValue(args, i, "timeout"), "timeout");
					i++;
					break;

				case "--store-id":
					config.storeId = getRequiredValue(args, i, "store-id");
					i++;
					break;

				case "--endpoint":
					config.destinationEndpoint = getRequiredValue(args, i, "endpoint");
					i++;
					break;

				case "--database":
					config.database = getRequiredValue(args, i, "database");
					i++;
					break;

				case "--table":
					config.table = getRequiredValue(args, i, "table");
					i++;
					break;

				case "--cursor":
					config.startCursor = getRequiredValue(args, i, "cursor");
					i++;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: loyalty-collector [OPTIONS]\n");
		help.append("\n");
		help.append("Export Yotpo loyalty customer profiles into a Treasure Data table.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                  Show this help message\n");
		help.append("    -b, --batch-size SIZE       Records per uploaded batch (default: ")
			.append(defaultProperties.getBatchSize())
			.append(")\n");
		help.append("    -w, --workers COUNT         Concurrent upload workers (default: ")
			.append(defaultProperties.getUploadWorkers())
			.append(")\n");
		help.append("    -q, --queue-capacity COUNT  Sealed batches waiting for a worker (default: ")
			.append(defaultProperties.getUploadQueueCapacity())
			.append(")\n");
		help.append("    --cursor CURSOR             Start from a stored page cursor instead of the first page\n");
		help.append("\n");
		help.append("RATE AND RETRY OPTIONS:\n");
		help.append("    --rps RATE                  Source requests per second (default: ")
			.append(defaultProperties.getRequestsPerSecond())
			.append(")\n");
		help.append("    --upload-rps RATE           Upload requests per second, 0 for unlimited (default: ")
			.append(defaultProperties.getUploadRequestsPerSecond())
			.append(")\n");
		help.append("    --max-attempts COUNT        Attempts per request, including the first (default: ")
			.append(defaultProperties.getMaxAttempts())
			.append(")\n");
		help.append("    --retry-delay-ms MILLIS     Base backoff, doubled per attempt (default: ")
			.append(defaultProperties.getRetryDelayMs())
			.append(")\n");
		help.append("    --timeout SECONDS           Request timeout (default: ")
			.append(defaultProperties.getRequestTimeoutSeconds())
			.append(")\n");
		help.append("\n");
		help.append("SOURCE AND DESTINATION OPTIONS:\n");
		help.append("    --store-id ID               Yotpo store id (default: $YOTPO_STORE_ID)\n");
		help.append("    --endpoint URL              Treasure Data import endpoint (default: ")
			.append(defaultProperties.getDestinationEndpoint())
			.append(")\n");
		help.append("    --database NAME             Destination database (default: ")
			.append(defaultProperties.getDatabase())
			.append(")\n");
		help.append("    --table NAME                Destination table (default: ")
			.append(defaultProperties.getTable())
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    YOTPO_CLIENT_SECRET         Yotpo API secret (required)\n");
		help.append("    YOTPO_STORE_ID              Yotpo store id (required unless --store-id is given)\n");
		help.append("    TD_API_KEY                  Treasure Data write API key (required)\n");
		help.append("    Variables may also be placed in a .env file in the working or home directory.\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  every record was uploaded\n");
		help.append("    2  partial success: some batches failed or the export was cancelled\n");
		help.append("    1  fatal error or invalid arguments\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    loyalty-collector\n");
		help.append("    loyalty-collector --batch-size 50000 --workers 4\n");
		help.append("    loyalty-collector --database sandbox --table yotpo_customers_test --rps 2\n");
		help.append("    loyalty-collector --cursor eyJsYXN0X2lkIjo0Mn0\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (credentials and store id).
	 * @param config parsed configuration, used for the store id
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment(ParsedConfiguration config) {
		List<String> missing = new ArrayList<>();
		if (isBlank(EnvironmentSupport.get(ExportPipelineBuilder.SOURCE_SECRET_ENV))) {
			missing.add(ExportPipelineBuilder.SOURCE_SECRET_ENV);
		}
		if (isBlank(EnvironmentSupport.get(ExportPipelineBuilder.DESTINATION_API_KEY_ENV))) {
			missing.add(ExportPipelineBuilder.DESTINATION_API_KEY_ENV);
		}
		if (isBlank(config.storeId) && isBlank(EnvironmentSupport.get(ExportPipelineBuilder.STORE_ID_ENV))) {
			missing.add(ExportPipelineBuilder.STORE_ID_ENV + " (or --store-id)");
		}
		if (!missing.isEmpty()) {
			throw new IllegalStateException("Missing required environment variables: " + String.join(", ", missing)
					+ ". Export them or add them to a .env file.");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private static int parseInt(String value, String name) {
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be an integer");
		}
	}

	private static double parseDouble(String value, String name) {
		try {
			return Double.parseDouble(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a number");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.batchSize <= 0) {
			errors.add("Batch size must be positive (got: " + config.batchSize + ")");
		}
		if (config.uploadWorkers <= 0) {
			errors.add("Worker count must be positive (got: " + config.uploadWorkers + ")");
		}
		if (config.uploadQueueCapacity <= 0) {
			errors.add("Queue capacity must be positive (got: " + config.uploadQueueCapacity + ")");
		}
		if (!(config.requestsPerSecond > 0) || Double.isInfinite(config.requestsPerSecond)) {
			errors.add("Requests per second must be a positive number (got: " + config.requestsPerSecond + ")");
		}
		if (Double.isNaN(config.uploadRequestsPerSecond) || Double.isInfinite(config.uploadRequestsPerSecond)) {
			errors.add("Upload requests per second must be a finite number (got: " + config.uploadRequestsPerSecond
					+ ")");
		}
		if (config.maxAttempts <= 0) {
			errors.add("Max attempts must be positive (got: " + config.maxAttempts + ")");
		}
		if (config.retryDelayMs < 0) {
			errors.add("Retry delay must not be negative (got: " + config.retryDelayMs + ")");
		}
		if (config.timeoutSeconds <= 0) {
			errors.add("Timeout must be positive (got: " + config.timeoutSeconds + ")");
		}
		if (isBlank(config.database)) {
			errors.add("Database cannot be empty");
		}
		if (isBlank(config.table)) {
			errors.add("Table cannot be empty");
		}
		if (config.destinationEndpoint == null || !config.destinationEndpoint.matches("^https?://.+")) {
			errors.add("Endpoint must be an http(s) URL (got: " + config.destinationEndpoint + ")");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.trim().isEmpty();
	}

}
