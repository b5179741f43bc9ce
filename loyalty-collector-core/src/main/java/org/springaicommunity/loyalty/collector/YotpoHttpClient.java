package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * {@link SourceClient} for the Yotpo core v3 customers endpoint.
 *
 * <p>
 * The store secret is exchanged for an access token on the first request. Pages are
 * requested with loyalty data and custom properties expanded; the first page carries the
 * page size, later pages only the {@code page_info} cursor.
 */
public class YotpoHttpClient implements SourceClient {

	private static final Logger logger = LoggerFactory.getLogger(YotpoHttpClient.class);

	private static final String SERVICE_NAME = "Yotpo";

	private static final String TOKEN_HEADER = "X-Yotpo-Token";

	private static final int LARGE_RESPONSE_BYTES = 1_000_000;

	private static final int PREVIEW_LENGTH = 200;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final String baseUrl;

	private final String storeId;

	private final String secret;

	private final int pageLimit;

	private final String recordsField;

	private final Duration requestTimeout;

	private volatile @Nullable String accessToken;

	public YotpoHttpClient(ExportProperties properties, String storeId, String secret, ObjectMapper objectMapper) {
		this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
		this.httpClient = HttpSupport.newClient(requestTimeout);
		this.objectMapper = objectMapper;
		this.baseUrl = stripTrailingSlash(properties.getSourceBaseUrl());
		this.storeId = storeId;
		this.secret = secret;
		this.pageLimit = properties.getPageLimit();
		this.recordsField = properties.getRecordsField();
	}

	@Override
	public String fetchPage(@Nullable String cursor) {
		String url = customersUrl(cursor);
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header(TOKEN_HEADER, authenticate())
			.header("Accept", "application/json")
			.GET()
			.build();

		HttpResponse<String> response = HttpSupport.send(httpClient, request);
		if (response.statusCode() == 400 && containsNoResults(response.body())) {
			logger.info("API returned 'no results found', treating as empty page");
			return emptyPage();
		}
		String body = HttpSupport.ensureSuccess(response, SERVICE_NAME);
		checkJsonBody(response, body);
		logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start, body.length());
		return body;
	}

	/**
	 * Return the cached access token, requesting one on first use.
	 * @return access token
	 * @throws RemoteServiceException if the token request fails
	 * @throws PageParseException if the token response has no token
	 */
	synchronized String authenticate() {
		String token = this.accessToken;
		if (token != null) {
			return token;
		}

		String url = baseUrl + "/stores/" + encode(storeId) + "/access_tokens";
		logger.info("Requesting access token from {}", url);
		ObjectNode payload = objectMapper.createObjectNode().put("secret", secret);

		HttpRequest request;
		try {
			request = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.timeout(requestTimeout)
				.header("Content-Type", "application/json")
				.header("Accept", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
				.build();
		}
		catch (JsonProcessingException e) {
			throw new CollectorException("Failed to serialize token request", e);
		}

		String body = HttpSupport.ensureSuccess(HttpSupport.send(httpClient, request), SERVICE_NAME);
		JsonNode tokenNode;
		try {
			tokenNode = objectMapper.readTree(body).path("access_token");
		}
		catch (JsonProcessingException e) {
			throw new PageParseException("Malformed access token response: " + e.getOriginalMessage(), e);
		}
		if (!tokenNode.isTextual() || tokenNode.asText().isEmpty()) {
			throw new PageParseException("Access token not found in response");
		}

		logger.info("Access token received successfully");
		this.accessToken = tokenNode.asText();
		return this.accessToken;
	}

	String customersUrl(@Nullable String cursor) {
		StringBuilder url = new StringBuilder(baseUrl).append("/stores/")
			.append(encode(storeId))
			.append("/customers?");
		if (cursor == null) {
			url.append("limit=").append(pageLimit).append('&');
		}
		url.append("include_custom_properties=true&expand=loyalty");
		if (cursor != null) {
			url.append("&page_info=").append(encode(cursor));
		}
		return url.toString();
	}

	private void checkJsonBody(HttpResponse<String> response, String body) {
		String contentType = response.headers().firstValue("Content-Type").orElse("");
		if (!contentType.toLowerCase(Locale.ROOT).contains("json")) {
			logger.debug("Response preview: {}", preview(body));
			throw new PageParseException(
					"Non-JSON response (" + (contentType.isEmpty() ? "no content type" : contentType) + ")"
							+ diagnose(body));
		}
		if (body.length() > LARGE_RESPONSE_BYTES) {
			logger.warn("Large response size: {} bytes", body.length());
		}
	}

	private String emptyPage() {
		ObjectNode page = objectMapper.createObjectNode();
		page.putArray(recordsField);
		return page.toString();
	}

	static String diagnose(String body) {
		String text = body.strip();
		if (text.isEmpty()) {
			return ": empty response body";
		}
		if (text.startsWith("<")) {
			return ": response appears to be HTML/XML";
		}
		if (text.toLowerCase(Locale.ROOT).contains("rate limit")) {
			return ": possible rate limit message in response";
		}
		return "";
	}

	private static boolean containsNoResults(@Nullable String body) {
		return body != null && body.toLowerCase(Locale.ROOT).contains("no results found");
	}

	private static String preview(String body) {
		return body.length() <= PREVIEW_LENGTH ? body : body.substring(0, PREVIEW_LENGTH) + "...";
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

}
