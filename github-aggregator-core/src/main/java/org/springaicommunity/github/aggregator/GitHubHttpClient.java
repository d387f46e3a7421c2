package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * HTTP client wrapper for GitHub REST calls using the Java 11+ HttpClient.
 *
 * <p>
 * Each instance carries one user's bearer credential. Instances created through
 * {@link #factory(String, Duration)} share a single underlying {@link HttpClient}, so
 * creating one per request is cheap.
 *
 * <p>
 * Extracts rate limit headers from all responses and makes them available via
 * {@link #getLastRateLimitInfo()}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String GITHUB_API_BASE = "https://api.github.com";

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final String baseUrl;

	private final String token;

	private final Duration requestTimeout;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(newHttpClient(), GITHUB_API_BASE, token, DEFAULT_REQUEST_TIMEOUT);
	}

	public GitHubHttpClient(HttpClient httpClient, String baseUrl, String token, Duration requestTimeout) {
		this.httpClient = httpClient;
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.token = token;
		this.requestTimeout = requestTimeout;
	}

	/**
	 * Create a factory whose clients share one connection pool.
	 * @param baseUrl API base URL (e.g. {@value #GITHUB_API_BASE})
	 * @param requestTimeout timeout applied to every request
	 * @return factory producing a client per credential
	 */
	public static GitHubClientFactory factory(String baseUrl, Duration requestTimeout) {
		HttpClient shared = newHttpClient();
		return token -> new GitHubHttpClient(shared, baseUrl, token, requestTimeout);
	}

	private static HttpClient newHttpClient() {
		return HttpClient.newBuilder()
			.connectTimeout(DEFAULT_REQUEST_TIMEOUT)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : baseUrl + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "github-aggregator")
			.GET()
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String url = baseUrl + path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			if (remaining >= 0) {
				this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset, used);
				logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: bad or expired credentials", statusCode, response.body(),
						remaining, reset);
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
							response.body(), remaining, reset);
				}
				throw new GitHubApiException("Forbidden: " + request.uri(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body(), remaining,
						reset);
			}
		}
		catch (HttpTimeoutException e) {
			throw new GitHubApiException("HTTP request timed out after " + requestTimeout.toMillis() + "ms", e);
		}
		catch (IOException e) {
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * Carries the HTTP status and rate limit information when available.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		/**
		 * Returns true if this exception represents a rate limit error (either 403 with
		 * remaining=0 or 429).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

	}

}
