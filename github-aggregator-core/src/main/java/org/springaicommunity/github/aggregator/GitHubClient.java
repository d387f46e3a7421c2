package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API calls made on behalf of one authenticated user.
 *
 * <p>
 * Implementations are bound to a single bearer credential. Use a
 * {@link GitHubClientFactory} to obtain one per credential.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/user/repos") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String getWithQuery(String path, @Nullable String queryString);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
