package org.springaicommunity.github.aggregator;

import java.time.Duration;

/**
 * Configuration properties for the aggregator.
 *
 * <p>
 * Controls upstream access, concurrency caps, per-task timeouts, fetch ceilings, cache
 * TTL tiers and rate-limit thresholds. Properties can be set directly via setters or
 * overlaid from the environment with {@link #fromEnvironment()}, then passed to
 * {@link GitHubAggregatorBuilder}.
 *
 * <p>
 * Default values are suitable for most use cases.
 */
public class AggregatorProperties {

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String apiBaseUrl = GitHubHttpClient.GITHUB_API_BASE;

	/**
	 * Timeout applied to every upstream request.
	 */
	private Duration requestTimeout = GitHubHttpClient.DEFAULT_REQUEST_TIMEOUT;

	/**
	 * Items requested per upstream page (GitHub allows at most 100).
	 */
	private int pageSize = 100;

	/**
	 * Maximum concurrent page fetches for repositories and gists.
	 */
	private int maxFetchWorkers = 10;

	/**
	 * Maximum concurrent page fetches for pull requests.
	 */
	private int pullRequestFetchWorkers = 3;

	/**
	 * Maximum concurrent item conversions.
	 */
	private int maxConversionWorkers = 200;

	/**
	 * Time a single page fetch may run before it is cancelled.
	 */
	private Duration fetchTimeout = Duration.ofSeconds(30);

	/**
	 * Time a single item conversion may run before it is cancelled.
	 */
	private Duration conversionTimeout = Duration.ofSeconds(30);

	/**
	 * Upper bound on repositories collected per user.
	 */
	private int maxRepositories = 2000;

	/**
	 * Upper bound on gists collected per user.
	 */
	private int maxGists = 1000;

	/**
	 * Upper bound on pull requests collected per user.
	 */
	private int maxPullRequests = 1000;

	/**
	 * Upper bound on upstream pages fetched for pull requests.
	 */
	private int maxPullRequestPages = 10;

	/**
	 * Number of leading pull requests enriched with detail data.
	 */
	private int maxEnrichedPullRequests = 100;

	/**
	 * Maximum concurrent pull request detail calls.
	 */
	private int enrichmentWorkers = 5;

	/**
	 * Time a single pull request detail call may run.
	 */
	private Duration enrichmentTimeout = Duration.ofSeconds(10);

	/**
	 * TTL of the short cache tier (rate limit status).
	 */
	private Duration shortCacheTtl = Duration.ofSeconds(60);

	/**
	 * TTL of the medium cache tier (gists, pull requests).
	 */
	private Duration mediumCacheTtl = Duration.ofMinutes(30);

	/**
	 * TTL of the long cache tier (repositories, profile, followers, following).
	 */
	private Duration longCacheTtl = Duration.ofMinutes(60);

	/**
	 * Maximum number of entries held by the in-memory cache.
	 */
	private long cacheMaximumSize = 10_000;

	/**
	 * Remaining-call threshold below which repository requests are refused.
	 */
	private int repositoriesRateLimitThreshold = 100;

	/**
	 * Remaining-call threshold below which gist requests are refused.
	 */
	private int gistsRateLimitThreshold = 10;

	/**
	 * Remaining-call threshold below which pull request requests are refused.
	 */
	private int pullRequestsRateLimitThreshold = 10;

	/**
	 * Create properties with defaults, overlaid with values found in the environment.
	 *
	 * <p>
	 * Recognised variables: {@code GITHUB_API_URL}, {@code MAX_REPOS_FETCH},
	 * {@code MAX_GISTS_FETCH}, {@code MAX_PRS_FETCH}, {@code CACHE_DEFAULT_TIMEOUT}
	 * (seconds, long tier) and {@code CACHE_MAX_ENTRIES}.
	 * @return configured properties
	 */
	public static AggregatorProperties fromEnvironment() {
		AggregatorProperties properties = new AggregatorProperties();
		String apiUrl = EnvironmentSupport.get("GITHUB_API_URL");
		if (apiUrl != null && !apiUrl.isBlank()) {
			properties.setApiBaseUrl(apiUrl.trim());
		}
		properties.setMaxRepositories(EnvironmentSupport.getInt("MAX_REPOS_FETCH", properties.getMaxRepositories()));
		properties.setMaxGists(EnvironmentSupport.getInt("MAX_GISTS_FETCH", properties.getMaxGists()));
		properties.setMaxPullRequests(EnvironmentSupport.getInt("MAX_PRS_FETCH", properties.getMaxPullRequests()));
		int longTtlSeconds = EnvironmentSupport.getInt("CACHE_DEFAULT_TIMEOUT", (int) properties.longCacheTtl.toSeconds());
		if (longTtlSeconds > 0) {
			properties.setLongCacheTtl(Duration.ofSeconds(longTtlSeconds));
		}
		int maxEntries = EnvironmentSupport.getInt("CACHE_MAX_ENTRIES", (int) properties.getCacheMaximumSize());
		if (maxEntries > 0) {
			properties.setCacheMaximumSize(maxEntries);
		}
		return properties;
	}

	/**
	 * Fetch ceiling for a resource kind.
	 * @param kind the resource kind
	 * @return maximum number of items collected per user
	 */
	public int maxItems(ResourceKind kind) {
		return switch (kind) {
			case REPOSITORIES -> maxRepositories;
			case GISTS -> maxGists;
			case PULL_REQUESTS -> maxPullRequests;
		};
	}

	/**
	 * Upper bound on upstream pages for a resource kind.
	 * @param kind the resource kind
	 * @return page ceiling
	 */
	public int maxPages(ResourceKind kind) {
		if (kind == ResourceKind.PULL_REQUESTS) {
			return maxPullRequestPages;
		}
		return (maxItems(kind) + pageSize - 1) / pageSize;
	}

	public int fetchWorkers(ResourceKind kind) {
		return kind == ResourceKind.PULL_REQUESTS ? pullRequestFetchWorkers : maxFetchWorkers;
	}

	public int rateLimitThreshold(ResourceKind kind) {
		return switch (kind) {
			case REPOSITORIES -> repositoriesRateLimitThreshold;
			case GISTS -> gistsRateLimitThreshold;
			case PULL_REQUESTS -> pullRequestsRateLimitThreshold;
		};
	}

	/**
	 * TTL of a cache tier.
	 * @param tier the tier
	 * @return configured time to live
	 */
	public Duration cacheTtl(CacheTier tier) {
		return switch (tier) {
			case SHORT -> shortCacheTtl;
			case MEDIUM -> mediumCacheTtl;
			case LONG -> longCacheTtl;
		};
	}

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = Math.max(1, Math.min(100, pageSize));
	}

	public int getMaxFetchWorkers() {
		return maxFetchWorkers;
	}

	public void setMaxFetchWorkers(int maxFetchWorkers) {
		this.maxFetchWorkers = maxFetchWorkers;
	}

	public int getPullRequestFetchWorkers() {
		return pullRequestFetchWorkers;
	}

	public void setPullRequestFetchWorkers(int pullRequestFetchWorkers) {
		this.pullRequestFetchWorkers = pullRequestFetchWorkers;
	}

	public int getMaxConversionWorkers() {
		return maxConversionWorkers;
	}

	public void setMaxConversionWorkers(int maxConversionWorkers) {
		this.maxConversionWorkers = maxConversionWorkers;
	}

	public Duration getFetchTimeout() {
		return fetchTimeout;
	}

	public void setFetchTimeout(Duration fetchTimeout) {
		this.fetchTimeout = fetchTimeout;
	}

	public Duration getConversionTimeout() {
		return conversionTimeout;
	}

	public void setConversionTimeout(Duration conversionTimeout) {
		this.conversionTimeout = conversionTimeout;
	}

	public int getMaxRepositories() {
		return maxRepositories;
	}

	public void setMaxRepositories(int maxRepositories) {
		this.maxRepositories = maxRepositories;
	}

	public int getMaxGists() {
		return maxGists;
	}

	public void setMaxGists(int maxGists) {
		this.maxGists = maxGists;
	}

	public int getMaxPullRequests() {
		return maxPullRequests;
	}

	public void setMaxPullRequests(int maxPullRequests) {
		this.maxPullRequests = maxPullRequests;
	}

	public int getMaxPullRequestPages() {
		return maxPullRequestPages;
	}

	public void setMaxPullRequestPages(int maxPullRequestPages) {
		this.maxPullRequestPages = maxPullRequestPages;
	}

	public int getMaxEnrichedPullRequests() {
		return maxEnrichedPullRequests;
	}

	public void setMaxEnrichedPullRequests(int maxEnrichedPullRequests) {
		this.maxEnrichedPullRequests = maxEnrichedPullRequests;
	}

	public int getEnrichmentWorkers() {
		return enrichmentWorkers;
	}

	public void setEnrichmentWorkers(int enrichmentWorkers) {
		this.enrichmentWorkers = enrichmentWorkers;
	}

	public Duration getEnrichmentTimeout() {
		return enrichmentTimeout;
	}

	public void setEnrichmentTimeout(Duration enrichmentTimeout) {
		this.enrichmentTimeout = enrichmentTimeout;
	}

	public Duration getShortCacheTtl() {
		return shortCacheTtl;
	}

	public void setShortCacheTtl(Duration shortCacheTtl) {
		this.shortCacheTtl = shortCacheTtl;
	}

	public Duration getMediumCacheTtl() {
		return mediumCacheTtl;
	}

	public void setMediumCacheTtl(Duration mediumCacheTtl) {
		this.mediumCacheTtl = mediumCacheTtl;
	}

	public Duration getLongCacheTtl() {
		return longCacheTtl;
	}

	public void setLongCacheTtl(Duration longCacheTtl) {
		this.longCacheTtl = longCacheTtl;
	}

	public long getCacheMaximumSize() {
		return cacheMaximumSize;
	}

	public void setCacheMaximumSize(long cacheMaximumSize) {
		this.cacheMaximumSize = cacheMaximumSize;
	}

	public int getRepositoriesRateLimitThreshold() {
		return repositoriesRateLimitThreshold;
	}

	public void setRepositoriesRateLimitThreshold(int repositoriesRateLimitThreshold) {
		this.repositoriesRateLimitThreshold = repositoriesRateLimitThreshold;
	}

	public int getGistsRateLimitThreshold() {
		return gistsRateLimitThreshold;
	}

	public void setGistsRateLimitThreshold(int gistsRateLimitThreshold) {
		this.gistsRateLimitThreshold = gistsRateLimitThreshold;
	}

	public int getPullRequestsRateLimitThreshold() {
		return pullRequestsRateLimitThreshold;
	}

	public void setPullRequestsRateLimitThreshold(int pullRequestsRateLimitThreshold) {
		this.pullRequestsRateLimitThreshold = pullRequestsRateLimitThreshold;
	}

}
