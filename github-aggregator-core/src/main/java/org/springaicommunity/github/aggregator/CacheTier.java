package org.springaicommunity.github.aggregator;

/**
 * TTL tiers for cached data. Durations are configured in {@link AggregatorProperties}.
 */
public enum CacheTier {

	/** Volatile advisory data such as the rate limit status. */
	SHORT,

	/** Collections that change often (gists, pull requests). */
	MEDIUM,

	/** Repositories and profile data. */
	LONG

}
