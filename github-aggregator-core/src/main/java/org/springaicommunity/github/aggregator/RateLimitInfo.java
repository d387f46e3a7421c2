package org.springaicommunity.github.aggregator;

import java.time.Instant;

/**
 * Core rate limit budget reported by the GitHub API.
 *
 * @param limit the maximum number of requests allowed per window
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if more than {@code threshold} requests remain in the window.
	 * @param threshold number of requests to keep in reserve
	 * @return true if the budget is above the threshold
	 */
	public boolean hasMoreThan(int threshold) {
		return remaining > threshold;
	}

}
