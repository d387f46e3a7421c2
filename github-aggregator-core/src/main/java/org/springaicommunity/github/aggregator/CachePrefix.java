package org.springaicommunity.github.aggregator;

import java.util.Optional;

/**
 * Known per-user cache key prefixes.
 *
 * <p>
 * Each prefix is combined with a user id to form a key of the form
 * {@code {prefix}:{userId}}. Invalidating a user without a prefix deletes one key per
 * value of this enum.
 */
public enum CachePrefix {

	REPOSITORIES("repos"),

	GISTS("gists"),

	PULL_REQUESTS("pullrequests"),

	FOLLOWERS("followers"),

	FOLLOWING("following"),

	PROFILE("profile"),

	RATE_LIMIT("rate_limit");

	private final String key;

	CachePrefix(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	public static Optional<CachePrefix> fromKey(String key) {
		for (CachePrefix prefix : values()) {
			if (prefix.key.equals(key)) {
				return Optional.of(prefix);
			}
		}
		return Optional.empty();
	}

}
