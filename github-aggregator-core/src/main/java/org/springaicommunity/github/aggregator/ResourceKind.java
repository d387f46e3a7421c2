package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Optional;

/**
 * The three paginated collections served by the aggregator, with the upstream listing
 * endpoint and cache placement of each.
 */
public enum ResourceKind {

	REPOSITORIES("repos", "/user/repos", "visibility=all&sort=updated", CachePrefix.REPOSITORIES, CacheTier.LONG),

	GISTS("gists", "/gists", null, CachePrefix.GISTS, CacheTier.MEDIUM),

	/**
	 * Listed through the issues endpoint; elements without a {@code pull_request} member
	 * are plain issues and are discarded.
	 */
	PULL_REQUESTS("prs", "/user/issues", "filter=all&state=all&pulls=true&sort=updated&direction=desc",
			CachePrefix.PULL_REQUESTS, CacheTier.MEDIUM);

	private final String shortName;

	private final String path;

	private final @Nullable String query;

	private final CachePrefix cachePrefix;

	private final CacheTier cacheTier;

	ResourceKind(String shortName, String path, @Nullable String query, CachePrefix cachePrefix,
			CacheTier cacheTier) {
		this.shortName = shortName;
		this.path = path;
		this.query = query;
		this.cachePrefix = cachePrefix;
		this.cacheTier = cacheTier;
	}

	public String shortName() {
		return shortName;
	}

	public String path() {
		return path;
	}

	public @Nullable String query() {
		return query;
	}

	public CachePrefix cachePrefix() {
		return cachePrefix;
	}

	public CacheTier cacheTier() {
		return cacheTier;
	}

	/**
	 * Resolve a kind from its short name ("repos", "gists", "prs"), case-insensitively.
	 * @param name short name
	 * @return the kind, or empty when unknown
	 */
	public static Optional<ResourceKind> fromShortName(String name) {
		String normalized = name.trim().toLowerCase(Locale.ROOT);
		for (ResourceKind kind : values()) {
			if (kind.shortName.equals(normalized)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}

}
