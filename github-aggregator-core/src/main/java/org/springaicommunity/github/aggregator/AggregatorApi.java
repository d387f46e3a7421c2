package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Consumer-facing operations, independent of any HTTP framework.
 *
 * <p>
 * Every operation returns an {@link ApiResponse}. Failures become a body of the form
 * {@code {"error": message}} with the status carried by the
 * {@link CollectionServiceException}; any other exception becomes a 500.
 */
public class AggregatorApi {

	private static final Logger logger = LoggerFactory.getLogger(AggregatorApi.class);

	private final ResourceCollectionService<Repository> repositoryService;

	private final ResourceCollectionService<Gist> gistService;

	private final ResourceCollectionService<PullRequest> pullRequestService;

	private final ProfileService profileService;

	private final UserCache cache;

	private final AggregatorProperties properties;

	public AggregatorApi(ResourceCollectionService<Repository> repositoryService,
			ResourceCollectionService<Gist> gistService, ResourceCollectionService<PullRequest> pullRequestService,
			ProfileService profileService, UserCache cache, AggregatorProperties properties) {
		this.repositoryService = repositoryService;
		this.gistService = gistService;
		this.pullRequestService = pullRequestService;
		this.profileService = profileService;
		this.cache = cache;
		this.properties = properties;
	}

	public ApiResponse repositories(CollectionQuery query) {
		return handle("repositories", () -> repositoryService.list(query));
	}

	public ApiResponse gists(CollectionQuery query) {
		return handle("gists", () -> gistService.list(query));
	}

	public ApiResponse pullRequests(CollectionQuery query) {
		return handle("pull requests", () -> pullRequestService.list(query));
	}

	/**
	 * Dispatch a collection query by resource kind.
	 * @param kind the resource kind
	 * @param query the request
	 * @return the response
	 */
	public ApiResponse collection(ResourceKind kind, CollectionQuery query) {
		return switch (kind) {
			case REPOSITORIES -> repositories(query);
			case GISTS -> gists(query);
			case PULL_REQUESTS -> pullRequests(query);
		};
	}

	public ApiResponse profile(@Nullable Long userId, @Nullable String credential) {
		return handle("profile", () -> profileService.getProfile(userId, credential));
	}

	public ApiResponse followers(@Nullable Long userId, @Nullable String credential) {
		return handle("followers", () -> profileService.getFollowers(userId, credential));
	}

	public ApiResponse following(@Nullable Long userId, @Nullable String credential) {
		return handle("following", () -> profileService.getFollowing(userId, credential));
	}

	/**
	 * Clear one cache entry of a user, or all of them. Idempotent.
	 * @param userId the user id
	 * @param cacheType prefix of the entry to clear, or null for every entry of the user
	 * @return the response
	 */
	public ApiResponse clearCache(@Nullable Long userId, @Nullable String cacheType) {
		if (userId == null) {
			return ApiResponse.error(401, "Not authenticated");
		}
		String prefix = cacheType == null || cacheType.isBlank() ? null : cacheType.trim();
		try {
			if (!cache.invalidateUser(userId, prefix)) {
				return ApiResponse.error(500, "Failed to clear cache");
			}
		}
		catch (IllegalArgumentException e) {
			return ApiResponse.error(400, "Invalid cache type: " + cacheType);
		}
		String message = prefix != null ? "Cleared " + prefix + " cache for user " + userId
				: "Cleared all cache entries for user " + userId;
		logger.info("Cleared {} cache entries of user {}", prefix != null ? prefix : "all", userId);
		return ApiResponse.ok(Map.of("message", message));
	}

	/**
	 * Clear every cache entry of every user. Idempotent.
	 * @return the response
	 */
	public ApiResponse clearAllCache() {
		if (!cache.clearAll()) {
			return ApiResponse.error(500, "Failed to clear cache");
		}
		return ApiResponse.ok(Map.of("message", "Cleared all cache entries"));
	}

	/**
	 * Drop every cached entry of a user at the end of their session.
	 * @param userId the user id, null when no session exists
	 * @return the response
	 */
	public ApiResponse logout(@Nullable Long userId) {
		if (userId != null) {
			cache.invalidateUser(userId, null);
			logger.info("Invalidated cache of user {} on logout", userId);
		}
		return ApiResponse.ok(Map.of("message", "Logged out"));
	}

	/**
	 * Describe the cache backend and its TTL tiers in seconds.
	 * @return the response
	 */
	public ApiResponse cacheStatus() {
		Map<String, Object> timeouts = new LinkedHashMap<>();
		for (CacheTier tier : CacheTier.values()) {
			timeouts.put(tier.name().toLowerCase(Locale.ROOT), properties.cacheTtl(tier).toSeconds());
		}
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("cache_type", cache.backendName());
		body.put("timeouts", timeouts);
		return ApiResponse.ok(body);
	}

	private ApiResponse handle(String what, Supplier<Object> call) {
		try {
			return ApiResponse.ok(call.get());
		}
		catch (CollectionServiceException e) {
			if (e.getStatus() >= 500) {
				logger.error("Request for {} failed: {}", what, e.getMessage());
			}
			else {
				logger.debug("Request for {} refused with {}: {}", what, e.getStatus(), e.getMessage());
			}
			return ApiResponse.error(e.getStatus(), e.getMessage());
		}
		catch (RuntimeException e) {
			logger.error("Request for {} failed", what, e);
			return ApiResponse.error(500, "Failed to fetch " + what + ": " + e.getMessage());
		}
	}

}
