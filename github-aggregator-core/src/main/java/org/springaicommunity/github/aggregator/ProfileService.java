package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Profile, follower and following reads for the authenticated user, cached per user.
 */
public class ProfileService {

	private static final Logger logger = LoggerFactory.getLogger(ProfileService.class);

	private final GitHubClientFactory clientFactory;

	private final ObjectMapper objectMapper;

	private final UserCache cache;

	private final Duration ttl;

	public ProfileService(GitHubClientFactory clientFactory, ObjectMapper objectMapper, UserCache cache,
			Duration ttl) {
		this.clientFactory = clientFactory;
		this.objectMapper = objectMapper;
		this.cache = cache;
		this.ttl = ttl;
	}

	public UserProfile getProfile(@Nullable Long userId, @Nullable String credential) {
		return read(CachePrefix.PROFILE, userId, credential, RestService::getAuthenticatedUser);
	}

	public List<UserSummary> getFollowers(@Nullable Long userId, @Nullable String credential) {
		return read(CachePrefix.FOLLOWERS, userId, credential, rest -> List.copyOf(rest.getFollowers()));
	}

	public List<UserSummary> getFollowing(@Nullable Long userId, @Nullable String credential) {
		return read(CachePrefix.FOLLOWING, userId, credential, rest -> List.copyOf(rest.getFollowing()));
	}

	private <T> T read(CachePrefix prefix, @Nullable Long userId, @Nullable String credential, RestCall<T> call) {
		if (userId == null || credential == null || credential.isBlank()) {
			throw new AuthenticationRequiredException();
		}
		return cache.cached(UserCache.key(prefix, userId), ttl, () -> {
			RestService restService = new GitHubRestService(clientFactory.forToken(credential), objectMapper);
			try {
				return call.apply(restService);
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (e.getStatusCode() == 401) {
					throw new AuthenticationRequiredException();
				}
				logger.error("Failed to fetch {} for user {}: {}", prefix.key(), userId, e.getMessage());
				throw new CollectionServiceException("Failed to fetch " + prefix.key() + ": " + e.getMessage(), 500,
						e);
			}
			catch (Exception e) {
				logger.error("Failed to fetch {} for user {}: {}", prefix.key(), userId, e.getMessage());
				throw new CollectionServiceException("Failed to fetch " + prefix.key() + ": " + e.getMessage(), 500,
						e);
			}
		});
	}

	@FunctionalInterface
	private interface RestCall<T> {

		T apply(RestService restService) throws Exception;

	}

}
