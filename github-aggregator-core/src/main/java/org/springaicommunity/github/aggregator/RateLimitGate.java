package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Advisory check of the remaining upstream call budget, cached per user.
 *
 * <p>
 * The cached value is the budget snapshot; each call compares it against its own
 * threshold.
 * The gate fails open: when the rate limit cannot be read the request is allowed and
 * nothing is cached, so the next request checks again.
 */
public class RateLimitGate {

	private static final Logger logger = LoggerFactory.getLogger(RateLimitGate.class);

	private final GitHubClientFactory clientFactory;

	private final ObjectMapper objectMapper;

	private final UserCache cache;

	private final Duration ttl;

	public RateLimitGate(GitHubClientFactory clientFactory, ObjectMapper objectMapper, UserCache cache,
			Duration ttl) {
		this.clientFactory = clientFactory;
		this.objectMapper = objectMapper;
		this.cache = cache;
		this.ttl = ttl;
	}

	/**
	 * Check whether more than {@code threshold} calls remain for a user.
	 * @param credential bearer credential of the user
	 * @param userId the user id
	 * @param threshold calls to keep in reserve
	 * @return true if the request may proceed
	 */
	public boolean check(String credential, long userId, int threshold) {
		String key = UserCache.key(CachePrefix.RATE_LIMIT, userId);
		Optional<Object> cached = cache.get(key);
		if (cached.isPresent() && cached.get() instanceof RateLimitInfo rateLimit) {
			return evaluate(rateLimit, userId, threshold);
		}
		try {
			RateLimitInfo rateLimit = new GitHubRestService(clientFactory.forToken(credential), objectMapper)
				.getRateLimit();
			cache.set(key, rateLimit, ttl);
			return evaluate(rateLimit, userId, threshold);
		}
		catch (Exception e) {
			logger.warn("Rate limit check failed for user {}, allowing request: {}", userId, e.getMessage());
			return true;
		}
	}

	private boolean evaluate(RateLimitInfo rateLimit, long userId, int threshold) {
		boolean ok = rateLimit.hasMoreThan(threshold);
		if (!ok) {
			logger.warn("Rate limit low for user {}: {} remaining, threshold {}, resets at {}", userId,
					rateLimit.remaining(), threshold, rateLimit.getResetTime());
		}
		return ok;
	}

}
