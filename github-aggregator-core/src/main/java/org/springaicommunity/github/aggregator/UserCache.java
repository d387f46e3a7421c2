package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-user cache-aside access to a {@link CacheStore}.
 *
 * <p>
 * Keys have the form {@code {prefix}:{userId}}. Backend failures never reach the caller:
 * a failed read is a miss and a failed write, delete or clear returns {@code false}.
 * Concurrent misses on the same key each run their own computation.
 */
public class UserCache {

	private static final Logger logger = LoggerFactory.getLogger(UserCache.class);

	private final CacheStore store;

	public UserCache(CacheStore store) {
		this.store = store;
	}

	/**
	 * Derive the cache key of a user's entry.
	 * @param prefix entry prefix, non-blank and free of ':'
	 * @param userId the user id
	 * @return {@code prefix:userId}
	 */
	public static String key(String prefix, long userId) {
		if (prefix.isBlank() || prefix.indexOf(':') >= 0) {
			throw new IllegalArgumentException("Invalid cache prefix: '" + prefix + "'");
		}
		return prefix + ":" + userId;
	}

	public static String key(CachePrefix prefix, long userId) {
		return key(prefix.key(), userId);
	}

	public Optional<Object> get(String key) {
		try {
			Optional<Object> value = store.get(key);
			logger.debug("Cache {} for {}", value.isPresent() ? "hit" : "miss", key);
			return value;
		}
		catch (RuntimeException e) {
			logger.warn("Cache get failed for {}, treating as miss: {}", key, e.getMessage());
			return Optional.empty();
		}
	}

	public boolean set(String key, Object value, Duration ttl) {
		try {
			boolean stored = store.set(key, value, ttl);
			if (stored) {
				logger.debug("Cached {} for {}s", key, ttl.toSeconds());
			}
			return stored;
		}
		catch (RuntimeException e) {
			logger.warn("Cache set failed for {}: {}", key, e.getMessage());
			return false;
		}
	}

	public boolean delete(String key) {
		try {
			return store.delete(key);
		}
		catch (RuntimeException e) {
			logger.warn("Cache delete failed for {}: {}", key, e.getMessage());
			return false;
		}
	}

	/**
	 * Return the cached value of {@code key}, computing and storing it on a miss.
	 * @param key the cache key
	 * @param ttl time to live of a newly stored value
	 * @param compute produces the value on a miss; its exceptions propagate and nothing is
	 * stored
	 * @return the cached or computed value
	 */
	public <T> T cached(String key, Duration ttl, Supplier<T> compute) {
		return lookup(key, ttl, compute).value();
	}

	/**
	 * Same as {@link #cached(String, Duration, Supplier)}, also reporting whether the
	 * value came from the cache.
	 */
	@SuppressWarnings("unchecked")
	public <T> Lookup<T> lookup(String key, Duration ttl, Supplier<T> compute) {
		Optional<Object> hit = get(key);
		if (hit.isPresent()) {
			return new Lookup<>((T) hit.get(), true);
		}
		T value = compute.get();
		set(key, value, ttl);
		return new Lookup<>(value, false);
	}

	/**
	 * Remove one entry of a user, or all of the user's entries.
	 * @param userId the user id
	 * @param prefix prefix of the single entry to remove, or null for every known prefix
	 * @return true if every delete succeeded
	 */
	public boolean invalidateUser(long userId, @Nullable String prefix) {
		if (prefix != null) {
			return delete(key(prefix, userId));
		}
		boolean allDeleted = true;
		for (CachePrefix known : CachePrefix.values()) {
			allDeleted &= delete(key(known, userId));
		}
		logger.debug("Invalidated all cache entries of user {}", userId);
		return allDeleted;
	}

	public boolean clearAll() {
		try {
			boolean cleared = store.clear();
			logger.info("Cleared all cache entries");
			return cleared;
		}
		catch (RuntimeException e) {
			logger.warn("Cache clear failed: {}", e.getMessage());
			return false;
		}
	}

	public String backendName() {
		return store.backendName();
	}

	/**
	 * A value returned by {@link #lookup}.
	 *
	 * @param value the cached or computed value
	 * @param hit true if the value came from the cache
	 */
	public record Lookup<T>(T value, boolean hit) {
	}

}
