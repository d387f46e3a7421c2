package org.springaicommunity.github.aggregator;

import java.time.Duration;
import java.util.Optional;

/**
 * Keyed store with a time to live per entry, shared by all requests of the process.
 *
 * <p>
 * Writes report success as a flag rather than throwing; callers treat a failed write as
 * "not cached" and carry on with their data.
 */
public interface CacheStore {

	/**
	 * Look up a live entry.
	 * @param key the cache key
	 * @return the value, or empty when absent or expired
	 */
	Optional<Object> get(String key);

	/**
	 * Store a value, replacing any previous entry and its expiry.
	 * @param key the cache key
	 * @param value the value to store
	 * @param ttl time to live, must be positive
	 * @return true if the value was stored
	 */
	boolean set(String key, Object value, Duration ttl);

	/**
	 * Remove one entry. Removing an absent key succeeds.
	 * @param key the cache key
	 * @return true if the key is no longer present
	 */
	boolean delete(String key);

	/**
	 * Remove every entry of every user.
	 * @return true if the store is now empty
	 */
	boolean clear();

	/**
	 * Short description of the backend for status reports.
	 * @return backend name
	 */
	default String backendName() {
		return getClass().getSimpleName();
	}

}
