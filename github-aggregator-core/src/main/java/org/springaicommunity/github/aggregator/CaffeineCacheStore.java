package org.springaicommunity.github.aggregator;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory {@link CacheStore} backed by Caffeine, with a TTL carried by each entry.
 */
public class CaffeineCacheStore implements CacheStore {

	private static final Logger logger = LoggerFactory.getLogger(CaffeineCacheStore.class);

	private final Cache<String, Entry> cache;

	public CaffeineCacheStore(long maximumSize) {
		this(maximumSize, Ticker.systemTicker());
	}

	/**
	 * Create a store reading time from {@code ticker}; tests pass a manual ticker.
	 * @param maximumSize maximum number of entries before eviction
	 * @param ticker time source for expiry
	 */
	public CaffeineCacheStore(long maximumSize, Ticker ticker) {
		this.cache = Caffeine.newBuilder()
			.maximumSize(maximumSize)
			.expireAfter(new EntryExpiry())
			.ticker(ticker)
			.executor(Runnable::run)
			.build();
	}

	@Override
	public Optional<Object> get(String key) {
		Entry entry = cache.getIfPresent(key);
		return entry == null ? Optional.empty() : Optional.of(entry.value());
	}

	@Override
	public boolean set(String key, Object value, Duration ttl) {
		if (ttl.isZero() || ttl.isNegative()) {
			logger.warn("Refusing to cache {} with non-positive ttl {}", key, ttl);
			return false;
		}
		cache.put(key, new Entry(value, ttl.toNanos()));
		return true;
	}

	@Override
	public boolean delete(String key) {
		cache.invalidate(key);
		return true;
	}

	@Override
	public boolean clear() {
		cache.invalidateAll();
		cache.cleanUp();
		return true;
	}

	@Override
	public String backendName() {
		return "caffeine";
	}

	long estimatedSize() {
		return cache.estimatedSize();
	}

	private record Entry(Object value, long ttlNanos) {
	}

	private static final class EntryExpiry implements Expiry<String, Entry> {

		@Override
		public long expireAfterCreate(String key, Entry entry, long currentTime) {
			return entry.ttlNanos();
		}

		@Override
		public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
			return entry.ttlNanos();
		}

		@Override
		public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
			return currentDuration;
		}

	}

}
