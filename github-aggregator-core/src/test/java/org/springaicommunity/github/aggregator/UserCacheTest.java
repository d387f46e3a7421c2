package org.springaicommunity.github.aggregator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("UserCache Tests")
@ExtendWith(MockitoExtension.class)
class UserCacheTest {

	private static final Duration TTL = Duration.ofMinutes(5);

	@Mock
	private CacheStore store;

	@Nested
	@DisplayName("Keys")
	class KeyTest {

		@Test
		@DisplayName("Should join prefix and user id")
		void shouldJoinPrefixAndUserId() {
			assertThat(UserCache.key(CachePrefix.REPOSITORIES, 42)).isEqualTo("repos:42");
			assertThat(UserCache.key(CachePrefix.PULL_REQUESTS, 42)).isEqualTo("pullrequests:42");
			assertThat(UserCache.key(CachePrefix.RATE_LIMIT, 7)).isEqualTo("rate_limit:7");
		}

		@ParameterizedTest
		@ValueSource(strings = { "", "  ", "repos:extra" })
		@DisplayName("Should reject blank prefixes and prefixes containing ':'")
		void shouldRejectInvalidPrefix(String prefix) {
			assertThatThrownBy(() -> UserCache.key(prefix, 1)).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Cache-aside")
	class CacheAsideTest {

		private UserCache cache;

		@BeforeEach
		void setUp() {
			cache = new UserCache(new CaffeineCacheStore(100));
		}

		@Test
		@DisplayName("Should compute once and then serve from the cache")
		void shouldComputeOnce() {
			AtomicInteger computations = new AtomicInteger();

			UserCache.Lookup<List<String>> first = cache.lookup("repos:1", TTL, () -> {
				computations.incrementAndGet();
				return List.of("a", "b");
			});
			UserCache.Lookup<List<String>> second = cache.lookup("repos:1", TTL, () -> {
				computations.incrementAndGet();
				return List.of("c");
			});

			assertThat(first.hit()).isFalse();
			assertThat(second.hit()).isTrue();
			assertThat(second.value()).containsExactly("a", "b");
			assertThat(computations).hasValue(1);
		}

		@Test
		@DisplayName("Should store nothing when the computation fails")
		void shouldNotStoreFailure() {
			assertThatThrownBy(() -> cache.cached("repos:1", TTL, () -> {
				throw new AggregateFetchException("upstream down");
			})).isInstanceOf(AggregateFetchException.class);

			assertThat(cache.get("repos:1")).isEmpty();
		}

		@Test
		@DisplayName("Should invalidate one prefix or every prefix of a user")
		void shouldInvalidateUser() {
			cache.set("repos:1", "r", TTL);
			cache.set("gists:1", "g", TTL);
			cache.set("rate_limit:1", "x", TTL);
			cache.set("repos:2", "other user", TTL);

			assertThat(cache.invalidateUser(1, "repos")).isTrue();
			assertThat(cache.get("repos:1")).isEmpty();
			assertThat(cache.get("gists:1")).isPresent();

			assertThat(cache.invalidateUser(1, null)).isTrue();
			assertThat(cache.get("gists:1")).isEmpty();
			assertThat(cache.get("rate_limit:1")).isEmpty();
			assertThat(cache.get("repos:2")).contains("other user");
		}

		@Test
		@DisplayName("Should reject an invalid prefix on invalidation")
		void shouldRejectInvalidPrefixOnInvalidation() {
			assertThatThrownBy(() -> cache.invalidateUser(1, "a:b")).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Backend Failures")
	class BackendFailureTest {

		@Test
		@DisplayName("A failing read should be a miss")
		void failingReadShouldBeMiss() {
			when(store.get(anyString())).thenThrow(new IllegalStateException("connection refused"));
			UserCache cache = new UserCache(store);

			UserCache.Lookup<String> lookup = cache.lookup("profile:1", TTL, () -> "fresh");

			assertThat(lookup.value()).isEqualTo("fresh");
			assertThat(lookup.hit()).isFalse();
		}

		@Test
		@DisplayName("Failing writes should return false")
		void failingWritesShouldReturnFalse() {
			when(store.set(anyString(), any(), any())).thenThrow(new IllegalStateException("read only"));
			when(store.delete(anyString())).thenThrow(new IllegalStateException("read only"));
			when(store.clear()).thenThrow(new IllegalStateException("read only"));
			UserCache cache = new UserCache(store);

			assertThat(cache.set("profile:1", "value", TTL)).isFalse();
			assertThat(cache.delete("profile:1")).isFalse();
			assertThat(cache.invalidateUser(1, null)).isFalse();
			assertThat(cache.clearAll()).isFalse();
		}

	}

}
