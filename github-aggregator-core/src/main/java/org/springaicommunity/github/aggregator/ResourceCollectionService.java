package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalInt;

/**
 * Serves filtered, sorted and paginated views of one resource kind.
 *
 * <p>
 * A request passes the authentication check and the rate-limit gate, then reads the
 * user's merged collection from the cache. On a miss the collection is gathered with a
 * {@link ParallelCollector} and stored for the TTL of the kind's tier. The query
 * pipeline runs on the cached collection; sort, search and page changes never fetch
 * again.
 *
 * @param <T> item type
 */
public class ResourceCollectionService<T> {

	private static final Logger logger = LoggerFactory.getLogger(ResourceCollectionService.class);

	private final ResourceKind kind;

	private final GitHubClientFactory clientFactory;

	private final ObjectMapper objectMapper;

	private final RateLimitGate rateLimitGate;

	private final UserCache cache;

	private final ParallelCollector<JsonNode, T> collector;

	private final QueryPipeline<T> pipeline;

	private final AggregatorProperties properties;

	public ResourceCollectionService(ResourceKind kind, GitHubClientFactory clientFactory, ObjectMapper objectMapper,
			RateLimitGate rateLimitGate, UserCache cache, ParallelCollector<JsonNode, T> collector,
			QueryPipeline<T> pipeline, AggregatorProperties properties) {
		this.kind = kind;
		this.clientFactory = clientFactory;
		this.objectMapper = objectMapper;
		this.rateLimitGate = rateLimitGate;
		this.cache = cache;
		this.collector = collector;
		this.pipeline = pipeline;
		this.properties = properties;
	}

	public ResourceKind getKind() {
		return kind;
	}

	/**
	 * Serve one page of the user's collection.
	 * @param query the request
	 * @return the response envelope
	 * @throws AuthenticationRequiredException if the query carries no user or credential
	 * @throws RateLimitExceededException if the remaining budget is too low
	 * @throws AggregateFetchException if the collection could not be gathered at all
	 */
	public CollectionResponse<T> list(CollectionQuery query) {
		long start = System.nanoTime();
		if (!query.isAuthenticated()) {
			throw new AuthenticationRequiredException();
		}
		long userId = query.userId();
		String credential = query.credential();
		logger.debug("Listing {} for user {}: sort={}, search='{}', page={}, per_page={}, table_sort={} {}",
				kind.shortName(), userId, query.sort(), query.search(), query.page(), query.perPage(),
				query.tableSort(), query.tableSortDirection());

		if (!rateLimitGate.check(credential, userId, properties.rateLimitThreshold(kind))) {
			throw new RateLimitExceededException();
		}

		long fetchStart = System.nanoTime();
		UserCache.Lookup<List<T>> collection = cache.lookup(UserCache.key(kind.cachePrefix(), userId),
				properties.cacheTtl(kind.cacheTier()), () -> collect(credential, userId));
		QueryResult<T> result = pipeline.run(collection.value(), query.search(), query.sort(), query.tableSort(),
				query.tableSortDirection(), query.page(), query.perPage());
		double fetchTime = secondsSince(fetchStart);

		PageInfo pageInfo = result.pageInfo();
		boolean tableSortApplied = query.tableSort() != null;
		CollectionResponse.DebugInfo debugInfo = new CollectionResponse.DebugInfo(secondsSince(start), fetchTime,
				pageInfo.totalCount(), result.items().size(), collection.hit(), tableSortApplied);
		logger.debug("Returning {} {} (page {}/{}, cache {})", result.items().size(), kind.shortName(),
				pageInfo.page(), pageInfo.totalPages(), collection.hit() ? "hit" : "miss");
		return new CollectionResponse<>(result.items(), pageInfo.page(), pageInfo.perPage(), pageInfo.totalCount(),
				pageInfo.totalPages(), pageInfo.hasNext(), pageInfo.hasPrev(), query.search(), query.sort(),
				query.tableSort(), tableSortApplied ? SortDirection.parse(query.tableSortDirection()).wireName() : null,
				debugInfo);
	}

	private List<T> collect(String credential, long userId) {
		RestService restService = new GitHubRestService(clientFactory.forToken(credential), objectMapper);
		OptionalInt total = restService.getTotalCount(kind);
		if (total.isEmpty()) {
			throw new AggregateFetchException("Failed to fetch " + kind.shortName() + ": could not determine how many "
					+ kind.shortName() + " user " + userId + " has");
		}
		int estimate = Math.min(total.getAsInt(), properties.maxItems(kind));
		logger.debug("Collecting up to {} {} for user {} (reported {})", estimate, kind.shortName(), userId,
				total.getAsInt());
		return List.copyOf(collector.collect(credential, estimate, properties.getPageSize(), properties.maxPages(kind)));
	}

	private static double secondsSince(long startNanos) {
		return (System.nanoTime() - startNanos) / 1_000_000_000.0;
	}

}
