package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for wiring the aggregator services without a dependency injection container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults overlaid with the environment (.env file, then process environment)
 * AggregatorApi api = GitHubAggregatorBuilder.create()
 *     .properties(AggregatorProperties.fromEnvironment())
 *     .build();
 *
 * ApiResponse response = api.repositories(CollectionQuery.builder()
 *     .userId(userId)
 *     .credential(accessToken)
 *     .search("spring")
 *     .build());
 *
 * // For testing with a mock HTTP client and an injected cache
 * GitHubClient mockClient = mock(GitHubClient.class);
 * AggregatorApi testApi = GitHubAggregatorBuilder.create()
 *     .clientFactory(token -> mockClient)
 *     .cacheStore(new CaffeineCacheStore(100))
 *     .build();
 * }
 * </pre>
 *
 * <p>
 * All services built by one builder share a single {@link CacheStore}, created on first
 * use when none was supplied.
 */
public class GitHubAggregatorBuilder {

	private AggregatorProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClientFactory clientFactory;

	private @Nullable CacheStore cacheStore;

	private @Nullable UserCache userCache;

	private GitHubAggregatorBuilder() {
		this.properties = new AggregatorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubAggregatorBuilder
	 */
	public static GitHubAggregatorBuilder create() {
		return new GitHubAggregatorBuilder();
	}

	/**
	 * Set aggregator properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubAggregatorBuilder properties(@Nullable AggregatorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use {@link ObjectMapperFactory})
	 * @return this builder
	 */
	public GitHubAggregatorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom client factory. Useful for testing with mocks.
	 * @param clientFactory factory of per-credential clients (null to use
	 * {@link GitHubHttpClient#factory})
	 * @return this builder
	 */
	public GitHubAggregatorBuilder clientFactory(@Nullable GitHubClientFactory clientFactory) {
		this.clientFactory = clientFactory;
		return this;
	}

	/**
	 * Set the cache backend shared by all services of this builder.
	 * @param cacheStore the backend (null to use a {@link CaffeineCacheStore})
	 * @return this builder
	 */
	public GitHubAggregatorBuilder cacheStore(@Nullable CacheStore cacheStore) {
		this.cacheStore = cacheStore;
		this.userCache = null;
		return this;
	}

	/**
	 * Build the consumer-facing API over all services.
	 * @return configured AggregatorApi
	 */
	public AggregatorApi build() {
		return new AggregatorApi(buildRepositoryService(), buildGistService(), buildPullRequestService(),
				buildProfileService(), userCache(), properties);
	}

	public ResourceCollectionService<Repository> buildRepositoryService() {
		ParallelCollector<JsonNode, Repository> collector = this
			.<Repository>collectorFor(ResourceKind.REPOSITORIES)
			.converter(JsonItemParser::parseRepository)
			.build();
		return collectionService(ResourceKind.REPOSITORIES, collector, ResourceSchemas.REPOSITORIES);
	}

	public ResourceCollectionService<Gist> buildGistService() {
		ParallelCollector<JsonNode, Gist> collector = this.<Gist>collectorFor(ResourceKind.GISTS)
			.converter(JsonItemParser::parseGist)
			.build();
		return collectionService(ResourceKind.GISTS, collector, ResourceSchemas.GISTS);
	}

	public ResourceCollectionService<PullRequest> buildPullRequestService() {
		ParallelCollector<JsonNode, PullRequest> collector = this
			.<PullRequest>collectorFor(ResourceKind.PULL_REQUESTS)
			.converter(JsonItemParser::parsePullRequest)
			.maxItems(properties.getMaxPullRequests())
			.enricher(new PullRequestDetailEnricher(clientFactory(), objectMapper()))
			.maxEnrichedItems(properties.getMaxEnrichedPullRequests())
			.enrichmentWorkers(properties.getEnrichmentWorkers())
			.enrichmentTimeout(properties.getEnrichmentTimeout())
			.build();
		return collectionService(ResourceKind.PULL_REQUESTS, collector, ResourceSchemas.PULL_REQUESTS);
	}

	public ProfileService buildProfileService() {
		return new ProfileService(clientFactory(), objectMapper(), userCache(), properties.cacheTtl(CacheTier.LONG));
	}

	public RateLimitGate buildRateLimitGate() {
		return new RateLimitGate(clientFactory(), objectMapper(), userCache(), properties.cacheTtl(CacheTier.SHORT));
	}

	private <T> ParallelCollector.Builder<JsonNode, T> collectorFor(ResourceKind kind) {
		return ParallelCollector.<JsonNode, T>builder()
			.name(kind.shortName())
			.pageFetcher(new GitHubPageFetcher(kind, clientFactory(), objectMapper()))
			.maxFetchWorkers(properties.fetchWorkers(kind))
			.maxConversionWorkers(properties.getMaxConversionWorkers())
			.fetchTimeout(properties.getFetchTimeout())
			.conversionTimeout(properties.getConversionTimeout());
	}

	private <T> ResourceCollectionService<T> collectionService(ResourceKind kind,
			ParallelCollector<JsonNode, T> collector, ResourceSchema<T> schema) {
		return new ResourceCollectionService<>(kind, clientFactory(), objectMapper(), buildRateLimitGate(),
				userCache(), collector, new QueryPipeline<>(schema), properties);
	}

	private ObjectMapper objectMapper() {
		if (this.objectMapper == null) {
			this.objectMapper = ObjectMapperFactory.create();
		}
		return this.objectMapper;
	}

	private GitHubClientFactory clientFactory() {
		if (this.clientFactory == null) {
			this.clientFactory = GitHubHttpClient.factory(properties.getApiBaseUrl(), properties.getRequestTimeout());
		}
		return this.clientFactory;
	}

	private UserCache userCache() {
		if (this.userCache == null) {
			if (this.cacheStore == null) {
				this.cacheStore = new CaffeineCacheStore(properties.getCacheMaximumSize());
			}
			this.userCache = new UserCache(this.cacheStore);
		}
		return this.userCache;
	}

}
