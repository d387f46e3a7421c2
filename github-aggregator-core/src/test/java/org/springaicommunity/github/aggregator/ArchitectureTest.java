package org.springaicommunity.github.aggregator;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for the GitHub API</li>
 * <li>{@link CacheStore} - key/value cache backend with per-entry TTL</li>
 * <li>{@link PageFetcher}, {@link ItemConverter}, {@link ItemEnricher} - collector
 * stages</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Services → GitHubClientFactory / GitHubClient (NOT GitHubHttpClient)
 *   Services → CacheStore through UserCache (NOT CaffeineCacheStore)
 *   Query pipeline → models only
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.aggregator",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule services_should_not_construct_http_client = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.or()
		.haveSimpleNameEndingWith("Fetcher")
		.or()
		.haveSimpleName("RateLimitGate")
		.should()
		.callConstructor(GitHubHttpClient.class, String.class)
		.because("Services obtain clients from a GitHubClientFactory");

	@ArchTest
	static final ArchRule services_should_not_depend_on_caffeine = noClasses().that()
		.haveNameNotMatching(".*\\.CaffeineCacheStore(\\$.*)?")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("com.github.benmanes.caffeine..")
		.because("Only the Caffeine backend knows the cache implementation");

	@ArchTest
	static final ArchRule only_builder_should_create_cache_backend = noClasses().that()
		.doNotHaveSimpleName("GitHubAggregatorBuilder")
		.and()
		.haveNameNotMatching(".*\\.CaffeineCacheStore(\\$.*)?")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("CaffeineCacheStore")
		.because("Services depend on the CacheStore interface");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule cache_stores_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("CacheStore")
		.and()
		.doNotHaveSimpleName("CacheStore")
		.should()
		.implement(CacheStore.class)
		.because("All *CacheStore classes should implement the CacheStore interface");

	@ArchTest
	static final ArchRule github_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("GitHubClient")
		.and()
		.doNotHaveSimpleName("GitHubClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *GitHubClient classes should implement the GitHubClient interface");

	// ========== Layering ==========

	@ArchTest
	static final ArchRule query_stage_should_not_reach_upstream = noClasses().that()
		.haveSimpleNameStartingWith("Query")
		.or()
		.haveSimpleNameStartingWith("ResourceSchema")
		.or()
		.haveSimpleName("PageInfo")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameStartingWith("GitHub")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Cache")
		.because("Filtering, sorting and pagination work on merged collections only");

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleName("Repository")
		.or()
		.haveSimpleName("Gist")
		.or()
		.haveSimpleName("GistFile")
		.or()
		.haveSimpleName("PullRequest")
		.or()
		.haveSimpleName("UserProfile")
		.or()
		.haveSimpleName("UserSummary")
		.or()
		.haveSimpleNameStartingWith("Collection")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Model classes should be pure data without service dependencies");

	@ArchTest
	static final ArchRule github_services_should_not_depend_on_collection_services = noClasses().that()
		.haveSimpleNameStartingWith("GitHub")
		.and()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("CollectionService")
		.because("GitHub API services are lower-level than collection services");

	@ArchTest
	static final ArchRule parser_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Parser")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Support classes should not depend on higher-level services");

}
