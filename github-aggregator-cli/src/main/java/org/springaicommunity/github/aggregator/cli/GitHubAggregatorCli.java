package org.springaicommunity.github.aggregator.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.aggregator.AggregatorApi;
import org.springaicommunity.github.aggregator.AggregatorProperties;
import org.springaicommunity.github.aggregator.ApiResponse;
import org.springaicommunity.github.aggregator.CollectionQuery;
import org.springaicommunity.github.aggregator.EnvironmentSupport;
import org.springaicommunity.github.aggregator.GitHubAggregatorBuilder;
import org.springaicommunity.github.aggregator.GitHubHttpClient;
import org.springaicommunity.github.aggregator.GitHubRestService;
import org.springaicommunity.github.aggregator.ObjectMapperFactory;
import org.springaicommunity.github.aggregator.ResourceKind;
import org.springaicommunity.github.aggregator.UserProfile;

import java.io.PrintStream;

/**
 * GitHub Aggregator CLI Application
 *
 * Plain Java command-line application that serves one page of the authenticated user's
 * repositories, gists or pull requests, or their profile and social lists, and prints
 * the response envelope as JSON on standard output. Logging goes to standard error.
 *
 * Usage: java -jar github-aggregator-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub access token for authentication
 *
 * Examples: java -jar github-aggregator-cli.jar --type repos --search spring java -jar
 * github-aggregator-cli.jar --type prs --table-sort additions --table-sort-direction desc
 */
public class GitHubAggregatorCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubAggregatorCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args, System.out);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Request failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args, PrintStream out) throws Exception {
		ArgumentParser argumentParser = new ArgumentParser();

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);

		argumentParser.validateEnvironment();
		String token = EnvironmentSupport.get("GITHUB_TOKEN");

		logConfiguration(config);

		AggregatorProperties properties = AggregatorProperties.fromEnvironment();
		AggregatorApi api = GitHubAggregatorBuilder.create().properties(properties).build();

		// The session user id keys the cache; a CLI run has no session, so resolve it
		UserProfile user = new GitHubRestService(
				GitHubHttpClient.factory(properties.getApiBaseUrl(), properties.getRequestTimeout()).forToken(token),
				ObjectMapperFactory.create())
			.getAuthenticatedUser();
		logger.info("Authenticated as {} ({})", user.login(), user.id());

		ApiResponse response = execute(api, config, user.id(), token);

		ObjectMapper objectMapper = ObjectMapperFactory.create().enable(SerializationFeature.INDENT_OUTPUT);
		out.println(objectMapper.writeValueAsString(response.body()));

		if (!response.isSuccess()) {
			logger.warn("Request for {} returned status {}", config.type, response.status());
			return 1;
		}
		return 0;
	}

	static ApiResponse execute(AggregatorApi api, ParsedConfiguration config, long userId, String token) {
		switch (config.type) {
			case "profile":
				return api.profile(userId, token);
			case "followers":
				return api.followers(userId, token);
			case "following":
				return api.following(userId, token);
			default:
				ResourceKind kind = ResourceKind.fromShortName(config.type)
					.orElseThrow(() -> new IllegalArgumentException("Unknown type: " + config.type));
				CollectionQuery query = CollectionQuery.builder()
					.userId(userId)
					.credential(token)
					.sort(config.sort)
					.search(config.search)
					.page(config.page)
					.perPage(config.perPage)
					.tableSort(config.tableSort)
					.tableSortDirection(config.tableSortDirection)
					.build();
				return api.collection(kind, query);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Type: {}", config.type);
		if (config.isCollectionType()) {
			logger.info("  Sort: {}", config.sort);
			logger.info("  Search: {}", config.search.isEmpty() ? "(none)" : config.search);
			logger.info("  Page: {}", config.page);
			logger.info("  Per page: {}", config.perPage);
			logger.info("  Table sort: {}",
					config.tableSort != null ? config.tableSort + " " + config.tableSortDirection : "(not set)");
		}
	}

}
