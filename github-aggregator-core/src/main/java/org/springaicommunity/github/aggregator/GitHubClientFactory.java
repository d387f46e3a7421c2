package org.springaicommunity.github.aggregator;

/**
 * Creates {@link GitHubClient} instances bound to a user's bearer credential.
 */
@FunctionalInterface
public interface GitHubClientFactory {

	GitHubClient forToken(String token);

}
