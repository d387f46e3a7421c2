package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;
import java.util.OptionalInt;

/**
 * Interface for GitHub REST API operations made on behalf of one authenticated user.
 *
 * <p>
 * Returns strongly-typed DTOs instead of raw JSON to provide type safety and encapsulate
 * the GitHub API response structure.
 */
public interface RestService {

	/**
	 * Get current core rate limit status.
	 * @return Rate limit information
	 * @throws IOException if the response cannot be read
	 */
	RateLimitInfo getRateLimit() throws IOException;

	/**
	 * Get the profile of the user owning the credential.
	 * @return the user profile
	 * @throws IOException if the response cannot be read
	 */
	UserProfile getAuthenticatedUser() throws IOException;

	/**
	 * Estimate the size of one of the user's collections.
	 *
	 * <p>
	 * Repositories and gists are counted from the profile (public plus private); pull
	 * requests from a search for {@code author:{login} type:pr}.
	 * @param kind the resource kind
	 * @return the estimate, or empty when it could not be obtained
	 */
	OptionalInt getTotalCount(ResourceKind kind);

	/**
	 * Get the users following the authenticated user.
	 * @return follower list
	 * @throws IOException if a response cannot be read
	 */
	List<UserSummary> getFollowers() throws IOException;

	/**
	 * Get the users the authenticated user follows.
	 * @return following list
	 * @throws IOException if a response cannot be read
	 */
	List<UserSummary> getFollowing() throws IOException;

	/**
	 * Fetch the pull request behind an issues-endpoint element and merge its detail
	 * members (code statistics, branches, mergeability, reviewers, assignees) into a copy
	 * of the element.
	 * @param issueElement an element carrying {@code pull_request.url}
	 * @return the enriched copy, or the element itself when it has no detail URL
	 * @throws IOException if the detail response cannot be read
	 */
	JsonNode getPullRequestDetails(JsonNode issueElement) throws IOException;

}
