package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * Profile of the authenticated user.
 *
 * <p>
 * {@code totalRepos} and {@code totalGists} include private items, unlike
 * {@code publicRepos}.
 *
 * @param id the numeric user id
 * @param login the GitHub username
 * @param name display name
 * @param email public email
 * @param avatarUrl avatar image URL
 * @param bio profile bio
 * @param location profile location
 * @param company profile company
 * @param blog profile website
 * @param twitterUsername linked Twitter handle
 * @param publicRepos number of public repositories
 * @param totalRepos public plus private repositories
 * @param totalGists public plus private gists
 * @param followers follower count
 * @param following following count
 * @param createdAt account creation time
 * @param updatedAt last profile update
 * @param htmlUrl profile page URL
 */
public record UserProfile(long id, String login, @Nullable String name, @Nullable String email,
		@Nullable String avatarUrl, @Nullable String bio, @Nullable String location, @Nullable String company,
		@Nullable String blog, @Nullable String twitterUsername, int publicRepos, int totalRepos, int totalGists,
		int followers, int following, @Nullable LocalDateTime createdAt, @Nullable LocalDateTime updatedAt,
		@Nullable String htmlUrl) {
}
