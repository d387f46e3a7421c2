package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;

/**
 * Compact view of a GitHub user as embedded in other payloads (owners, authors,
 * reviewers) and in follower listings.
 *
 * @param id the numeric GitHub user id
 * @param login the GitHub username (never null)
 * @param avatarUrl the avatar image URL
 * @param htmlUrl the profile page URL
 */
public record UserSummary(long id, String login, @Nullable String avatarUrl, @Nullable String htmlUrl) {
}
