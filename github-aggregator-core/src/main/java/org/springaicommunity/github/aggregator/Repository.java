package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A repository the authenticated user owns, collaborates on or can see through an
 * organization.
 *
 * @param id the numeric repository id
 * @param name the repository name
 * @param fullName the name in "owner/repo" form
 * @param description the repository description
 * @param isPrivate whether the repository is private
 * @param htmlUrl the web URL of the repository
 * @param cloneUrl the HTTPS clone URL
 * @param sshUrl the SSH clone URL
 * @param language the primary language detected by GitHub
 * @param stargazersCount number of stars
 * @param watchersCount number of watchers
 * @param forksCount number of forks
 * @param size repository size in kilobytes
 * @param defaultBranch the default branch name
 * @param createdAt when the repository was created
 * @param updatedAt when the repository metadata was last updated
 * @param pushedAt when the last push happened
 * @param archived whether the repository is archived
 * @param disabled whether the repository is disabled
 * @param fork whether the repository is a fork
 * @param topics topics attached to the repository
 * @param visibility "public", "private" or "internal"
 * @param owner the owning user or organization
 */
public record Repository(long id, String name, String fullName, @Nullable String description,
		@JsonProperty("private") boolean isPrivate, @Nullable String htmlUrl, @Nullable String cloneUrl,
		@Nullable String sshUrl, @Nullable String language, int stargazersCount, int watchersCount, int forksCount,
		int size, @Nullable String defaultBranch, @Nullable LocalDateTime createdAt,
		@Nullable LocalDateTime updatedAt, @Nullable LocalDateTime pushedAt, boolean archived, boolean disabled,
		boolean fork, List<String> topics, String visibility, @Nullable UserSummary owner) {
}
