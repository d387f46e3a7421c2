package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Represents a GitHub pull request authored by, assigned to or involving the
 * authenticated user.
 *
 * <p>
 * Pull requests are listed through the issues endpoint, which omits code statistics and
 * branch data. Those fields keep their zero values unless detail enrichment filled them
 * in.
 *
 * @param id the numeric id
 * @param number the pull request number within its repository
 * @param title the title (never null)
 * @param body the description (may be null)
 * @param state "open" or "closed"
 * @param user the author
 * @param createdAt when the pull request was opened
 * @param updatedAt when the pull request was last updated
 * @param closedAt when it was closed (null while open)
 * @param mergedAt when it was merged (null if not merged)
 * @param htmlUrl the web URL
 * @param base the target branch
 * @param head the source branch
 * @param repository the repository the pull request belongs to
 * @param draft whether this is a draft
 * @param mergeable whether GitHub considers it mergeable (null while unknown)
 * @param mergeableState GitHub's mergeable state (e.g. "clean", "dirty")
 * @param mergedBy the user who merged it
 * @param additions lines added
 * @param deletions lines deleted
 * @param changedFiles files changed
 * @param comments number of issue comments
 * @param reviewComments number of review comments
 * @param commits number of commits
 * @param assignees assigned users
 * @param requestedReviewers users whose review is requested
 * @param labels label names
 */
public record PullRequest(long id, int number, String title, @Nullable String body, String state,
		@Nullable UserSummary user, @Nullable LocalDateTime createdAt, @Nullable LocalDateTime updatedAt,
		@Nullable LocalDateTime closedAt, @Nullable LocalDateTime mergedAt, @Nullable String htmlUrl,
		@Nullable Branch base, @Nullable Branch head, @Nullable RepositoryRef repository, boolean draft,
		@Nullable Boolean mergeable, @Nullable String mergeableState, @Nullable UserSummary mergedBy, int additions,
		int deletions, int changedFiles, int comments, int reviewComments, int commits, List<UserSummary> assignees,
		List<UserSummary> requestedReviewers, List<String> labels) {

	/**
	 * A branch reference on either side of a pull request.
	 *
	 * @param ref the branch name
	 * @param sha the commit the branch points at
	 * @param label the "owner:branch" label
	 */
	public record Branch(String ref, @Nullable String sha, @Nullable String label) {
	}

	/**
	 * The repository a pull request belongs to.
	 *
	 * @param id the repository id, 0 when only the URL was known
	 * @param name the repository name
	 * @param fullName the "owner/repo" name
	 * @param htmlUrl the repository web URL
	 */
	public record RepositoryRef(long id, String name, String fullName, @Nullable String htmlUrl) {
	}

}
