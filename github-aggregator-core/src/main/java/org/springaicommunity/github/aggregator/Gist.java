package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A gist owned by the authenticated user.
 *
 * @param id the gist id (a hex string)
 * @param description the gist description
 * @param isPublic whether the gist is public
 * @param htmlUrl the web URL of the gist
 * @param gitPullUrl the git pull URL
 * @param gitPushUrl the git push URL
 * @param createdAt when the gist was created
 * @param updatedAt when the gist was last updated
 * @param comments number of comments
 * @param files files in the gist, in the order GitHub lists them
 * @param owner the gist owner
 * @param truncated whether GitHub truncated the file list
 */
public record Gist(String id, @Nullable String description, @JsonProperty("public") boolean isPublic,
		@Nullable String htmlUrl, @Nullable String gitPullUrl, @Nullable String gitPushUrl,
		@Nullable LocalDateTime createdAt, @Nullable LocalDateTime updatedAt, int comments, List<GistFile> files,
		@Nullable UserSummary owner, boolean truncated) {

	@JsonProperty("file_count")
	public int fileCount() {
		return files.size();
	}

}
