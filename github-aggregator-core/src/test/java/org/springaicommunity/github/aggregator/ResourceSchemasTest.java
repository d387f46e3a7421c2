package org.springaicommunity.github.aggregator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResourceSchemas Tests")
class ResourceSchemasTest {

	private static PullRequest pullRequest(long id, int number, String title, String author, String repository,
			int additions, int updatedDay) {
		return new PullRequest(id, number, title, null, "open", new UserSummary(id, author, null, null),
				LocalDateTime.of(2024, 1, updatedDay, 0, 0), LocalDateTime.of(2024, 1, updatedDay, 0, 0), null, null,
				null, null, null, new PullRequest.RepositoryRef(0, repository, "me/" + repository, null), false, null,
				null, null, additions, 0, 0, 0, 0, 0, List.of(), List.of(), List.of());
	}

	private static Gist gist(String id, String description, boolean isPublic, List<GistFile> files) {
		return new Gist(id, description, isPublic, null, null, null, null, null, 0, files, null, false);
	}

	@Test
	@DisplayName("Pull request sorts are ascending by name except for timestamps")
	void pullRequestDefaultDirections() {
		QueryPipeline<PullRequest> pipeline = new QueryPipeline<>(ResourceSchemas.PULL_REQUESTS);
		List<PullRequest> prs = List.of(pullRequest(1, 30, "Beta", "zoe", "tool", 5, 3),
				pullRequest(2, 10, "alpha", "adam", "api", 50, 9), pullRequest(3, 20, "Gamma", "mia", "web", 1, 1));

		assertThat(pipeline.sort(prs, "title", null, null)).extracting(PullRequest::id).containsExactly(2L, 1L, 3L);
		assertThat(pipeline.sort(prs, "number", null, null)).extracting(PullRequest::id).containsExactly(2L, 3L, 1L);
		assertThat(pipeline.sort(prs, "author", null, null)).extracting(PullRequest::id).containsExactly(2L, 3L, 1L);
		assertThat(pipeline.sort(prs, "updated", null, null)).extracting(PullRequest::id).containsExactly(2L, 1L, 3L);
		assertThat(pipeline.sort(prs, null, "additions", "desc")).extracting(PullRequest::id)
			.containsExactly(2L, 1L, 3L);
	}

	@Test
	@DisplayName("Pull requests match by author, repository and number")
	void pullRequestSearchFields() {
		QueryPipeline<PullRequest> pipeline = new QueryPipeline<>(ResourceSchemas.PULL_REQUESTS);
		List<PullRequest> prs = List.of(pullRequest(1, 4347, "Fix", "zoe", "spring-ai", 5, 3),
				pullRequest(2, 12, "Docs", "adam", "api", 50, 9));

		assertThat(pipeline.filter(prs, "ADAM")).extracting(PullRequest::id).containsExactly(2L);
		assertThat(pipeline.filter(prs, "spring-ai")).extracting(PullRequest::id).containsExactly(1L);
		assertThat(pipeline.filter(prs, "me/api")).extracting(PullRequest::id).containsExactly(2L);
		assertThat(pipeline.filter(prs, "4347")).extracting(PullRequest::id).containsExactly(1L);
	}

	@Test
	@DisplayName("Gists match by file name and language, and sort by file count")
	void gistSearchAndSort() {
		QueryPipeline<Gist> pipeline = new QueryPipeline<>(ResourceSchemas.GISTS);
		List<Gist> gists = List.of(gist("a", "Shell helpers", true, List.of(new GistFile("deploy.sh", null, "Shell", null, 10))),
				gist("b", null, false,
						List.of(new GistFile("Notes.md", null, "Markdown", null, 5),
								new GistFile("todo.txt", null, null, null, 1))));

		assertThat(pipeline.filter(gists, "notes")).extracting(Gist::id).containsExactly("b");
		assertThat(pipeline.filter(gists, "markdown")).extracting(Gist::id).containsExactly("b");
		assertThat(pipeline.filter(gists, "shell")).extracting(Gist::id).containsExactly("a");
		assertThat(pipeline.sort(gists, "files", null, null)).extracting(Gist::id).containsExactly("b", "a");
		assertThat(pipeline.sort(gists, null, "public", "asc")).extracting(Gist::id).containsExactly("b", "a");
	}

	@Test
	@DisplayName("Sort names are case-insensitive and aliases resolve to the same sort")
	void sortNamesAreCaseInsensitive() {
		assertThat(ResourceSchemas.REPOSITORIES.sort("STARS")).isPresent();
		assertThat(ResourceSchemas.REPOSITORIES.sort("stargazers_count")).isEqualTo(ResourceSchemas.REPOSITORIES.sort("stars"));
		assertThat(ResourceSchemas.REPOSITORIES.sort("popularity")).isEmpty();
		assertThat(ResourceSchemas.REPOSITORIES.sort(null)).isEmpty();
	}

}
