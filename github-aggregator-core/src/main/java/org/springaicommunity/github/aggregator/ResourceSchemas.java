package org.springaicommunity.github.aggregator;

import java.util.ArrayList;
import java.util.List;

import static org.springaicommunity.github.aggregator.ResourceSchema.flag;
import static org.springaicommunity.github.aggregator.ResourceSchema.number;
import static org.springaicommunity.github.aggregator.ResourceSchema.text;
import static org.springaicommunity.github.aggregator.ResourceSchema.time;
import static org.springaicommunity.github.aggregator.SortDirection.ASC;
import static org.springaicommunity.github.aggregator.SortDirection.DESC;

/**
 * Query schemas of the three resource kinds.
 */
public final class ResourceSchemas {

	/**
	 * Repositories: searched by name, description, language and topics; every named sort
	 * defaults to descending.
	 */
	public static final ResourceSchema<Repository> REPOSITORIES = ResourceSchema.<Repository>builder("repositories")
		.searchField(Repository::name)
		.searchField(Repository::description)
		.searchField(Repository::language)
		.searchFields(Repository::topics)
		.sort(text(Repository::name), DESC, "name")
		.sort(text(Repository::language), DESC, "language")
		.sort(number(Repository::stargazersCount), DESC, "stars", "stargazers_count")
		.sort(number(Repository::forksCount), DESC, "forks", "forks_count")
		.sort(number(Repository::size), DESC, "size")
		.sort(time(Repository::createdAt), DESC, "created", "created_at")
		.sort(time(Repository::updatedAt), DESC, "updated", "updated_at")
		.sort(time(Repository::pushedAt), DESC, "pushed", "pushed_at")
		.defaultSort("updated")
		.build();

	/**
	 * Gists: searched by description, file names and file languages; every named sort
	 * defaults to descending.
	 */
	public static final ResourceSchema<Gist> GISTS = ResourceSchema.<Gist>builder("gists")
		.searchField(Gist::description)
		.searchFields(gist -> gist.files().stream().map(GistFile::filename).toList())
		.searchFields(gist -> {
			List<String> languages = new ArrayList<>();
			for (GistFile file : gist.files()) {
				if (file.language() != null) {
					languages.add(file.language());
				}
			}
			return languages;
		})
		.sort(text(Gist::description), DESC, "description")
		.sort(number(Gist::comments), DESC, "comments")
		.sort(number(Gist::fileCount), DESC, "files")
		.sort(flag(Gist::isPublic), DESC, "public")
		.sort(time(Gist::createdAt), DESC, "created", "created_at")
		.sort(time(Gist::updatedAt), DESC, "updated", "updated_at")
		.defaultSort("updated")
		.build();

	/**
	 * Pull requests: searched by title, body, author, repository and number; named sorts
	 * are descending only for the two timestamps.
	 */
	public static final ResourceSchema<PullRequest> PULL_REQUESTS = ResourceSchema
		.<PullRequest>builder("pull requests")
		.searchField(PullRequest::title)
		.searchField(PullRequest::body)
		.searchField(pr -> pr.user() != null ? pr.user().login() : null)
		.searchField(pr -> pr.repository() != null ? pr.repository().name() : null)
		.searchField(pr -> pr.repository() != null ? pr.repository().fullName() : null)
		.searchField(pr -> String.valueOf(pr.number()))
		.sort(time(PullRequest::updatedAt), DESC, "updated")
		.sort(time(PullRequest::createdAt), DESC, "created")
		.sort(text(PullRequest::title), ASC, "title")
		.sort(number(PullRequest::number), ASC, "number")
		.sort(text(PullRequest::state), ASC, "state")
		.sort(text(pr -> pr.user() != null ? pr.user().login() : null), ASC, "author")
		.sort(text(pr -> pr.repository() != null ? pr.repository().name() : null), ASC, "repository")
		.sort(number(PullRequest::comments), ASC, "comments")
		.sort(number(PullRequest::commits), ASC, "commits")
		.sort(number(PullRequest::additions), ASC, "additions")
		.sort(number(PullRequest::deletions), ASC, "deletions")
		.defaultSort("updated")
		.build();

	private ResourceSchemas() {
	}

}
