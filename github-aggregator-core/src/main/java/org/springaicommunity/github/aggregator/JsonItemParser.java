package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Maps raw GitHub JSON elements to the aggregator's records.
 *
 * <p>
 * Missing optional members take their zero value. An element without its identity
 * member ({@code id}, {@code login}) is rejected with {@link IllegalArgumentException},
 * which the collector treats as a failed conversion of that single item.
 */
public final class JsonItemParser {

	private static final Logger logger = LoggerFactory.getLogger(JsonItemParser.class);

	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

	private JsonItemParser() {
	}

	public static Repository parseRepository(JsonNode node) {
		requireMember(node, "id");
		boolean isPrivate = node.path("private").asBoolean(false);
		return new Repository(node.path("id").asLong(), node.path("name").asText(""),
				node.path("full_name").asText(""), textOrNull(node, "description"), isPrivate,
				textOrNull(node, "html_url"), textOrNull(node, "clone_url"), textOrNull(node, "ssh_url"),
				textOrNull(node, "language"), node.path("stargazers_count").asInt(0),
				node.path("watchers_count").asInt(0), node.path("forks_count").asInt(0), node.path("size").asInt(0),
				textOrNull(node, "default_branch"), parseDateTime(textOrNull(node, "created_at")),
				parseDateTime(textOrNull(node, "updated_at")), parseDateTime(textOrNull(node, "pushed_at")),
				node.path("archived").asBoolean(false), node.path("disabled").asBoolean(false),
				node.path("fork").asBoolean(false), parseStrings(node.path("topics")),
				node.path("visibility").asText(isPrivate ? "private" : "public"), parseUserOrNull(node.path("owner")));
	}

	public static Gist parseGist(JsonNode node) {
		requireMember(node, "id");
		List<GistFile> files = new ArrayList<>();
		Iterator<Map.Entry<String, JsonNode>> fields = node.path("files").fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> entry = fields.next();
			JsonNode file = entry.getValue();
			files.add(new GistFile(file.path("filename").asText(entry.getKey()), textOrNull(file, "type"),
					textOrNull(file, "language"), textOrNull(file, "raw_url"), file.path("size").asLong(0)));
		}
		return new Gist(node.path("id").asText(), textOrNull(node, "description"),
				node.path("public").asBoolean(true), textOrNull(node, "html_url"), textOrNull(node, "git_pull_url"),
				textOrNull(node, "git_push_url"), parseDateTime(textOrNull(node, "created_at")),
				parseDateTime(textOrNull(node, "updated_at")), node.path("comments").asInt(0), files,
				parseUserOrNull(node.path("owner")), node.path("truncated").asBoolean(false));
	}

	/**
	 * Parse a pull request from an issues-endpoint element, optionally enriched with
	 * detail members.
	 * @param node the element
	 * @return the pull request
	 */
	public static PullRequest parsePullRequest(JsonNode node) {
		requireMember(node, "id");
		String mergedAt = textOrNull(node, "merged_at");
		if (mergedAt == null) {
			mergedAt = textOrNull(node.path("pull_request"), "merged_at");
		}
		JsonNode mergeable = node.path("mergeable");
		return new PullRequest(node.path("id").asLong(), node.path("number").asInt(0), node.path("title").asText(""),
				textOrNull(node, "body"), node.path("state").asText("open"), parseUserOrNull(node.path("user")),
				parseDateTime(textOrNull(node, "created_at")), parseDateTime(textOrNull(node, "updated_at")),
				parseDateTime(textOrNull(node, "closed_at")), parseDateTime(mergedAt), textOrNull(node, "html_url"),
				parseBranch(node.path("base")), parseBranch(node.path("head")), parseRepositoryRef(node),
				node.path("draft").asBoolean(false), mergeable.isBoolean() ? mergeable.asBoolean() : null,
				textOrNull(node, "mergeable_state"), parseUserOrNull(node.path("merged_by")),
				node.path("additions").asInt(0), node.path("deletions").asInt(0),
				node.path("changed_files").asInt(0), node.path("comments").asInt(0),
				node.path("review_comments").asInt(0), node.path("commits").asInt(0),
				parseUsers(node.path("assignees")), parseUsers(node.path("requested_reviewers")),
				parseLabelNames(node.path("labels")));
	}

	/**
	 * Parse the authenticated user's profile from {@code /user}.
	 * @param node the user element
	 * @return the profile
	 */
	public static UserProfile parseUserProfile(JsonNode node) {
		requireMember(node, "login");
		int publicRepos = node.path("public_repos").asInt(0);
		int publicGists = node.path("public_gists").asInt(0);
		return new UserProfile(node.path("id").asLong(), node.path("login").asText(), textOrNull(node, "name"),
				textOrNull(node, "email"), textOrNull(node, "avatar_url"), textOrNull(node, "bio"),
				textOrNull(node, "location"), textOrNull(node, "company"), textOrNull(node, "blog"),
				textOrNull(node, "twitter_username"), publicRepos,
				publicRepos + node.path("total_private_repos").asInt(0),
				publicGists + node.path("private_gists").asInt(0), node.path("followers").asInt(0),
				node.path("following").asInt(0), parseDateTime(textOrNull(node, "created_at")),
				parseDateTime(textOrNull(node, "updated_at")), textOrNull(node, "html_url"));
	}

	public static UserSummary parseUser(JsonNode node) {
		requireMember(node, "login");
		return new UserSummary(node.path("id").asLong(), node.path("login").asText(), textOrNull(node, "avatar_url"),
				textOrNull(node, "html_url"));
	}

	public static List<UserSummary> parseUsers(JsonNode nodes) {
		List<UserSummary> users = new ArrayList<>();
		if (nodes.isArray()) {
			for (JsonNode node : nodes) {
				UserSummary user = parseUserOrNull(node);
				if (user != null) {
					users.add(user);
				}
			}
		}
		return users;
	}

	private static @Nullable UserSummary parseUserOrNull(JsonNode node) {
		if (node.isMissingNode() || node.isNull() || !node.hasNonNull("login")) {
			return null;
		}
		return parseUser(node);
	}

	private static PullRequest.@Nullable Branch parseBranch(JsonNode node) {
		if (node.isMissingNode() || node.isNull() || !node.hasNonNull("ref")) {
			return null;
		}
		return new PullRequest.Branch(node.path("ref").asText(), textOrNull(node, "sha"), textOrNull(node, "label"));
	}

	/**
	 * The issues endpoint embeds {@code repository} for most elements; otherwise the
	 * owner and name are recovered from {@code repository_url}.
	 */
	private static PullRequest.@Nullable RepositoryRef parseRepositoryRef(JsonNode node) {
		JsonNode repository = node.path("repository");
		if (repository.hasNonNull("full_name")) {
			return new PullRequest.RepositoryRef(repository.path("id").asLong(0), repository.path("name").asText(""),
					repository.path("full_name").asText(), textOrNull(repository, "html_url"));
		}
		JsonNode baseRepo = node.path("base").path("repo");
		if (baseRepo.hasNonNull("full_name")) {
			return new PullRequest.RepositoryRef(baseRepo.path("id").asLong(0), baseRepo.path("name").asText(""),
					baseRepo.path("full_name").asText(), textOrNull(baseRepo, "html_url"));
		}
		String repositoryUrl = textOrNull(node, "repository_url");
		if (repositoryUrl != null) {
			String[] parts = repositoryUrl.split("/");
			if (parts.length >= 2) {
				String owner = parts[parts.length - 2];
				String name = parts[parts.length - 1];
				return new PullRequest.RepositoryRef(0, name, owner + "/" + name,
						"https://github.com/" + owner + "/" + name);
			}
		}
		return null;
	}

	private static List<String> parseStrings(JsonNode nodes) {
		List<String> values = new ArrayList<>();
		if (nodes.isArray()) {
			for (JsonNode node : nodes) {
				values.add(node.asText());
			}
		}
		return values;
	}

	private static List<String> parseLabelNames(JsonNode nodes) {
		List<String> names = new ArrayList<>();
		if (nodes.isArray()) {
			for (JsonNode node : nodes) {
				names.add(node.isTextual() ? node.asText() : node.path("name").asText(""));
			}
		}
		return names;
	}

	private static void requireMember(JsonNode node, String member) {
		if (!node.hasNonNull(member)) {
			throw new IllegalArgumentException("Element has no '" + member + "' member");
		}
	}

	private static @Nullable String textOrNull(JsonNode node, String member) {
		JsonNode value = node.path(member);
		return value.isMissingNode() || value.isNull() ? null : value.asText();
	}

	static @Nullable LocalDateTime parseDateTime(@Nullable String dateTimeStr) {
		if (dateTimeStr == null || dateTimeStr.isEmpty()) {
			return null;
		}
		try {
			return LocalDateTime.parse(dateTimeStr, ISO_FORMATTER);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", dateTimeStr);
			return null;
		}
	}

}
