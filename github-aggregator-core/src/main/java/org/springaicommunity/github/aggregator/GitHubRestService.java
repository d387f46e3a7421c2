package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	/** Search results are capped by GitHub at this many items. */
	static final int SEARCH_RESULT_CAP = 1000;

	private static final int USER_LIST_PAGE_SIZE = 100;

	private static final int USER_LIST_MAX_PAGES = 10;

	private static final List<String> DETAIL_MEMBERS = List.of("additions", "deletions", "changed_files", "commits",
			"mergeable", "mergeable_state", "merged_by", "draft", "base", "head", "requested_reviewers", "assignees",
			"review_comments", "merged_at");

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public RateLimitInfo getRateLimit() throws IOException {
		JsonNode core = objectMapper.readTree(httpClient.get("/rate_limit")).path("resources").path("core");
		if (!core.has("remaining")) {
			throw new IOException("Rate limit response has no core budget");
		}
		return new RateLimitInfo(core.path("limit").asInt(), core.path("remaining").asInt(),
				core.path("reset").asLong(), core.path("used").asInt());
	}

	@Override
	public UserProfile getAuthenticatedUser() throws IOException {
		return JsonItemParser.parseUserProfile(objectMapper.readTree(httpClient.get("/user")));
	}

	@Override
	public OptionalInt getTotalCount(ResourceKind kind) {
		try {
			JsonNode user = objectMapper.readTree(httpClient.get("/user"));
			return switch (kind) {
				case REPOSITORIES ->
					OptionalInt.of(user.path("public_repos").asInt(0) + user.path("total_private_repos").asInt(0));
				case GISTS -> OptionalInt.of(user.path("public_gists").asInt(0) + user.path("private_gists").asInt(0));
				case PULL_REQUESTS -> OptionalInt.of(getTotalPRCount(user.path("login").asText()));
			};
		}
		catch (Exception e) {
			logger.error("Failed to get total {} count: {}", kind.shortName(), e.getMessage());
			return OptionalInt.empty();
		}
	}

	private int getTotalPRCount(String login) throws IOException {
		String query = URLEncoder.encode("author:" + login + " type:pr", StandardCharsets.UTF_8);
		JsonNode searchResult = objectMapper.readTree(httpClient.getWithQuery("/search/issues", "q=" + query));
		return Math.min(searchResult.path("total_count").asInt(0), SEARCH_RESULT_CAP);
	}

	@Override
	public List<UserSummary> getFollowers() throws IOException {
		return getUserList("/user/followers");
	}

	@Override
	public List<UserSummary> getFollowing() throws IOException {
		return getUserList("/user/following");
	}

	private List<UserSummary> getUserList(String path) throws IOException {
		List<UserSummary> users = new ArrayList<>();
		for (int page = 1; page <= USER_LIST_MAX_PAGES; page++) {
			JsonNode nodes = objectMapper
				.readTree(httpClient.getWithQuery(path, "per_page=" + USER_LIST_PAGE_SIZE + "&page=" + page));
			List<UserSummary> pageUsers = JsonItemParser.parseUsers(nodes);
			users.addAll(pageUsers);
			if (pageUsers.size() < USER_LIST_PAGE_SIZE) {
				break;
			}
		}
		logger.debug("Fetched {} users from {}", users.size(), path);
		return users;
	}

	@Override
	public JsonNode getPullRequestDetails(JsonNode issueElement) throws IOException {
		String detailUrl = issueElement.path("pull_request").path("url").asText(null);
		if (detailUrl == null || !(issueElement instanceof ObjectNode original)) {
			return issueElement;
		}
		JsonNode detail = objectMapper.readTree(httpClient.get(detailUrl));
		ObjectNode enriched = original.deepCopy();
		for (String member : DETAIL_MEMBERS) {
			JsonNode value = detail.get(member);
			if (value != null) {
				enriched.set(member, value);
			}
		}
		return enriched;
	}

}
