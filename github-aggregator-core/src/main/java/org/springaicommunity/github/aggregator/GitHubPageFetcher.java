package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link PageFetcher} over a GitHub listing endpoint described by a {@link ResourceKind}.
 *
 * <p>
 * Issues {@code GET {path}?{query}&page=N&per_page=M}. For pull requests only elements
 * carrying a {@code pull_request} member are kept.
 */
public class GitHubPageFetcher implements PageFetcher<JsonNode> {

	private static final Logger logger = LoggerFactory.getLogger(GitHubPageFetcher.class);

	private final ResourceKind kind;

	private final GitHubClientFactory clientFactory;

	private final ObjectMapper objectMapper;

	public GitHubPageFetcher(ResourceKind kind, GitHubClientFactory clientFactory, ObjectMapper objectMapper) {
		this.kind = kind;
		this.clientFactory = clientFactory;
		this.objectMapper = objectMapper;
	}

	@Override
	public List<JsonNode> fetch(String credential, int pageNumber, int pageSize) {
		int perPage = Math.max(1, Math.min(100, pageSize));
		String query = (kind.query() != null ? kind.query() + "&" : "") + "page=" + pageNumber + "&per_page="
				+ perPage;
		try {
			JsonNode body = objectMapper.readTree(clientFactory.forToken(credential).getWithQuery(kind.path(), query));
			if (!body.isArray()) {
				logger.warn("Page {} of {} is not a JSON array, treating as empty", pageNumber, kind.shortName());
				return List.of();
			}
			List<JsonNode> elements = new ArrayList<>(body.size());
			for (JsonNode element : body) {
				if (kind != ResourceKind.PULL_REQUESTS || element.has("pull_request")) {
					elements.add(element);
				}
			}
			logger.debug("Fetched {} {} from page {}", elements.size(), kind.shortName(), pageNumber);
			return elements;
		}
		catch (Exception e) {
			logger.warn("Failed to fetch {} page {}: {}", kind.shortName(), pageNumber, e.getMessage());
			return List.of();
		}
	}

}
