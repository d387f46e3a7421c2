package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Fills in pull request statistics that the issues endpoint omits, one detail call per
 * pull request.
 */
public class PullRequestDetailEnricher implements ItemEnricher<JsonNode> {

	private final GitHubClientFactory clientFactory;

	private final ObjectMapper objectMapper;

	public PullRequestDetailEnricher(GitHubClientFactory clientFactory, ObjectMapper objectMapper) {
		this.clientFactory = clientFactory;
		this.objectMapper = objectMapper;
	}

	@Override
	public JsonNode enrich(String credential, JsonNode raw) throws Exception {
		return new GitHubRestService(clientFactory.forToken(credential), objectMapper).getPullRequestDetails(raw);
	}

}
