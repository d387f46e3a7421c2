package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("GitHubPageFetcher Tests")
@ExtendWith(MockitoExtension.class)
class GitHubPageFetcherTest {

	@Mock
	private GitHubClient mockClient;

	private GitHubPageFetcher fetcher(ResourceKind kind) {
		return new GitHubPageFetcher(kind, token -> mockClient, ObjectMapperFactory.create());
	}

	@Test
	@DisplayName("Should request the kind's listing with page parameters")
	void shouldRequestListingPage() {
		when(mockClient.getWithQuery("/user/repos", "visibility=all&sort=updated&page=2&per_page=100"))
			.thenReturn("[{\"id\": 1}, {\"id\": 2}]");

		List<JsonNode> elements = fetcher(ResourceKind.REPOSITORIES).fetch("token", 2, 100);

		assertThat(elements).hasSize(2);
	}

	@Test
	@DisplayName("Should omit the fixed query when the kind has none")
	void shouldRequestGistsWithoutFixedQuery() {
		when(mockClient.getWithQuery("/gists", "page=1&per_page=50")).thenReturn("[]");

		assertThat(fetcher(ResourceKind.GISTS).fetch("token", 1, 50)).isEmpty();
	}

	@Test
	@DisplayName("Should keep only issues that are pull requests")
	void shouldKeepOnlyPullRequests() {
		when(mockClient.getWithQuery(eq("/user/issues"), anyString())).thenReturn("""
				[{"id": 1, "pull_request": {"url": "x"}}, {"id": 2}, {"id": 3, "pull_request": {"url": "y"}}]
				""");

		List<JsonNode> elements = fetcher(ResourceKind.PULL_REQUESTS).fetch("token", 1, 100);

		assertThat(elements).extracting(node -> node.path("id").asInt()).containsExactly(1, 3);
	}

	@Test
	@DisplayName("Should treat a failed page as empty")
	void shouldTreatFailureAsEmpty() {
		when(mockClient.getWithQuery(anyString(), anyString()))
			.thenThrow(new GitHubHttpClient.GitHubApiException("GitHub API error: 500", 500, null));

		assertThat(fetcher(ResourceKind.REPOSITORIES).fetch("token", 3, 100)).isEmpty();
	}

	@Test
	@DisplayName("Should treat a non-array body as empty")
	void shouldTreatObjectBodyAsEmpty() {
		when(mockClient.getWithQuery(anyString(), anyString())).thenReturn("{\"message\": \"Bad credentials\"}");

		assertThat(fetcher(ResourceKind.GISTS).fetch("token", 1, 100)).isEmpty();
	}

}
