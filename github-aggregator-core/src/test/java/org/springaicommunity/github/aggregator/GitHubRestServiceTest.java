package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for GitHubRestService with a mocked client. No real GitHub API calls.
 */
@DisplayName("GitHubRestService Tests")
@ExtendWith(MockitoExtension.class)
class GitHubRestServiceTest {

	private static final String USER = """
			{
			    "id": 583231,
			    "login": "octocat",
			    "public_repos": 8,
			    "total_private_repos": 2,
			    "public_gists": 3,
			    "private_gists": 1
			}
			""";

	@Mock
	private GitHubClient mockClient;

	private ObjectMapper objectMapper;

	private GitHubRestService service;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		service = new GitHubRestService(mockClient, objectMapper);
	}

	@Nested
	@DisplayName("Rate Limit")
	class RateLimitTest {

		@Test
		@DisplayName("Should read the core budget")
		void shouldReadCoreBudget() throws IOException {
			when(mockClient.get("/rate_limit")).thenReturn("""
					{"resources": {"core": {"limit": 5000, "remaining": 4999, "reset": 1700000000, "used": 1}}}
					""");

			RateLimitInfo rateLimit = service.getRateLimit();

			assertThat(rateLimit.limit()).isEqualTo(5000);
			assertThat(rateLimit.remaining()).isEqualTo(4999);
			assertThat(rateLimit.reset()).isEqualTo(1700000000L);
			assertThat(rateLimit.hasMoreThan(100)).isTrue();
		}

		@Test
		@DisplayName("Should fail when the core budget is missing")
		void shouldFailWithoutCoreBudget() {
			when(mockClient.get("/rate_limit")).thenReturn("{\"resources\": {}}");

			assertThatThrownBy(() -> service.getRateLimit()).isInstanceOf(IOException.class);
		}

	}

	@Nested
	@DisplayName("Total Counts")
	class TotalCountTest {

		@Test
		@DisplayName("Should add public and private repositories")
		void shouldCountRepositories() {
			when(mockClient.get("/user")).thenReturn(USER);

			assertThat(service.getTotalCount(ResourceKind.REPOSITORIES)).hasValue(10);
		}

		@Test
		@DisplayName("Should add public and private gists")
		void shouldCountGists() {
			when(mockClient.get("/user")).thenReturn(USER);

			assertThat(service.getTotalCount(ResourceKind.GISTS)).hasValue(4);
		}

		@Test
		@DisplayName("Should count pull requests by search, capped at 1000")
		void shouldCountPullRequestsBySearch() {
			when(mockClient.get("/user")).thenReturn(USER);
			when(mockClient.getWithQuery(eq("/search/issues"), startsWith("q=author%3Aoctocat")))
				.thenReturn("{\"total_count\": 4321, \"items\": []}");

			assertThat(service.getTotalCount(ResourceKind.PULL_REQUESTS)).hasValue(GitHubRestService.SEARCH_RESULT_CAP);
		}

		@Test
		@DisplayName("Should report an unknown total when the user call fails")
		void shouldReportUnknownTotal() {
			when(mockClient.get("/user"))
				.thenThrow(new GitHubHttpClient.GitHubApiException("GitHub API error: 502", 502, null));

			assertThat(service.getTotalCount(ResourceKind.REPOSITORIES)).isEqualTo(OptionalInt.empty());
		}

	}

	@Nested
	@DisplayName("User Lists")
	class UserListTest {

		@Test
		@DisplayName("Should stop paging at the first short page")
		void shouldStopAtShortPage() throws IOException {
			StringBuilder fullPage = new StringBuilder("[");
			for (int i = 0; i < 100; i++) {
				fullPage.append(i > 0 ? "," : "").append("{\"id\": ").append(i).append(", \"login\": \"u").append(i)
					.append("\"}");
			}
			fullPage.append("]");
			when(mockClient.getWithQuery("/user/followers", "per_page=100&page=1")).thenReturn(fullPage.toString());
			when(mockClient.getWithQuery("/user/followers", "per_page=100&page=2"))
				.thenReturn("[{\"id\": 500, \"login\": \"last\"}]");

			List<UserSummary> followers = service.getFollowers();

			assertThat(followers).hasSize(101);
			assertThat(followers.get(100).login()).isEqualTo("last");
			verify(mockClient, never()).getWithQuery("/user/followers", "per_page=100&page=3");
		}

	}

	@Nested
	@DisplayName("Pull Request Details")
	class PullRequestDetailsTest {

		@Test
		@DisplayName("Should merge detail members into a copy of the element")
		void shouldMergeDetailMembers() throws IOException {
			JsonNode element = objectMapper.readTree("""
					{"id": 1, "number": 7, "pull_request": {"url": "https://api.github.com/repos/me/tool/pulls/7"}}
					""");
			when(mockClient.get("https://api.github.com/repos/me/tool/pulls/7"))
				.thenReturn("{\"additions\": 10, \"deletions\": 2, \"commits\": 1, \"title\": \"ignored\"}");

			JsonNode enriched = service.getPullRequestDetails(element);

			assertThat(enriched.path("additions").asInt()).isEqualTo(10);
			assertThat(enriched.path("commits").asInt()).isEqualTo(1);
			assertThat(enriched.has("title")).isFalse();
			assertThat(element.has("additions")).isFalse();
		}

		@Test
		@DisplayName("Should return the element unchanged without a detail URL")
		void shouldSkipWithoutDetailUrl() throws IOException {
			JsonNode element = objectMapper.readTree("{\"id\": 1}");

			assertThat(service.getPullRequestDetails(element)).isSameAs(element);
			verifyNoInteractions(mockClient);
		}

	}

}
