package org.springaicommunity.github.aggregator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("QueryPipeline Tests")
class QueryPipelineTest {

	private final QueryPipeline<Repository> pipeline = new QueryPipeline<>(ResourceSchemas.REPOSITORIES);

	private static Repository repository(long id, String name, String description, String language, int stars,
			int updatedDay, List<String> topics) {
		LocalDateTime updated = updatedDay > 0 ? LocalDateTime.of(2024, 1, updatedDay, 12, 0) : null;
		return new Repository(id, name, "me/" + name, description, false, null, null, null, language, stars, 0, 0, 0,
				"main", updated, updated, updated, false, false, false, topics, "public", null);
	}

	private static List<Repository> numbered(int count) {
		List<Repository> repositories = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			repositories.add(repository(i, "repo-" + i, null, "Java", i, (i % 28) + 1, List.of()));
		}
		return repositories;
	}

	private final List<Repository> sample = List.of(
			repository(1, "spring-ai", "AI for Spring", "Java", 300, 10, List.of("ai")),
			repository(2, "dotfiles", null, null, 3, 20, List.of()),
			repository(3, "notebook", "Data SCIENCE notes", "Python", 50, 0, List.of("spring-tips")),
			repository(4, "tool", "A CLI", "Go", 50, 5, List.of()));

	@Nested
	@DisplayName("Filtering")
	class FilteringTest {

		@Test
		@DisplayName("Should match any searchable field case-insensitively")
		void shouldMatchAnyField() {
			assertThat(pipeline.filter(sample, "SPRING")).extracting(Repository::id).containsExactly(1L, 3L);
			assertThat(pipeline.filter(sample, "science")).extracting(Repository::id).containsExactly(3L);
			assertThat(pipeline.filter(sample, "go")).extracting(Repository::id).containsExactly(4L);
		}

		@Test
		@DisplayName("Blank search keeps everything")
		void blankSearchKeepsEverything() {
			assertThat(pipeline.filter(sample, "")).hasSize(4);
			assertThat(pipeline.filter(sample, "   ")).hasSize(4);
			assertThat(pipeline.filter(sample, null)).hasSize(4);
		}

		@Test
		@DisplayName("Filtering twice equals filtering once")
		void filteringIsIdempotent() {
			List<Repository> once = pipeline.filter(sample, "spring");

			assertThat(pipeline.filter(once, "spring")).isEqualTo(once);
		}

		@Test
		@DisplayName("Should not modify the input collection")
		void shouldNotModifyInput() {
			List<Repository> input = new ArrayList<>(sample);

			pipeline.run(input, "spring", "stars", null, null, 1, 30);

			assertThat(input).isEqualTo(sample);
		}

	}

	@Nested
	@DisplayName("Sorting")
	class SortingTest {

		@Test
		@DisplayName("Named sorts use their default direction")
		void namedSortUsesDefaultDirection() {
			assertThat(pipeline.sort(sample, "stars", null, null)).extracting(Repository::id)
				.containsExactly(1L, 3L, 4L, 2L);
		}

		@Test
		@DisplayName("Missing timestamps sort as the earliest value")
		void missingTimestampsSortFirstAscending() {
			assertThat(pipeline.sort(sample, null, "updated", "asc")).extracting(Repository::id)
				.containsExactly(3L, 4L, 1L, 2L);
		}

		@Test
		@DisplayName("Table sort overrides the named sort")
		void tableSortOverridesNamedSort() {
			assertThat(pipeline.sort(sample, "stars", "name", "asc")).extracting(Repository::name)
				.containsExactly("dotfiles", "notebook", "spring-ai", "tool");
		}

		@Test
		@DisplayName("Equal keys keep their input order in both directions")
		void sortIsStable() {
			assertThat(pipeline.sort(sample, null, "stars", "asc")).extracting(Repository::id)
				.containsExactly(2L, 3L, 4L, 1L);
			assertThat(pipeline.sort(sample, null, "stars", "desc")).extracting(Repository::id)
				.containsExactly(1L, 3L, 4L, 2L);
		}

		@Test
		@DisplayName("Descending is the reverse of ascending for distinct keys")
		void descendingReversesAscending() {
			List<Repository> ascending = pipeline.sort(sample, null, "name", "asc");
			List<Repository> descending = new ArrayList<>(pipeline.sort(sample, null, "name", "DESC"));
			Collections.reverse(descending);

			assertThat(descending).isEqualTo(ascending);
		}

		@Test
		@DisplayName("Unknown keys fall back to the default sort, descending")
		void unknownKeyFallsBack() {
			List<Repository> expected = pipeline.sort(sample, "updated", null, null);

			assertThat(pipeline.sort(sample, "popularity", null, null)).isEqualTo(expected);
			assertThat(pipeline.sort(sample, null, "popularity", "asc")).isEqualTo(expected);
			assertThat(expected).extracting(Repository::id).containsExactly(2L, 1L, 4L, 3L);
		}

	}

	@Nested
	@DisplayName("Pagination")
	class PaginationTest {

		@Test
		@DisplayName("Page 2 of 50 returns items 50 to 99")
		void shouldSliceSecondPage() {
			List<Repository> sorted = numbered(250);

			QueryResult<Repository> result = pipeline.paginate(sorted, 2, 50);

			assertThat(result.items()).isEqualTo(sorted.subList(50, 100));
			assertThat(result.pageInfo().totalPages()).isEqualTo(5);
			assertThat(result.pageInfo().hasNext()).isTrue();
			assertThat(result.pageInfo().hasPrev()).isTrue();
		}

		@Test
		@DisplayName("A page past the end is empty but keeps the totals")
		void pagePastEndIsEmpty() {
			QueryResult<Repository> result = pipeline.paginate(numbered(10), 5, 30);

			assertThat(result.items()).isEmpty();
			assertThat(result.pageInfo().totalCount()).isEqualTo(10);
			assertThat(result.pageInfo().totalPages()).isEqualTo(1);
			assertThat(result.pageInfo().hasNext()).isFalse();
			assertThat(result.pageInfo().hasPrev()).isTrue();
		}

		@Test
		@DisplayName("A search with no match yields one empty page")
		void noMatchYieldsEmptyPage() {
			QueryResult<Repository> result = pipeline.run(sample, "kubernetes", "updated", null, null, 1, 30);

			assertThat(result.items()).isEmpty();
			assertThat(result.pageInfo().totalCount()).isZero();
			assertThat(result.pageInfo().totalPages()).isEqualTo(1);
			assertThat(result.pageInfo().hasNext()).isFalse();
			assertThat(result.pageInfo().hasPrev()).isFalse();
		}

		@ParameterizedTest
		@CsvSource({ "0, 30, 1, 30", "-4, 30, 1, 30", "1, 0, 1, 1", "1, 500, 1, 100", "3, 25, 3, 25" })
		@DisplayName("Page and page size are clamped")
		void shouldClampPageAndPerPage(int page, int perPage, int expectedPage, int expectedPerPage) {
			PageInfo pageInfo = PageInfo.of(page, perPage, 250);

			assertThat(pageInfo.page()).isEqualTo(expectedPage);
			assertThat(pageInfo.perPage()).isEqualTo(expectedPerPage);
		}

		@Test
		@DisplayName("Pages partition the collection")
		void pagesPartitionCollection() {
			List<Repository> sorted = numbered(95);
			List<Repository> concatenated = new ArrayList<>();
			PageInfo first = pipeline.paginate(sorted, 1, 20).pageInfo();

			for (int page = 1; page <= first.totalPages(); page++) {
				concatenated.addAll(pipeline.paginate(sorted, page, 20).items());
			}

			assertThat(first.totalPages()).isEqualTo(5);
			assertThat(concatenated).isEqualTo(sorted);
		}

	}

}
