package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Filter, sort and paginate an already merged collection.
 *
 * <p>
 * The stages run in that order on a copy; the input collection is never modified, so
 * cached collections can be passed directly. Sorting is stable.
 *
 * @param <T> item type
 */
public class QueryPipeline<T> {

	private static final Logger logger = LoggerFactory.getLogger(QueryPipeline.class);

	private final ResourceSchema<T> schema;

	public QueryPipeline(ResourceSchema<T> schema) {
		this.schema = schema;
	}

	/**
	 * Run all three stages.
	 * @param collection the merged collection
	 * @param search case-insensitive substring query, blank for no filtering
	 * @param sort named sort, applied in its default direction
	 * @param tableSort explicit sort overriding {@code sort}
	 * @param tableSortDirection direction of {@code tableSort}, "asc" unless "desc"
	 * @param page requested page, at least 1 after clamping
	 * @param perPage requested page size, within [1, 100] after clamping
	 * @return the requested page and its pagination details
	 */
	public QueryResult<T> run(Collection<T> collection, @Nullable String search, @Nullable String sort,
			@Nullable String tableSort, @Nullable String tableSortDirection, int page, int perPage) {
		List<T> filtered = filter(collection, search);
		List<T> sorted = sort(filtered, sort, tableSort, tableSortDirection);
		QueryResult<T> result = paginate(sorted, page, perPage);
		logger.debug("Query on {} {}: {} matched, returning {} (page {}/{})", collection.size(), schema.name(),
				filtered.size(), result.items().size(), result.pageInfo().page(), result.pageInfo().totalPages());
		return result;
	}

	/**
	 * Keep the items where any searchable field contains {@code search}.
	 * @param collection the items
	 * @param search the query; blank keeps everything
	 * @return a new list
	 */
	public List<T> filter(Collection<T> collection, @Nullable String search) {
		if (search == null || search.isBlank()) {
			return new ArrayList<>(collection);
		}
		String query = search.trim().toLowerCase(Locale.ROOT);
		List<T> matches = new ArrayList<>();
		for (T item : collection) {
			if (schema.matches(item, query)) {
				matches.add(item);
			}
		}
		return matches;
	}

	/**
	 * Sort a copy of {@code items}. A table sort overrides the named sort; an unknown key
	 * falls back to the default sort, descending.
	 */
	public List<T> sort(Collection<T> items, @Nullable String sort, @Nullable String tableSort,
			@Nullable String tableSortDirection) {
		List<T> sorted = new ArrayList<>(items);
		sorted.sort(comparator(sort, tableSort, tableSortDirection));
		return sorted;
	}

	private Comparator<T> comparator(@Nullable String sort, @Nullable String tableSort,
			@Nullable String tableSortDirection) {
		if (tableSort != null && !tableSort.isBlank()) {
			return schema.sort(tableSort)
				.map(field -> field.comparator(SortDirection.parse(tableSortDirection)))
				.orElseGet(this::fallback);
		}
		return schema.sort(sort).map(field -> field.comparator(field.defaultDirection())).orElseGet(this::fallback);
	}

	private Comparator<T> fallback() {
		return schema.defaultSortField().comparator(SortDirection.DESC);
	}

	/**
	 * Slice one page out of an ordered list.
	 * @param sorted the ordered items
	 * @param page requested page
	 * @param perPage requested page size
	 * @return the page and its pagination details
	 */
	public QueryResult<T> paginate(List<T> sorted, int page, int perPage) {
		PageInfo pageInfo = PageInfo.of(page, perPage, sorted.size());
		long start = pageInfo.startIndex();
		if (start >= sorted.size()) {
			return new QueryResult<>(List.of(), pageInfo);
		}
		int end = (int) Math.min(sorted.size(), start + pageInfo.perPage());
		return new QueryResult<>(List.copyOf(sorted.subList((int) start, end)), pageInfo);
	}

}
