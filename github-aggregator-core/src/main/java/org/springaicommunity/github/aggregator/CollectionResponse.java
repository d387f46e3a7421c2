package org.springaicommunity.github.aggregator;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Response envelope of the collection endpoints.
 *
 * <p>
 * Serialized with snake_case names. {@code table_sort} and {@code table_sort_direction}
 * are only present when a table sort was requested.
 *
 * @param items the items of the requested page
 * @param page the page number after clamping
 * @param perPage the page size after clamping
 * @param totalCount matching items before pagination
 * @param totalPages number of pages, at least 1
 * @param hasNext whether a later page holds items
 * @param hasPrev whether this is not the first page
 * @param searchQuery the search query as applied
 * @param sort the named sort requested
 * @param tableSort the table sort requested
 * @param tableSortDirection the table sort direction requested
 * @param debugInfo timings and counts of this request
 * @param <T> item type
 */
public record CollectionResponse<T>(List<T> items, int page, int perPage, int totalCount, int totalPages,
		boolean hasNext, boolean hasPrev, String searchQuery, String sort,
		@JsonInclude(JsonInclude.Include.NON_NULL) @Nullable String tableSort,
		@JsonInclude(JsonInclude.Include.NON_NULL) @Nullable String tableSortDirection, DebugInfo debugInfo) {

	/**
	 * Diagnostics that expose degradation without leaking internal errors.
	 *
	 * @param processingTime seconds spent on the whole request
	 * @param fetchTime seconds spent obtaining and querying the collection
	 * @param itemsTotal items matching the query before pagination
	 * @param itemsReturned items in this page
	 * @param cacheHit whether the merged collection came from the cache
	 * @param tableSortApplied whether a table sort overrode the named sort
	 */
	public record DebugInfo(double processingTime, double fetchTime, int itemsTotal, int itemsReturned,
			boolean cacheHit, boolean tableSortApplied) {
	}

}
