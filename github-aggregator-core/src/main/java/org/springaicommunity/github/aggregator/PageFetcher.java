package org.springaicommunity.github.aggregator;

import java.util.List;

/**
 * Fetches exactly one page of a paginated upstream collection.
 *
 * <p>
 * Implementations never throw: a timeout, a non-2xx answer or a malformed body is logged
 * and reported as an empty page.
 *
 * @param <R> raw element type
 */
@FunctionalInterface
public interface PageFetcher<R> {

	/**
	 * Fetch one page.
	 * @param credential bearer credential of the user
	 * @param pageNumber 1-based page number
	 * @param pageSize requested page size
	 * @return the page's raw elements, empty on failure
	 */
	List<R> fetch(String credential, int pageNumber, int pageSize);

}
