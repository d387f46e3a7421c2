package org.springaicommunity.github.aggregator;

/**
 * Pagination details of one query result.
 *
 * @param page the 1-based page number, at least 1
 * @param perPage the page size, within [1, 100]
 * @param totalCount number of items after filtering, before pagination
 * @param totalPages number of pages, at least 1 even for an empty result
 * @param hasNext whether a later page holds items
 * @param hasPrev whether this is not the first page
 */
public record PageInfo(int page, int perPage, int totalCount, int totalPages, boolean hasNext, boolean hasPrev) {

	/** Largest page size a client may request. */
	public static final int MAX_PER_PAGE = 100;

	/**
	 * Compute pagination for a request, clamping {@code perPage} to [1, 100] and
	 * {@code page} to at least 1.
	 * @param page requested page
	 * @param perPage requested page size
	 * @param totalCount number of items being paginated
	 * @return the pagination details
	 */
	public static PageInfo of(int page, int perPage, int totalCount) {
		int clampedPerPage = clampPerPage(perPage);
		int clampedPage = Math.max(1, page);
		int totalPages = Math.max(1, (int) ((totalCount + (long) clampedPerPage - 1) / clampedPerPage));
		long end = (long) clampedPage * clampedPerPage;
		return new PageInfo(clampedPage, clampedPerPage, totalCount, totalPages, end < totalCount, clampedPage > 1);
	}

	public static int clampPerPage(int perPage) {
		return Math.max(1, Math.min(MAX_PER_PAGE, perPage));
	}

	/**
	 * Index of the first item of this page, may lie beyond the collection.
	 */
	public long startIndex() {
		return (long) (page - 1) * perPage;
	}

}
