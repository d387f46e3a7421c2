package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;

/**
 * One client request for a page of a resource collection.
 *
 * <p>
 * The user id and credential come from the caller's session; either being null means
 * the caller is not authenticated.
 *
 * @param userId the GitHub user id of the session
 * @param credential the bearer credential of the session
 * @param sort named sort, applied in its default direction
 * @param search case-insensitive substring query
 * @param page requested page
 * @param perPage requested page size
 * @param tableSort explicit sort overriding {@code sort}
 * @param tableSortDirection "asc" or "desc"
 */
public record CollectionQuery(@Nullable Long userId, @Nullable String credential, String sort, String search, int page,
		int perPage, @Nullable String tableSort, String tableSortDirection) {

	public static final String DEFAULT_SORT = "updated";

	public static final int DEFAULT_PAGE = 1;

	public static final int DEFAULT_PER_PAGE = 30;

	public static final String DEFAULT_TABLE_SORT_DIRECTION = "asc";

	public CollectionQuery {
		search = search.trim();
		if (tableSort != null && tableSort.isBlank()) {
			tableSort = null;
		}
	}

	public boolean isAuthenticated() {
		return userId != null && credential != null && !credential.isBlank();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link CollectionQuery} with the defaults of the collection endpoints.
	 */
	public static final class Builder {

		private @Nullable Long userId;

		private @Nullable String credential;

		private String sort = DEFAULT_SORT;

		private String search = "";

		private int page = DEFAULT_PAGE;

		private int perPage = DEFAULT_PER_PAGE;

		private @Nullable String tableSort;

		private String tableSortDirection = DEFAULT_TABLE_SORT_DIRECTION;

		private Builder() {
		}

		public Builder userId(@Nullable Long userId) {
			this.userId = userId;
			return this;
		}

		public Builder credential(@Nullable String credential) {
			this.credential = credential;
			return this;
		}

		public Builder sort(@Nullable String sort) {
			this.sort = sort != null ? sort : DEFAULT_SORT;
			return this;
		}

		public Builder search(@Nullable String search) {
			this.search = search != null ? search : "";
			return this;
		}

		public Builder page(int page) {
			this.page = page;
			return this;
		}

		public Builder perPage(int perPage) {
			this.perPage = perPage;
			return this;
		}

		public Builder tableSort(@Nullable String tableSort) {
			this.tableSort = tableSort;
			return this;
		}

		public Builder tableSortDirection(@Nullable String tableSortDirection) {
			this.tableSortDirection = tableSortDirection != null ? tableSortDirection
					: DEFAULT_TABLE_SORT_DIRECTION;
			return this;
		}

		public CollectionQuery build() {
			return new CollectionQuery(userId, credential, sort, search, page, perPage, tableSort,
					tableSortDirection);
		}

	}

}
