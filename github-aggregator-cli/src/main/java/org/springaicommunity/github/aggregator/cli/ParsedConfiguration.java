package org.springaicommunity.github.aggregator.cli;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// What to read: repos, gists, prs, profile, followers or following
	public String type = "repos";

	// Query options, only used by the collection types
	public String sort = "updated";

	public String search = "";

	public int page = 1;

	public int perPage = 30;

	public String tableSort = null;

	public String tableSortDirection = "asc";

	public boolean helpRequested = false;

	public boolean isCollectionType() {
		return "repos".equals(type) || "gists".equals(type) || "prs".equals(type);
	}

}
