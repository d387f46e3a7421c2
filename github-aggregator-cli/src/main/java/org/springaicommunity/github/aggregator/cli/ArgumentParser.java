package org.springaicommunity.github.aggregator.cli;

import org.springaicommunity.github.aggregator.EnvironmentSupport;
import org.springaicommunity.github.aggregator.PageInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the aggregator CLI.
 */
public class ArgumentParser {

	static final List<String> VALID_TYPES = List.of("repos", "gists", "prs", "profile", "followers", "following");

	private static final List<String> VALID_DIRECTIONS = List.of("asc", "desc");

	/**
	 * Parse command-line arguments and validate them.
	 * @param args Command-line arguments
	 * @return Parsed configuration
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-t", "--type":
					config.type = getRequiredValue(args, i, "type");
					i++;
					break;

				case "-s", "--sort":
					config.sort = getRequiredValue(args, i, "sort");
					i++;
					break;

				case "-q", "--search":
					config.search = getRequiredValue(args, i, "search");
					i++;
					break;

				case "-p", "--page":
					config.page = parseInteger(getRequiredValue(args, i, "page"), "page");
					i++;
					break;

				case "--per-page":
					config.perPage = parseInteger(getRequiredValue(args, i, "per-page"), "per-page");
					i++;
					break;

				case "--table-sort":
					config.tableSort = getRequiredValue(args, i, "table-sort");
					i++;
					break;

				case "--table-sort-direction":
					config.tableSortDirection = getRequiredValue(args, i, "table-sort-direction").toLowerCase();
					i++;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-aggregator [OPTIONS]\n");
		help.append("\n");
		help.append("Read the authenticated user's GitHub repositories, gists or pull requests,\n");
		help.append("filtered, sorted and paginated, and print the response as JSON.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                    Show this help message\n");
		help.append("    -t, --type <type>             One of: repos, gists, prs, profile, followers,\n");
		help.append("                                  following (default: repos)\n");
		help.append("\n");
		help.append("QUERY OPTIONS (repos, gists, prs):\n");
		help.append("    -s, --sort <key>              Named sort in its default direction (default: updated)\n");
		help.append("    -q, --search <text>           Case-insensitive substring filter\n");
		help.append("    -p, --page <n>                Page number, starting at 1 (default: 1)\n");
		help.append("    --per-page <n>                Page size, 1 to ")
			.append(PageInfo.MAX_PER_PAGE)
			.append(" (default: 30)\n");
		help.append("    --table-sort <key>            Explicit sort key, overrides --sort\n");
		help.append("    --table-sort-direction <dir>  asc or desc (default: asc)\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN                  GitHub access token (required)\n");
		help.append("    GITHUB_API_URL                API base URL (default: https://api.github.com)\n");
		help.append("    MAX_REPOS_FETCH               Maximum repositories to collect (default: 2000)\n");
		help.append("    MAX_GISTS_FETCH               Maximum gists to collect (default: 1000)\n");
		help.append("    MAX_PRS_FETCH                 Maximum pull requests to collect (default: 1000)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-aggregator --type repos --search spring --sort stars\n");
		help.append("    github-aggregator --type prs --table-sort additions --table-sort-direction desc\n");
		help.append("    github-aggregator --type gists --page 2 --per-page 50\n");
		help.append("    github-aggregator --type followers\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (GitHub token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		String githubToken = EnvironmentSupport.get("GITHUB_TOKEN");
		if (githubToken == null || githubToken.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub access token: export GITHUB_TOKEN=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parseInteger(String value, String optionName) {
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + ": must be a number");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (!VALID_TYPES.contains(config.type)) {
			errors.add("Invalid type: must be one of " + String.join(", ", VALID_TYPES));
		}

		if (!VALID_DIRECTIONS.contains(config.tableSortDirection)) {
			errors.add("Invalid table sort direction: must be 'asc' or 'desc'");
		}

		if (config.page < 1) {
			errors.add("Invalid page: must be at least 1");
		}

		if (config.perPage < 1 || config.perPage > PageInfo.MAX_PER_PAGE) {
			errors.add("Invalid per-page: must be between 1 and " + PageInfo.MAX_PER_PAGE);
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration validation failed: " + String.join(", ", errors));
		}
	}

}
