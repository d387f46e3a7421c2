package org.springaicommunity.github.aggregator;

/**
 * The remaining upstream budget is at or below the threshold for the requested
 * resource kind.
 */
public class RateLimitExceededException extends CollectionServiceException {

	public RateLimitExceededException() {
		super("GitHub API rate limit exceeded. Please try again later.", 429);
	}

}
