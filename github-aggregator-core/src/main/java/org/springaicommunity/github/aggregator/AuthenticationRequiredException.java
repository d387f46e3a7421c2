package org.springaicommunity.github.aggregator;

/**
 * No credential or user id was present; no pipeline work is performed.
 */
public class AuthenticationRequiredException extends CollectionServiceException {

	public AuthenticationRequiredException() {
		super("Not authenticated", 401);
	}

}
