package org.springaicommunity.github.aggregator;

/**
 * Failure that crosses the consumer boundary. Carries the HTTP status the consumer
 * surface answers with.
 */
public class CollectionServiceException extends RuntimeException {

	private final int status;

	public CollectionServiceException(String message, int status) {
		super(message);
		this.status = status;
	}

	public CollectionServiceException(String message, int status, Throwable cause) {
		super(message, cause);
		this.status = status;
	}

	public int getStatus() {
		return status;
	}

}
