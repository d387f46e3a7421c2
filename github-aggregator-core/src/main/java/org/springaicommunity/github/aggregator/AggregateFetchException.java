package org.springaicommunity.github.aggregator;

/**
 * Every page or every item of a collection failed, so no usable data exists where items
 * were expected.
 */
public class AggregateFetchException extends CollectionServiceException {

	public AggregateFetchException(String message) {
		super(message, 500);
	}

	public AggregateFetchException(String message, Throwable cause) {
		super(message, 500, cause);
	}

}
