package org.springaicommunity.github.aggregator;

/**
 * Adds data from a per-item upstream call to a raw element before conversion.
 *
 * <p>
 * A failing or timed-out enrichment keeps the raw element unchanged.
 *
 * @param <R> raw element type
 */
@FunctionalInterface
public interface ItemEnricher<R> {

	/**
	 * Enrich one element.
	 * @param credential bearer credential of the user
	 * @param raw the element as fetched
	 * @return the enriched element
	 * @throws Exception if the detail call fails
	 */
	R enrich(String credential, R raw) throws Exception;

}
