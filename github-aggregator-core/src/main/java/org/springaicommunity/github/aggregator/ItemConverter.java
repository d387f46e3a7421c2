package org.springaicommunity.github.aggregator;

/**
 * Converts one raw element into a domain item. Throwing drops only that element.
 *
 * @param <R> raw element type
 * @param <T> item type
 */
@FunctionalInterface
public interface ItemConverter<R, T> {

	T convert(R raw);

}
