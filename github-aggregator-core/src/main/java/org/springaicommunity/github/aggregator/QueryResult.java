package org.springaicommunity.github.aggregator;

import java.util.List;

/**
 * One page of a filtered and sorted collection.
 *
 * @param items the items of the requested page
 * @param pageInfo pagination details
 * @param <T> item type
 */
public record QueryResult<T>(List<T> items, PageInfo pageInfo) {
}
