package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Direction of a sort.
 */
public enum SortDirection {

	ASC,

	DESC;

	/**
	 * Parse a client-supplied direction. Anything other than "desc" is ascending.
	 * @param value the direction, may be null
	 * @return the parsed direction
	 */
	public static SortDirection parse(@Nullable String value) {
		return value != null && value.trim().equalsIgnoreCase("desc") ? DESC : ASC;
	}

	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

}
