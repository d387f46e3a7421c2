package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * Searchable fields and named sorts of one resource kind.
 *
 * <p>
 * Comparator factories treat absent values as the zero value of their type (empty
 * string, 0, false, {@link LocalDateTime#MIN}), so sorting never fails on missing data.
 *
 * @param <T> item type
 */
public final class ResourceSchema<T> {

	private final String name;

	private final List<Function<T, Collection<@Nullable String>>> searchFields;

	private final Map<String, SortField<T>> sorts;

	private final String defaultSort;

	private ResourceSchema(Builder<T> builder) {
		if (!builder.sorts.containsKey(builder.defaultSort)) {
			throw new IllegalStateException("Default sort '" + builder.defaultSort + "' is not a named sort");
		}
		this.name = builder.name;
		this.searchFields = List.copyOf(builder.searchFields);
		this.sorts = Map.copyOf(builder.sorts);
		this.defaultSort = builder.defaultSort;
	}

	public static <T> Builder<T> builder(String name) {
		return new Builder<>(name);
	}

	public String name() {
		return name;
	}

	public String defaultSort() {
		return defaultSort;
	}

	/**
	 * Whether any searchable field of {@code item} contains {@code lowerCaseQuery}.
	 * @param item the item
	 * @param lowerCaseQuery trimmed, lower-cased query
	 * @return true on a match
	 */
	public boolean matches(T item, String lowerCaseQuery) {
		for (Function<T, Collection<@Nullable String>> field : searchFields) {
			for (String value : field.apply(item)) {
				if (value != null && value.toLowerCase(Locale.ROOT).contains(lowerCaseQuery)) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Look up a named sort, case-insensitively.
	 * @param key sort name or alias
	 * @return the sort, or empty if unknown
	 */
	public Optional<SortField<T>> sort(@Nullable String key) {
		if (key == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(sorts.get(key.trim().toLowerCase(Locale.ROOT)));
	}

	public SortField<T> defaultSortField() {
		return sorts.get(defaultSort);
	}

	public static <T> Comparator<T> text(Function<T, @Nullable String> extractor) {
		return Comparator.comparing((T item) -> {
			String value = extractor.apply(item);
			return value == null ? "" : value.toLowerCase(Locale.ROOT);
		});
	}

	public static <T> Comparator<T> number(ToLongFunction<T> extractor) {
		return Comparator.comparingLong(extractor);
	}

	public static <T> Comparator<T> flag(Function<T, @Nullable Boolean> extractor) {
		return Comparator.comparing((T item) -> Boolean.TRUE.equals(extractor.apply(item)));
	}

	public static <T> Comparator<T> time(Function<T, @Nullable LocalDateTime> extractor) {
		return Comparator.comparing((T item) -> {
			LocalDateTime value = extractor.apply(item);
			return value == null ? LocalDateTime.MIN : value;
		});
	}

	/**
	 * A named sort.
	 *
	 * @param comparator ascending order of the field
	 * @param defaultDirection direction used when the sort is requested by name rather
	 * than as a table sort
	 * @param <T> item type
	 */
	public record SortField<T>(Comparator<T> comparator, SortDirection defaultDirection) {

		public Comparator<T> comparator(SortDirection direction) {
			return direction == SortDirection.DESC ? comparator.reversed() : comparator;
		}

	}

	/**
	 * Builder for {@link ResourceSchema}.
	 */
	public static final class Builder<T> {

		private final String name;

		private final List<Function<T, Collection<@Nullable String>>> searchFields = new ArrayList<>();

		private final Map<String, SortField<T>> sorts = new LinkedHashMap<>();

		private String defaultSort = "updated";

		private Builder(String name) {
			this.name = name;
		}

		public Builder<T> searchField(Function<T, @Nullable String> field) {
			this.searchFields.add(item -> {
				List<@Nullable String> values = new ArrayList<>(1);
				values.add(field.apply(item));
				return values;
			});
			return this;
		}

		public Builder<T> searchFields(Function<T, Collection<@Nullable String>> fields) {
			this.searchFields.add(fields);
			return this;
		}

		/**
		 * Register a sort under one or more names.
		 * @param comparator ascending comparator
		 * @param defaultDirection direction when requested by name
		 * @param names the sort name followed by its aliases
		 * @return this builder
		 */
		public Builder<T> sort(Comparator<T> comparator, SortDirection defaultDirection, String... names) {
			SortField<T> field = new SortField<>(comparator, defaultDirection);
			for (String sortName : names) {
				this.sorts.put(sortName.toLowerCase(Locale.ROOT), field);
			}
			return this;
		}

		public Builder<T> defaultSort(String defaultSort) {
			this.defaultSort = defaultSort;
			return this;
		}

		public ResourceSchema<T> build() {
			return new ResourceSchema<>(this);
		}

	}

}
