package io.github.flameyossnowy.asyncodm.api.options;

import com.google.errorprone.annotations.CheckReturnValue;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable description of a query: filters, projection, sort order, skip and limit.
 * <p>
 * Every method returns a new spec and leaves the receiver untouched, so a spec can be shared and
 * extended freely:
 * <pre>{@code
 * QuerySpec adults = QuerySpec.empty().filter("age", ">=", 18);
 * QuerySpec page = adults.orderBy("name", SortOrder.ASCENDING).skip(20).limit(10);
 * }</pre>
 * A spec never touches storage; it is translated into a storage query when executed.
 */
@CheckReturnValue
public final class QuerySpec {
    private static final QuerySpec EMPTY = new QuerySpec(List.of(), null, null, List.of(), 0, 0);

    private final List<FilterOption> filters;
    private final Map<String, Object> rawFilter;
    private final Projection projection;
    private final List<SortOption> sort;
    private final int skip;
    private final int limit;

    private QuerySpec(List<FilterOption> filters, Map<String, Object> rawFilter, Projection projection,
                      List<SortOption> sort, int skip, int limit) {
        this.filters = filters;
        this.rawFilter = rawFilter;
        this.projection = projection;
        this.sort = sort;
        this.skip = skip;
        this.limit = limit;
    }

    public static @NotNull QuerySpec empty() {
        return EMPTY;
    }

    /**
     * Adds a condition; all conditions of a spec must hold.
     *
     * @param field the model field path to apply the condition on
     * @param operator the comparison operator (e.g., '=', '<', 'IN', etc.)
     * @param value the value to compare the field against
     * @return the new spec
     */
    @Contract("_, _, _ -> new")
    public @NotNull QuerySpec filter(@NotNull String field, @NotNull String operator, @Nullable Object value) {
        return filter(new FilterOption(field, operator, value));
    }

    /**
     * Adds an equality condition.
     *
     * @param field the model field path to apply the condition on
     * @param value the value the field must equal
     * @return the new spec
     */
    @Contract("_, _ -> new")
    public @NotNull QuerySpec filter(@NotNull String field, @Nullable Object value) {
        return filter(FilterOption.eq(field, value));
    }

    @Contract("_ -> new")
    public @NotNull QuerySpec filter(@NotNull FilterOption option) {
        Objects.requireNonNull(option, "option");
        List<FilterOption> next = new ArrayList<>(filters.size() + 1);
        next.addAll(filters);
        next.add(option);
        return new QuerySpec(Collections.unmodifiableList(next), rawFilter, projection, sort, skip, limit);
    }

    /**
     * Sets a filter document in the storage query language, replacing the previous one.
     * The filter is combined with the conditions added by {@link #filter(FilterOption)}.
     *
     * @param filter the filter document, keys are stored field names
     * @return the new spec
     */
    @Contract("_ -> new")
    public @NotNull QuerySpec raw(@NotNull Map<String, ?> filter) {
        Objects.requireNonNull(filter, "filter");
        return new QuerySpec(filters, Collections.unmodifiableMap(new LinkedHashMap<>(filter)), projection, sort, skip, limit);
    }

    /**
     * Loads only the given fields, replacing any previous projection. The primary key is always loaded.
     * @param fields the model field paths
     * @return the new spec
     */
    @Contract("_ -> new")
    public @NotNull QuerySpec only(@NotNull String... fields) {
        return new QuerySpec(filters, rawFilter, new Projection(Projection.Mode.INCLUDE, List.of(fields)), sort, skip, limit);
    }

    /**
     * Loads every field except the given ones, replacing any previous projection. Excluding the
     * primary key has no effect.
     * @param fields the model field paths
     * @return the new spec
     */
    @Contract("_ -> new")
    public @NotNull QuerySpec exclude(@NotNull String... fields) {
        return new QuerySpec(filters, rawFilter, new Projection(Projection.Mode.EXCLUDE, List.of(fields)), sort, skip, limit);
    }

    /**
     * Replaces the sort order.
     * @param options the sort keys, most significant first; none to clear the sort
     * @return the new spec
     */
    @Contract("_ -> new")
    public @NotNull QuerySpec orderBy(@NotNull SortOption... options) {
        return new QuerySpec(filters, rawFilter, projection, List.of(options), skip, limit);
    }

    @Contract("_, _ -> new")
    public @NotNull QuerySpec orderBy(@NotNull String field, @NotNull SortOrder order) {
        return orderBy(new SortOption(field, order));
    }

    /**
     * @param skip the number of matching documents to skip, {@code 0} for none
     * @return the new spec
     * @throws IllegalArgumentException if {@code skip} is negative
     */
    @Contract("_ -> new")
    public @NotNull QuerySpec skip(int skip) {
        if (skip < 0) throw new IllegalArgumentException("Skip cannot be negative: " + skip);
        return new QuerySpec(filters, rawFilter, projection, sort, skip, limit);
    }

    /**
     * @param limit the maximum number of documents to return, {@code 0} for no limit
     * @return the new spec
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    @Contract("_ -> new")
    public @NotNull QuerySpec limit(int limit) {
        if (limit < 0) throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        return new QuerySpec(filters, rawFilter, projection, sort, skip, limit);
    }

    public List<FilterOption> filters() {
        return filters;
    }

    public @Nullable Map<String, Object> rawFilter() {
        return rawFilter;
    }

    public @Nullable Projection projection() {
        return projection;
    }

    public List<SortOption> sort() {
        return sort;
    }

    public int skip() {
        return skip;
    }

    public int limit() {
        return limit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuerySpec other)) return false;
        return skip == other.skip && limit == other.limit
            && filters.equals(other.filters)
            && Objects.equals(rawFilter, other.rawFilter)
            && Objects.equals(projection, other.projection)
            && sort.equals(other.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filters, rawFilter, projection, sort, skip, limit);
    }

    @Override
    public String toString() {
        return "QuerySpec{filters=" + filters + ", raw=" + rawFilter + ", projection=" + projection
            + ", sort=" + sort + ", skip=" + skip + ", limit=" + limit + '}';
    }
}
