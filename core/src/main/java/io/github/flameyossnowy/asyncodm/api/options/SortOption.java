package io.github.flameyossnowy.asyncodm.api.options;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The sort option
 * @param field The model field path
 * @param order The order
 */
public record SortOption(String field, SortOrder order) {
    public SortOption {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(order, "order");
    }

    @Contract("_ -> new")
    public static @NotNull SortOption ascending(String field) {
        return new SortOption(field, SortOrder.ASCENDING);
    }

    @Contract("_ -> new")
    public static @NotNull SortOption descending(String field) {
        return new SortOption(field, SortOrder.DESCENDING);
    }
}
