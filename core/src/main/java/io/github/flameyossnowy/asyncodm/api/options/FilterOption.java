package io.github.flameyossnowy.asyncodm.api.options;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Set;

/**
 * The filter option.
 * @param field The model field path, in dot notation for fields of embedded models.
 * @param operator The operator, one of {@link #OPERATORS}.
 * @param value The value to compare with. For {@code IN} and {@code NIN} a collection or array,
 *              for {@code EXISTS} a boolean and for {@code REGEX} a pattern string.
 */
public record FilterOption(String field, String operator, Object value) {
    public static final Set<String> OPERATORS = Set.of("=", "!=", ">", ">=", "<", "<=", "IN", "NIN", "EXISTS", "REGEX");

    public FilterOption {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
    }

    public static @NotNull FilterOption eq(String field, Object value) {
        return new FilterOption(field, "=", value);
    }
}
