package io.github.flameyossnowy.asyncodm.api;

import io.github.flameyossnowy.asyncodm.api.annotations.enums.IndexType;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * An index definition of a model's collection.
 * @param name the index name, or {@code null} to let the server generate one
 * @param keys the stored field paths in index order, {@code 1} for ascending and {@code -1} for descending
 * @param type the index type
 */
public record IndexOptions(@Nullable String name, Map<String, Integer> keys, IndexType type) {
    public IndexOptions {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(type, "type");
        if (keys.isEmpty()) throw new IllegalArgumentException("Index must have at least one field");
        keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
    }

    public boolean unique() {
        return type == IndexType.UNIQUE;
    }

    public String getJoinedFields() {
        StringJoiner joiner = new StringJoiner(", ");
        keys.forEach((field, direction) -> joiner.add(direction < 0 ? "-" + field : field));
        return joiner.toString();
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IndexType type = IndexType.NORMAL;
        private final Map<String, Integer> keys = new LinkedHashMap<>(2);
        private String indexName;

        Builder() {}

        /**
         * Sets the name of the index. If not specified, the server generates one.
         *
         * @param indexName the name of the index
         * @return this builder
         */
        public Builder indexName(String indexName) {
            this.indexName = indexName;
            return this;
        }

        /**
         * Sets the type of the index.
         *
         * <p>The default value is {@link IndexType#NORMAL}.
         *
         * @param type the type of the index
         * @return this builder
         */
        public Builder type(IndexType type) {
            this.type = type;
            return this;
        }

        public Builder ascending(@NotNull String wirePath) {
            keys.put(Objects.requireNonNull(wirePath, "Field cannot be null"), 1);
            return this;
        }

        public Builder descending(@NotNull String wirePath) {
            keys.put(Objects.requireNonNull(wirePath, "Field cannot be null"), -1);
            return this;
        }

        public IndexOptions build() {
            return new IndexOptions(indexName, keys, type);
        }
    }
}
