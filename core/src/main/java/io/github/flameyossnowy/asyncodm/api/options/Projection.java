package io.github.flameyossnowy.asyncodm.api.options;

import java.util.List;
import java.util.Objects;

/**
 * Which fields of the stored documents are loaded.
 * @param mode whether {@code fields} are the only ones loaded or the ones left out
 * @param fields model field paths
 */
public record Projection(Mode mode, List<String> fields) {
    public enum Mode {
        INCLUDE,
        EXCLUDE
    }

    public Projection {
        Objects.requireNonNull(mode, "mode");
        fields = List.copyOf(fields);
    }
}
