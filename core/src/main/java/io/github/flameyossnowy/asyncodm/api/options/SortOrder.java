package io.github.flameyossnowy.asyncodm.api.options;

public enum SortOrder {
    ASCENDING,
    DESCENDING
}
