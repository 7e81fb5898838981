package io.github.flameyossnowy.asyncodm.api.annotations.enums;

/**
 * The type of index, normal or unique.
 */
public enum IndexType {
    NORMAL,
    UNIQUE
}
