package io.github.flameyossnowy.asyncodm.api.reflect;

/**
 * How a field's value is stored.
 */
public enum FieldKind {
    /**
     * Stored as a single BSON value, after type coercion.
     */
    SCALAR,

    /**
     * Stored as a sub-document owned by the containing document.
     */
    EMBEDDED,

    /**
     * Stored as the primary key of a document in another collection.
     */
    REFERENCE
}
