package io.github.flameyossnowy.asyncodm.api.annotations.enums;

/**
 * What happens to referencing documents when the document they reference is deleted.
 * @author flameyosflow
 */
public enum DeleteRule {
    /**
     * Leave the referencing documents as they are.
     */
    DO_NOTHING,

    /**
     * Unset the reference field of the referencing documents.
     */
    NULLIFY,

    /**
     * Delete the referencing documents, applying their own delete rules.
     */
    CASCADE,

    /**
     * Refuse to delete while any referencing document exists.
     */
    DENY,

    /**
     * Remove the deleted identifiers from a list reference field.
     */
    PULL
}
