package io.github.flameyossnowy.asyncodm.api;

/**
 * What dereferencing does with a reference whose target document no longer exists.
 */
public enum BrokenReferencePolicy {
    /**
     * Leave a broken {@link Ref} in the field, see {@link Ref#isBroken()}.
     */
    SENTINEL,

    /**
     * Fail the dereference with a {@link io.github.flameyossnowy.asyncodm.api.exceptions.BrokenReferenceException}.
     */
    STRICT
}
