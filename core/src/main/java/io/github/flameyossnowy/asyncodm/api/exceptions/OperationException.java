package io.github.flameyossnowy.asyncodm.api.exceptions;

/**
 * An operation is not allowed in the current state, such as deleting a document that is still
 * referenced through a {@code DENY} delete rule.
 */
public class OperationException extends OdmException {
    public OperationException(String message) {
        super(message);
    }
}
