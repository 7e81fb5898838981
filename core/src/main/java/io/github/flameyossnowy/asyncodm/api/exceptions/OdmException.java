package io.github.flameyossnowy.asyncodm.api.exceptions;

/**
 * Base class of every failure raised by the mapper itself.
 * <p>
 * Failures of the storage driver are never wrapped in this type, they reach the caller as the
 * driver raised them.
 */
public class OdmException extends RuntimeException {
    public OdmException(String message) {
        super(message);
    }

    public OdmException(String message, Throwable cause) {
        super(message, cause);
    }
}
