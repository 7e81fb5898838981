package io.github.flameyossnowy.asyncodm.api.exceptions;

/**
 * A model class is declared in a way the mapper cannot handle.
 */
public class ModelDefinitionException extends OdmException {
    public ModelDefinitionException(String message) {
        super(message);
    }

    public ModelDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
