package io.github.flameyossnowy.asyncodm.api.exceptions;

/**
 * No document matched where exactly one was required.
 */
public class DoesNotExistException extends OdmException {
    private final Class<?> model;

    public DoesNotExistException(Class<?> model) {
        super(model.getSimpleName() + " matching query does not exist.");
        this.model = model;
    }

    public Class<?> getModel() {
        return model;
    }
}
