package io.github.flameyossnowy.asyncodm.api.exceptions;

/**
 * More than one document matched where exactly one was required.
 */
public class MultipleObjectsReturnedException extends OdmException {
    private final Class<?> model;

    public MultipleObjectsReturnedException(Class<?> model) {
        super("More than one " + model.getSimpleName() + " matched the query.");
        this.model = model;
    }

    public Class<?> getModel() {
        return model;
    }
}
