package io.github.flameyossnowy.asyncodm.api.exceptions;

/**
 * A reference points at a document that no longer exists.
 */
public class BrokenReferenceException extends OdmException {
    private final Class<?> model;
    private final Object id;

    public BrokenReferenceException(Class<?> model, Object id) {
        super("Reference to " + model.getSimpleName() + " with id " + id + " has no target.");
        this.model = model;
        this.id = id;
    }

    public Class<?> getModel() {
        return model;
    }

    public Object getId() {
        return id;
    }
}
