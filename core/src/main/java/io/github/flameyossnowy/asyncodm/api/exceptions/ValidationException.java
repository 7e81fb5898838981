package io.github.flameyossnowy.asyncodm.api.exceptions;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A field of a model instance violates one of its declared constraints.
 * <p>
 * Raised while encoding, before any document is sent to storage.
 */
public class ValidationException extends OdmException {
    private final String field;
    private final String constraint;
    private final String detail;

    public ValidationException(String field, String constraint, String detail) {
        super(field + ": " + detail + " [" + constraint + "]");
        this.field = field;
        this.constraint = constraint;
        this.detail = detail;
    }

    /**
     * The path of the offending field, in dot notation for fields of embedded models.
     * @return the field path
     */
    public String getField() {
        return field;
    }

    /**
     * The name of the violated constraint, such as {@code required} or {@code max_length}.
     * @return the constraint name
     */
    public String getConstraint() {
        return constraint;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Returns a copy of this exception whose field path is prefixed by the given parent field.
     * @param parent the name of the field that embeds the offending one
     * @return the nested exception
     */
    @Contract("_ -> new")
    public @NotNull ValidationException nestedIn(String parent) {
        return new ValidationException(parent + '.' + field, constraint, detail);
    }
}
