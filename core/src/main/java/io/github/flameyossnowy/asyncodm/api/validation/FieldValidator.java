package io.github.flameyossnowy.asyncodm.api.validation;

import io.github.flameyossnowy.asyncodm.api.annotations.MaxLength;
import io.github.flameyossnowy.asyncodm.api.annotations.Range;
import io.github.flameyossnowy.asyncodm.api.exceptions.ValidationException;
import io.github.flameyossnowy.asyncodm.api.reflect.FieldData;
import io.github.flameyossnowy.asyncodm.api.reflect.FieldKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Map;

/**
 * Checks a field value against the constraints declared on the field.
 * <p>
 * Constraint names reported by {@link ValidationException#getConstraint()}:
 * {@code required}, {@code min}, {@code max} and {@code max_length}.
 * Fields of embedded models are validated by whoever walks into them, usually the document codec.
 */
public final class FieldValidator {
    public static final String REQUIRED = "required";
    public static final String MIN = "min";
    public static final String MAX = "max";
    public static final String MAX_LENGTH = "max_length";

    private FieldValidator() {}

    /**
     * @param field the field
     * @param value the value about to be stored
     * @throws ValidationException if the value violates a constraint of the field
     */
    public static void validate(@NotNull FieldData<?> field, @Nullable Object value) {
        if (isBlank(value)) {
            if (field.nonNull()) {
                throw new ValidationException(field.name(), REQUIRED, "field is required");
            }
            if (value == null) return;
        }

        MaxLength maxLength = field.maxLength();
        if (maxLength != null) checkLength(field, value, maxLength.value());

        Range range = field.range();
        if (range == null || field.kind() != FieldKind.SCALAR) return;

        if (value instanceof Collection<?> collection) {
            for (Object element : collection) checkRange(field, element, range);
        } else {
            checkRange(field, value, range);
        }
    }

    private static boolean isBlank(Object value) {
        return value == null
            || (value instanceof CharSequence chars && chars.length() == 0)
            || (value instanceof Collection<?> collection && collection.isEmpty())
            || (value instanceof Map<?, ?> map && map.isEmpty());
    }

    private static void checkLength(FieldData<?> field, Object value, int max) {
        int length;
        if (value instanceof CharSequence chars) length = chars.length();
        else if (value instanceof Collection<?> collection) length = collection.size();
        else return;

        if (length > max) {
            throw new ValidationException(field.name(), MAX_LENGTH, "length " + length + " exceeds " + max);
        }
    }

    private static void checkRange(FieldData<?> field, Object value, Range range) {
        if (!(value instanceof Number number)) return;
        double actual = number.doubleValue();
        if (actual < range.min()) {
            throw new ValidationException(field.name(), MIN, value + " is less than " + format(range.min()));
        }
        if (actual > range.max()) {
            throw new ValidationException(field.name(), MAX, value + " is greater than " + format(range.max()));
        }
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) && !Double.isInfinite(bound) ? Long.toString((long) bound) : Double.toString(bound);
    }
}
