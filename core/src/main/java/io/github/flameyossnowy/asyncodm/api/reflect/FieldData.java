package io.github.flameyossnowy.asyncodm.api.reflect;

import io.github.flameyossnowy.asyncodm.api.Ref;
import io.github.flameyossnowy.asyncodm.api.annotations.MaxLength;
import io.github.flameyossnowy.asyncodm.api.annotations.Range;
import io.github.flameyossnowy.asyncodm.api.annotations.Reference;
import io.github.flameyossnowy.asyncodm.api.annotations.enums.DeleteRule;
import io.github.flameyossnowy.asyncodm.api.exceptions.ModelDefinitionException;
import io.github.flameyossnowy.asyncodm.api.exceptions.OdmException;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;

/**
 * The schema of one declared model field. Built once by the {@link ModelRegistry}, immutable afterwards.
 *
 * @param <T> the declared Java type of the field
 */
@ApiStatus.Internal
@SuppressWarnings("unchecked")
public class FieldData<T> {
    private final Class<?> declaringType;

    private final String name;
    private final String wireName;

    private final Field rawField;
    private final Class<T> type;

    // List element type, Ref target or embedded model, depending on kind
    private final Class<?> valueType;
    private final FieldKind kind;
    private final boolean list;

    private final boolean primary;
    private final boolean nonNull;
    private final boolean unique;

    private final Range range;
    private final MaxLength maxLength;
    private final Reference reference;

    FieldData(
        Class<?> declaringType,
        String name,
        String wireName,
        Field rawField,
        Class<T> type,
        boolean primary,
        boolean nonNull,
        boolean unique,
        Range range,
        MaxLength maxLength,
        Reference reference
    ) {
        this.declaringType = declaringType;
        this.name = name;
        this.wireName = wireName;

        this.rawField = rawField;
        this.type = type;

        GenericInfo info = GenericInfo.resolve(rawField, type);
        this.valueType = info.valueType;
        this.kind = info.kind;
        this.list = info.list;

        this.primary = primary;
        this.nonNull = nonNull;
        this.unique = unique;

        this.range = range;
        this.maxLength = maxLength;
        this.reference = reference;

        if (reference != null && kind != FieldKind.REFERENCE) {
            throw new ModelDefinitionException("@Reference on " + this + " requires a Ref<T> or List<Ref<T>> field");
        }
    }

    public Class<?> declaringType() {
        return declaringType;
    }

    /**
     * @return the Java field name
     */
    public String name() {
        return name;
    }

    /**
     * @return the name the value is stored under
     */
    public String wireName() {
        return wireName;
    }

    public Field rawField() {
        return rawField;
    }

    public Class<T> type() {
        return type;
    }

    /**
     * The type of the stored values. For a list this is the element type, for a reference the
     * referenced model and for an embedded field the embedded model.
     * @return the value type
     */
    public Class<?> valueType() {
        return valueType;
    }

    public FieldKind kind() {
        return kind;
    }

    public boolean list() {
        return list;
    }

    public boolean primary() {
        return primary;
    }

    public boolean nonNull() {
        return nonNull;
    }

    public boolean unique() {
        return unique;
    }

    public @Nullable Range range() {
        return range;
    }

    public @Nullable MaxLength maxLength() {
        return maxLength;
    }

    public DeleteRule deleteRule() {
        return reference == null ? DeleteRule.DO_NOTHING : reference.onDelete();
    }

    public boolean isReference() {
        return kind == FieldKind.REFERENCE;
    }

    public boolean isEmbedded() {
        return kind == FieldKind.EMBEDDED;
    }

    public <E> E getValue(Object obj) {
        try {
            return (E) rawField.get(obj);
        } catch (IllegalAccessException e) {
            throw new OdmException("Cannot read " + this, e);
        }
    }

    public <E> void setValue(Object obj, E value) {
        try {
            rawField.set(obj, value);
        } catch (IllegalAccessException e) {
            throw new OdmException("Cannot write " + this, e);
        }
    }

    public <A extends Annotation> A getAnnotation(Class<A> clazz) {
        return rawField.getAnnotation(clazz);
    }

    @Override
    public String toString() {
        return declaringType.getSimpleName() + "." + name;
    }

    private record GenericInfo(Class<?> valueType, FieldKind kind, boolean list) {
        static GenericInfo resolve(Field field, Class<?> rawType) {
            if (List.class.isAssignableFrom(rawType)) {
                Type element = typeArgument(field.getGenericType(), field);
                if (element instanceof ParameterizedType pt && pt.getRawType() == Ref.class) {
                    return new GenericInfo(requireClass(pt.getActualTypeArguments()[0], field), FieldKind.REFERENCE, true);
                }
                Class<?> elementType = requireClass(element, field);
                return new GenericInfo(elementType, kindOf(elementType), true);
            }

            if (rawType == Ref.class) {
                Type target = typeArgument(field.getGenericType(), field);
                return new GenericInfo(requireClass(target, field), FieldKind.REFERENCE, false);
            }

            return new GenericInfo(rawType, kindOf(rawType), false);
        }

        private static FieldKind kindOf(Class<?> type) {
            return ModelRegistry.isEmbeddedModel(type) ? FieldKind.EMBEDDED : FieldKind.SCALAR;
        }

        private static Type typeArgument(Type genericType, Field source) {
            if (genericType instanceof ParameterizedType pt) return pt.getActualTypeArguments()[0];
            throw new ModelDefinitionException("Raw type is not supported for " + source + ", declare its type argument");
        }

        private static Class<?> requireClass(Type type, Field source) {
            if (type instanceof Class<?> cls) return cls;
            if (type instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> raw) return raw;
            throw new ModelDefinitionException("Unsupported generic type in " + source + ": " + type);
        }
    }
}
