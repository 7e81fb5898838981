package io.github.flameyossnowy.asyncodm.mongodb.codec;

import io.github.flameyossnowy.asyncodm.api.Ref;
import io.github.flameyossnowy.asyncodm.api.UnknownFieldPolicy;
import io.github.flameyossnowy.asyncodm.api.exceptions.ModelDefinitionException;
import io.github.flameyossnowy.asyncodm.api.exceptions.OdmException;
import io.github.flameyossnowy.asyncodm.api.exceptions.ValidationException;
import io.github.flameyossnowy.asyncodm.api.reflect.FieldData;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelInformation;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelRegistry;
import io.github.flameyossnowy.asyncodm.api.validation.FieldValidator;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts model instances to stored documents and back.
 * <p>
 * Encoding validates every field in declaration order and fails with the first
 * {@link ValidationException}. Decoding is permissive: fields missing from the document are left
 * unset and fields the model does not declare follow the {@link UnknownFieldPolicy}.
 * References are stored as the primary key of their target and decode to unresolved {@link Ref}s.
 * No method of this class performs I/O.
 */
@ApiStatus.Internal
@SuppressWarnings({"unchecked", "rawtypes"})
public class DocumentCodec {
    private final ValueTypeResolverRegistry resolvers;
    private final UnknownFieldPolicy unknownFieldPolicy;

    public DocumentCodec(@NotNull ValueTypeResolverRegistry resolvers, @NotNull UnknownFieldPolicy unknownFieldPolicy) {
        this.resolvers = resolvers;
        this.unknownFieldPolicy = unknownFieldPolicy;
    }

    public ValueTypeResolverRegistry getResolvers() {
        return resolvers;
    }

    public UnknownFieldPolicy getUnknownFieldPolicy() {
        return unknownFieldPolicy;
    }

    /**
     * Encodes a top-level or embedded model instance.
     * @param instance the instance
     * @return the document to store
     * @throws ValidationException if a field violates its constraints
     */
    public @NotNull Document encode(@NotNull Object instance) {
        ModelInformation information = ModelRegistry.get(instance.getClass());
        Document document = new Document();

        for (FieldData<?> field : information.getFields()) {
            Object value = field.getValue(instance);

            if (field.primary()) {
                if (value == null) {
                    if (field.type() != ObjectId.class) {
                        throw new ValidationException(field.name(), FieldValidator.REQUIRED, "primary key of type "
                            + field.type().getSimpleName() + " must be set before saving");
                    }
                    continue;
                }
                document.put("_id", resolvers.encode(value));
                continue;
            }

            FieldValidator.validate(field, value);
            if (value == null) continue;
            document.put(field.wireName(), encodeField(field, value));
        }

        if (information.hasExtraFields()) {
            Map<String, Object> extras = information.getExtraFields(instance);
            extras.forEach(document::putIfAbsent);
        }
        return document;
    }

    private Object encodeField(FieldData<?> field, Object value) {
        return switch (field.kind()) {
            case REFERENCE -> field.list()
                ? mapList((Collection<?>) value, (element, index) -> encodeReference(field, element))
                : encodeReference(field, value);
            case EMBEDDED -> field.list()
                ? mapList((Collection<?>) value, (element, index) -> encodeEmbedded(field.name() + "." + index, element))
                : encodeEmbedded(field.name(), value);
            case SCALAR -> encodeValue(value);
        };
    }

    private Object encodeReference(FieldData<?> field, Object value) {
        Object id = referenceId(value);
        if (id == null) {
            throw new ValidationException(field.name(), "reference", "referenced "
                + field.valueType().getSimpleName() + " has no primary key, save it first");
        }
        return id;
    }

    private Document encodeEmbedded(String path, Object value) {
        try {
            return encode(value);
        } catch (ValidationException e) {
            throw e.nestedIn(path);
        }
    }

    private List<Object> mapList(Collection<?> values, ElementEncoder encoder) {
        List<Object> encoded = new ArrayList<>(values.size());
        int index = 0;
        for (Object element : values) {
            encoded.add(element == null ? null : encoder.encode(element, index));
            index++;
        }
        return encoded;
    }

    /**
     * Encodes a value by its runtime type, as used in query filters and updates.
     * <p>
     * References and top-level model instances encode to their primary key, embedded model
     * instances to their document, collections and maps element by element.
     * @param value the value
     * @return the stored form of the value
     */
    public Object encodeValue(@Nullable Object value) {
        if (value == null) return null;
        if (value instanceof Ref<?> ref) return resolvers.encode(ref.id());

        ModelInformation model = ModelRegistry.find(value.getClass());
        if (model != null) {
            return model.isEmbedded() ? encode(value) : referenceId(value);
        }

        if (value instanceof Collection<?> collection) {
            List<Object> encoded = new ArrayList<>(collection.size());
            for (Object element : collection) encoded.add(encodeValue(element));
            return encoded;
        }
        if (value instanceof Object[] array) {
            List<Object> encoded = new ArrayList<>(array.length);
            for (Object element : array) encoded.add(encodeValue(element));
            return encoded;
        }
        if (value instanceof Map<?, ?> map && !(value instanceof Document)) {
            Document encoded = new Document();
            map.forEach((key, element) -> encoded.put(String.valueOf(key), encodeValue(element)));
            return encoded;
        }
        return resolvers.encode(value);
    }

    /**
     * The stored primary key a reference value points at.
     * @param value a {@link Ref}, a model instance or a raw primary key
     * @return the primary key, or {@code null} if the value is an unsaved model instance
     */
    public @Nullable Object referenceId(@Nullable Object value) {
        if (value == null) return null;
        if (value instanceof Ref<?> ref) return resolvers.encode(ref.id());

        ModelInformation model = ModelRegistry.find(value.getClass());
        if (model != null && !model.isEmbedded()) {
            return resolvers.encode(model.getPrimaryKey().getValue(value));
        }
        return resolvers.encode(value);
    }

    /**
     * Decodes a stored document into a new instance of a top-level or embedded model.
     * @param document the stored document
     * @param type the model class
     * @return the instance
     */
    public <T> @NotNull T decode(@NotNull Document document, @NotNull Class<T> type) {
        ModelInformation information = ModelRegistry.get(type);
        T instance = (T) information.newInstance();

        for (Map.Entry<String, Object> entry : document.entrySet()) {
            FieldData<?> field = information.getFieldByWireName(entry.getKey());
            if (field == null) {
                handleUnknownField(information, instance, entry.getKey(), entry.getValue());
                continue;
            }
            setDecoded(field, instance, entry.getValue());
        }
        return instance;
    }

    /**
     * Overwrites fields of an existing instance with the stored values. Fields absent from the
     * document are reset to {@code null}.
     * @param document the stored document
     * @param target the instance to update
     * @param onlyFields Java field names to update, or an empty set for every field
     */
    public void decodeInto(@NotNull Document document, @NotNull Object target, @NotNull Set<String> onlyFields) {
        ModelInformation information = ModelRegistry.get(target.getClass());
        for (FieldData<?> field : information.getFields()) {
            if (!onlyFields.isEmpty() && !onlyFields.contains(field.name())) continue;
            if (field.type().isPrimitive() && document.get(field.wireName()) == null) continue;
            field.setValue(target, decodeField(field, document.get(field.wireName())));
        }

        if (onlyFields.isEmpty() && information.hasExtraFields()) {
            information.getExtraFields(target).clear();
            for (Map.Entry<String, Object> entry : document.entrySet()) {
                if (information.getFieldByWireName(entry.getKey()) == null) {
                    handleUnknownField(information, target, entry.getKey(), entry.getValue());
                }
            }
        }
    }

    private void handleUnknownField(ModelInformation information, Object instance, String key, Object value) {
        if (unknownFieldPolicy == UnknownFieldPolicy.DROP) return;
        if (!information.hasExtraFields()) {
            throw new ModelDefinitionException("Stored field '" + key + "' is unknown to " + information.getType().getSimpleName()
                + " and it declares no @ExtraFields map to preserve it");
        }
        information.getExtraFields(instance).put(key, value);
    }

    private void setDecoded(FieldData<?> field, Object instance, Object stored) {
        if (stored == null && field.type().isPrimitive()) return;
        field.setValue(instance, decodeField(field, stored));
    }

    private Object decodeField(FieldData<?> field, Object stored) {
        if (stored == null) return null;
        try {
            if (field.list()) {
                if (!(stored instanceof Collection<?> values)) {
                    throw new IllegalArgumentException("expected an array, found " + stored.getClass().getSimpleName());
                }
                List<Object> decoded = new ArrayList<>(values.size());
                for (Object element : values) {
                    decoded.add(element == null ? null : decodeElement(field, element));
                }
                return decoded;
            }
            return decodeElement(field, stored);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new OdmException("Cannot decode " + field + ": " + e.getMessage(), e);
        }
    }

    private Object decodeElement(FieldData<?> field, Object stored) {
        return switch (field.kind()) {
            case REFERENCE -> Ref.id((Class<Object>) field.valueType(), decodeId(field.valueType(), stored));
            case EMBEDDED -> decode((Document) stored, field.valueType());
            case SCALAR -> decodeScalar(field.valueType(), stored);
        };
    }

    private Object decodeId(Class<?> target, Object stored) {
        FieldData<?> primaryKey = ModelRegistry.get(target).getPrimaryKey();
        return resolvers.decode(primaryKey.type(), stored);
    }

    private Object decodeScalar(Class<?> type, Object stored) {
        if (Set.class.isAssignableFrom(type) && stored instanceof Collection<?> values) {
            return new LinkedHashSet<>(values);
        }
        if (Map.class.isAssignableFrom(type) && stored instanceof Map<?, ?> map) {
            return new LinkedHashMap<>(map);
        }
        return resolvers.decode(type, stored);
    }

    @FunctionalInterface
    private interface ElementEncoder {
        Object encode(Object element, int index);
    }
}
