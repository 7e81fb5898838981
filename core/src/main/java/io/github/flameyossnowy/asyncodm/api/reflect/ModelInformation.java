package io.github.flameyossnowy.asyncodm.api.reflect;

import io.github.flameyossnowy.asyncodm.api.IndexOptions;
import io.github.flameyossnowy.asyncodm.api.exceptions.ModelDefinitionException;
import io.github.flameyossnowy.asyncodm.api.exceptions.OdmException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Everything the mapper knows about one model class.
 * <p>
 * Instances are created by {@link ModelRegistry#register(Class[])}. A top-level model has a
 * collection and exactly one primary key; an embedded model has neither.
 */
public class ModelInformation {
    private static final Pattern POSITIONAL_FILTER = Pattern.compile("\\$\\[([a-z][A-Za-z0-9]*)?]");

    private final Class<?> type;
    private final String collectionName;
    private final boolean embedded;
    private final Constructor<?> constructor;

    private final Map<String, FieldData<?>> fields = new LinkedHashMap<>();
    private final Map<String, FieldData<?>> fieldsByWireName = new LinkedHashMap<>();
    private final List<FieldData<?>> referenceFields = new ArrayList<>();
    private final List<IndexOptions> indexes = new ArrayList<>();
    private final List<DeleteRuleEntry> deleteRules = new ArrayList<>();

    private FieldData<?> primaryKey;
    private Field extraFields;

    ModelInformation(Class<?> type, String collectionName, boolean embedded) {
        this.type = type;
        this.collectionName = collectionName;
        this.embedded = embedded;

        try {
            this.constructor = type.getDeclaredConstructor();
            this.constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new ModelDefinitionException("Model " + type.getName() + " must declare a no-argument constructor", e);
        }
    }

    void addField(FieldData<?> field) {
        if (fieldsByWireName.containsKey(field.wireName())) {
            throw new ModelDefinitionException("Model " + type.getSimpleName() + " stores two fields under '" + field.wireName() + "'");
        }
        fields.put(field.name(), field);
        fieldsByWireName.put(field.wireName(), field);
        if (field.primary()) primaryKey = field;
        if (field.isReference()) referenceFields.add(field);
    }

    void setExtraFields(Field extraFields) {
        this.extraFields = extraFields;
    }

    void addIndex(IndexOptions index) {
        indexes.add(index);
    }

    void addDeleteRule(DeleteRuleEntry entry) {
        deleteRules.add(entry);
    }

    public Class<?> getType() {
        return type;
    }

    /**
     * @return the collection name, {@code null} for embedded models
     */
    public @Nullable String getCollectionName() {
        return collectionName;
    }

    public boolean isEmbedded() {
        return embedded;
    }

    /**
     * @return the primary key field, {@code null} for embedded models
     */
    public FieldData<?> getPrimaryKey() {
        return primaryKey;
    }

    public Collection<FieldData<?>> getFields() {
        return Collections.unmodifiableCollection(fields.values());
    }

    public @Nullable FieldData<?> getField(String name) {
        return fields.get(name);
    }

    public @Nullable FieldData<?> getFieldByWireName(String wireName) {
        return fieldsByWireName.get(wireName);
    }

    public List<FieldData<?>> getReferenceFields() {
        return Collections.unmodifiableList(referenceFields);
    }

    public List<IndexOptions> getIndexes() {
        return Collections.unmodifiableList(indexes);
    }

    /**
     * The rules to apply to other models' documents when a document of this model is deleted.
     * @return the rules, in registration order
     */
    public List<DeleteRuleEntry> getDeleteRules() {
        return Collections.unmodifiableList(deleteRules);
    }

    public boolean hasExtraFields() {
        return extraFields != null;
    }

    /**
     * Returns the map holding the stored fields this model does not declare, creating it if the
     * instance has none yet.
     * @param instance the model instance
     * @return the live map, or {@code null} if the model declares no {@code @ExtraFields} map
     */
    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> getExtraFields(Object instance) {
        if (extraFields == null) return null;
        try {
            Map<String, Object> map = (Map<String, Object>) extraFields.get(instance);
            if (map == null) {
                map = new LinkedHashMap<>();
                extraFields.set(instance, map);
            }
            return map;
        } catch (IllegalAccessException e) {
            throw new OdmException("Cannot access extra fields of " + type.getSimpleName(), e);
        }
    }

    /**
     * Resolves a dotted path of Java field names to the path under which it is stored.
     * <p>
     * {@code pk} and {@code _id} name the primary key. Paths descend into embedded fields,
     * numeric segments and the positional operators {@code $}, {@code $[]} and {@code $[name]}
     * address list positions, and segments below a {@code Map} field are kept as they are. Stored names are accepted in place of Java field names.
     * @param path the path, for example {@code address.zipCode}
     * @return the resolved path, or {@code null} if the path names no field of this model
     */
    public @Nullable FieldPath resolvePath(@NotNull String path) {
        String[] segments = path.split("\\.");
        StringBuilder wire = new StringBuilder(path.length() + 8);
        ModelInformation current = this;
        FieldData<?> field = null;

        for (int index = 0; index < segments.length; index++) {
            String segment = segments[index];
            if (index > 0) wire.append('.');

            if (current == null) {
                if (field != null && field.list() && isPosition(segment)) {
                    wire.append(segment);
                    continue;
                }
                if (field != null && Map.class.isAssignableFrom(field.valueType())) {
                    wire.append(segment);
                    for (int rest = index + 1; rest < segments.length; rest++) wire.append('.').append(segments[rest]);
                    return new FieldPath(wire.toString(), null);
                }
                return null;
            }

            if (field != null && field.list() && isPosition(segment)) {
                wire.append(segment);
                continue;
            }

            FieldData<?> next;
            if (index == 0 && ("pk".equals(segment) || "_id".equals(segment)) && current.primaryKey != null) {
                next = current.primaryKey;
            } else {
                next = current.fields.get(segment);
                if (next == null) next = current.fieldsByWireName.get(segment);
            }
            if (next == null) return null;

            field = next;
            wire.append(next.wireName());
            current = next.isEmbedded() ? ModelRegistry.get(next.valueType()) : null;
        }

        return new FieldPath(wire.toString(), isPosition(segments[segments.length - 1]) ? null : field);
    }

    private static boolean isPosition(String segment) {
        return isNumeric(segment) || "$".equals(segment) || POSITIONAL_FILTER.matcher(segment).matches();
    }

    private static boolean isNumeric(String segment) {
        if (segment.isEmpty()) return false;
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) return false;
        }
        return true;
    }

    public Object newInstance() {
        try {
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new OdmException("Constructor of " + type.getSimpleName() + " threw", e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new OdmException("Cannot instantiate " + type.getSimpleName(), e);
        }
    }

    @Override
    public String toString() {
        return "ModelInformation{" + type.getSimpleName() + (embedded ? ", embedded" : ", collection=" + collectionName) + '}';
    }
}
