package io.github.flameyossnowy.asyncodm.api.reflect;

import io.github.flameyossnowy.asyncodm.api.IndexOptions;
import io.github.flameyossnowy.asyncodm.api.annotations.Embedded;
import io.github.flameyossnowy.asyncodm.api.annotations.ExtraFields;
import io.github.flameyossnowy.asyncodm.api.annotations.Id;
import io.github.flameyossnowy.asyncodm.api.annotations.Index;
import io.github.flameyossnowy.asyncodm.api.annotations.MaxLength;
import io.github.flameyossnowy.asyncodm.api.annotations.Named;
import io.github.flameyossnowy.asyncodm.api.annotations.NonNull;
import io.github.flameyossnowy.asyncodm.api.annotations.Range;
import io.github.flameyossnowy.asyncodm.api.annotations.Reference;
import io.github.flameyossnowy.asyncodm.api.annotations.Repository;
import io.github.flameyossnowy.asyncodm.api.annotations.Unique;
import io.github.flameyossnowy.asyncodm.api.annotations.enums.DeleteRule;
import io.github.flameyossnowy.asyncodm.api.annotations.enums.IndexType;
import io.github.flameyossnowy.asyncodm.api.exceptions.ModelDefinitionException;
import io.github.flameyossnowy.asyncodm.api.utils.Logging;
import org.bson.types.ObjectId;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table of model schemas.
 * <p>
 * The registry has two phases. During initialization, models are added with
 * {@link #register(Class[])}; referenced and embedded models are added along with them. Once the
 * mapper is built the registry is {@link #seal() sealed}: registering a new model fails from then
 * on and lookups never change.
 * <pre>{@code
 * ModelRegistry.register(User.class, Post.class);
 * ModelInformation info = ModelRegistry.get(Post.class);
 * }</pre>
 */
public final class ModelRegistry {
    private static final Map<Class<?>, ModelInformation> MODELS = new ConcurrentHashMap<>(8);

    // models of the register call in progress, published to MODELS only if all of them are valid
    private static Map<Class<?>, ModelInformation> pending = Collections.emptyMap();

    private static volatile boolean sealed;

    private ModelRegistry() {}

    /**
     * Registers the given models and every model they reference or embed. Registering a model
     * twice has no effect.
     *
     * @param types the model classes
     * @throws ModelDefinitionException if a model is declared incorrectly; no model of the call is registered then
     * @throws IllegalStateException if the registry is sealed and a model is not registered yet
     */
    public static synchronized void register(@NotNull Class<?>... types) {
        Objects.requireNonNull(types, "types");
        Map<Class<?>, ModelInformation> built = new LinkedHashMap<>(types.length * 2);
        pending = built;
        try {
            for (Class<?> type : types) {
                build(type);
            }
            List<DeleteRuleEntry> rules = new ArrayList<>();
            for (ModelInformation information : built.values()) {
                collectDeleteRules(information, rules);
            }
            for (DeleteRuleEntry rule : rules) {
                get(rule.field().valueType()).addDeleteRule(rule);
            }
            MODELS.putAll(built);
        } finally {
            pending = Collections.emptyMap();
        }
        for (ModelInformation information : built.values()) {
            Logging.info("Registered model " + information);
        }
    }

    /**
     * Ends the initialization phase.
     */
    public static void seal() {
        sealed = true;
    }

    public static boolean isSealed() {
        return sealed;
    }

    /**
     * @param type a registered model class
     * @return the schema of the model
     * @throws IllegalArgumentException if the model is not registered
     */
    public static @NotNull ModelInformation get(@NotNull Class<?> type) {
        ModelInformation information = find(type);
        if (information == null) {
            throw new IllegalArgumentException("Model " + type.getName() + " is not registered");
        }
        return information;
    }

    public static @Nullable ModelInformation find(@NotNull Class<?> type) {
        ModelInformation information = MODELS.get(type);
        return information != null ? information : pending.get(type);
    }

    public static Collection<ModelInformation> models() {
        return Collections.unmodifiableCollection(MODELS.values());
    }

    /**
     * Forgets every model and unseals the registry. Only for testing.
     */
    @ApiStatus.Internal
    public static synchronized void clear() {
        MODELS.clear();
        sealed = false;
    }

    static boolean isEmbeddedModel(Class<?> type) {
        return type.isAnnotationPresent(Embedded.class);
    }

    private static ModelInformation build(Class<?> type) {
        ModelInformation existing = find(type);
        if (existing != null) return existing;

        if (sealed) {
            throw new IllegalStateException("Cannot register " + type.getName() + ", the model registry is sealed");
        }

        Repository repository = type.getAnnotation(Repository.class);
        boolean embedded = isEmbeddedModel(type);
        if (repository == null && !embedded) {
            throw new ModelDefinitionException("Class " + type.getName() + " is neither annotated with @Repository nor @Embedded");
        }
        if (repository != null && embedded) {
            throw new ModelDefinitionException("Class " + type.getName() + " cannot be both a @Repository and @Embedded");
        }

        String collectionName = embedded ? null : repository.name().isEmpty() ? toSnakeCase(type.getSimpleName()) : repository.name();
        ModelInformation information = new ModelInformation(type, collectionName, embedded);

        // published before the fields so that cyclic references find it
        pending.put(type, information);

        Field primaryKey = findPrimaryKey(type, embedded);
        for (Field field : type.getDeclaredFields()) {
            if (!isPersistent(field)) continue;
            field.setAccessible(true);

            if (field.isAnnotationPresent(ExtraFields.class)) {
                if (!Map.class.isAssignableFrom(field.getType())) {
                    throw new ModelDefinitionException("@ExtraFields field " + field + " must be a Map<String, Object>");
                }
                if (information.hasExtraFields()) {
                    throw new ModelDefinitionException("Model " + type.getSimpleName() + " declares more than one @ExtraFields map");
                }
                information.setExtraFields(field);
                continue;
            }

            processField(information, field, field.equals(primaryKey));
        }

        for (FieldData<?> field : information.getFields()) {
            if (field.isEmbedded() || field.isReference()) {
                ModelInformation target = build(field.valueType());
                if (field.isReference() && target.isEmbedded()) {
                    throw new ModelDefinitionException("Reference " + field + " points at embedded model " + target.getType().getSimpleName());
                }
            } else if (field.valueType().isAnnotationPresent(Repository.class)) {
                throw new ModelDefinitionException("Field " + field + " holds a model directly, declare it as Ref<"
                    + field.valueType().getSimpleName() + "> to store a reference");
            }
        }

        if (!embedded) collectIndexes(information);
        return information;
    }

    private static void processField(ModelInformation information, Field field, boolean id) {
        Named named = field.getAnnotation(Named.class);
        String wireName = id ? "_id" : named == null ? field.getName() : named.value();

        information.addField(new FieldData<>(
            information.getType(),
            field.getName(),
            wireName,
            field,
            field.getType(),
            id,
            field.isAnnotationPresent(NonNull.class),
            field.isAnnotationPresent(Unique.class),
            field.getAnnotation(Range.class),
            field.getAnnotation(MaxLength.class),
            field.getAnnotation(Reference.class)
        ));
    }

    private static boolean isPersistent(Field field) {
        int mods = field.getModifiers();
        return !(Modifier.isStatic(mods) || Modifier.isFinal(mods) || Modifier.isTransient(mods) || field.isSynthetic());
    }

    // An @Id field, otherwise an ObjectId field named 'id'.
    private static @Nullable Field findPrimaryKey(Class<?> type, boolean embedded) {
        Field declared = null;
        Field implicit = null;
        for (Field field : type.getDeclaredFields()) {
            if (!isPersistent(field)) continue;
            if (field.isAnnotationPresent(Id.class)) {
                if (embedded) {
                    throw new ModelDefinitionException("Embedded model " + type.getSimpleName() + " cannot declare an @Id");
                }
                if (declared != null) {
                    throw new ModelDefinitionException("Model " + type.getSimpleName() + " declares more than one @Id");
                }
                declared = field;
            } else if ("id".equals(field.getName()) && field.getType() == ObjectId.class) {
                implicit = field;
            }
        }
        if (embedded) return null;

        Field primaryKey = declared != null ? declared : implicit;
        if (primaryKey == null) {
            throw new ModelDefinitionException("Model " + type.getSimpleName() + " has no primary key, declare an @Id field or an ObjectId field named 'id'");
        }
        return primaryKey;
    }

    private static void collectIndexes(ModelInformation information) {
        for (Index index : information.getType().getAnnotationsByType(Index.class)) {
            if (index.fields().length == 0) {
                throw new ModelDefinitionException("@Index on " + information.getType().getSimpleName() + " has no fields");
            }
            IndexOptions.Builder builder = IndexOptions.builder().type(index.type());
            if (!index.name().isEmpty()) builder.indexName(index.name());

            for (String spec : index.fields()) {
                boolean descending = spec.startsWith("-");
                String path = descending ? spec.substring(1) : spec;
                FieldPath resolved = information.resolvePath(path);
                if (resolved == null) {
                    throw new ModelDefinitionException("@Index on " + information.getType().getSimpleName() + " names unknown field '" + path + "'");
                }
                if (descending) builder.descending(resolved.wirePath());
                else builder.ascending(resolved.wirePath());
            }
            information.addIndex(builder.build());
        }

        for (FieldData<?> field : information.getFields()) {
            if (field.unique() && !field.primary()) {
                information.addIndex(IndexOptions.builder().type(IndexType.UNIQUE).ascending(field.wireName()).build());
            }
        }
    }

    private static void collectDeleteRules(ModelInformation information, List<DeleteRuleEntry> rules) {
        for (FieldData<?> field : information.getReferenceFields()) {
            DeleteRule rule = field.deleteRule();
            if (rule == DeleteRule.DO_NOTHING) continue;

            if (information.isEmbedded()) {
                throw new ModelDefinitionException("Delete rule " + rule + " on " + field
                    + " is not supported, delete rules can only be declared on top-level models");
            }
            if (rule == DeleteRule.PULL && !field.list()) {
                throw new ModelDefinitionException("Delete rule PULL on " + field + " requires a List<Ref<T>> field");
            }
            rules.add(new DeleteRuleEntry(information.getType(), field, rule));
        }
    }

    static String toSnakeCase(String name) {
        StringBuilder builder = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && (Character.isLowerCase(name.charAt(i - 1))
                    || (i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1)) && Character.isUpperCase(name.charAt(i - 1))))) {
                    builder.append('_');
                }
                builder.append(Character.toLowerCase(c));
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
