package io.github.flameyossnowy.asyncodm.mongodb.dereference;

import io.github.flameyossnowy.asyncodm.api.BrokenReferencePolicy;
import io.github.flameyossnowy.asyncodm.api.Ref;
import io.github.flameyossnowy.asyncodm.api.exceptions.BrokenReferenceException;
import io.github.flameyossnowy.asyncodm.api.exceptions.OdmException;
import io.github.flameyossnowy.asyncodm.api.exceptions.QueryTranslationException;
import io.github.flameyossnowy.asyncodm.api.reflect.FieldData;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelInformation;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelRegistry;
import io.github.flameyossnowy.asyncodm.api.utils.Logging;
import io.github.flameyossnowy.asyncodm.mongodb.MongoOdm;
import io.github.flameyossnowy.asyncodm.mongodb.collection.FindOptions;
import io.github.flameyossnowy.asyncodm.mongodb.query.QuerySetCursor;
import io.github.flameyossnowy.asyncodm.mongodb.query.QueryTranslator;
import org.bson.Document;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves {@link Ref} fields of already loaded instances.
 * <p>
 * The pending references of all instances of a call are grouped by referenced model and each
 * group is loaded with a single {@code $in} query, so a call costs one lookup per referenced model
 * regardless of the number of instances. The lookups run one after the other. Resolved references
 * replace the unresolved ones in the instances' fields, also inside embedded models and lists.
 * A reference whose target is missing becomes a broken {@link Ref}, or fails the call under
 * {@link BrokenReferencePolicy#STRICT}.
 */
@ApiStatus.Internal
public class Dereferencer {
    private final MongoOdm odm;

    public Dereferencer(@NotNull MongoOdm odm) {
        this.odm = odm;
    }

    /**
     * @param instances model instances, of any registered models
     * @param fields dotted paths of reference fields, or through embedded fields to them; empty for every reference
     * @return the same instances
     */
    public <T> CompletableFuture<List<T>> dereference(@NotNull List<T> instances, @NotNull Collection<String> fields) {
        List<Slot> slots = new ArrayList<>();
        try {
            Set<String> paths = new LinkedHashSet<>(fields);
            for (T instance : instances) {
                if (instance == null) continue;
                collect(instance, ModelRegistry.get(instance.getClass()), paths, slots);
            }
        } catch (OdmException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (slots.isEmpty()) return CompletableFuture.completedFuture(instances);

        Map<Class<?>, Set<Object>> pending = new LinkedHashMap<>();
        for (Slot slot : slots) {
            pending.computeIfAbsent(slot.target(), key -> new LinkedHashSet<>()).add(slot.storedId);
        }

        Map<Class<?>, Map<Object, Object>> loaded = new HashMap<>(pending.size() * 2);
        CompletableFuture<Void> lookups = CompletableFuture.completedFuture(null);
        for (Map.Entry<Class<?>, Set<Object>> entry : pending.entrySet()) {
            lookups = lookups.thenCompose(ignored -> load(entry.getKey(), entry.getValue())
                .thenAccept(found -> loaded.put(entry.getKey(), found)));
        }

        CompletableFuture<Void> all = lookups;
        return odm.execute("dereference", () -> all.thenApply(ignored -> {
            substitute(slots, loaded);
            return instances;
        }));
    }

    /**
     * @return the instance with the given primary key, or {@code null} if there is none
     */
    public <T> CompletableFuture<T> dereferenceId(@NotNull Class<T> type, @NotNull Object id) {
        return odm.execute("dereferenceId", () -> {
            ModelInformation information = ModelRegistry.get(type);
            return odm.collection(information)
                .findOne(new Document("_id", odm.getCodec().encodeValue(id)))
                .thenApply(document -> document == null ? null : odm.getCodec().decode(document, type));
        });
    }

    private CompletableFuture<Map<Object, Object>> load(Class<?> type, Set<Object> ids) {
        ModelInformation information = ModelRegistry.get(type);
        Logging.deepInfo(() -> "Dereferencing " + ids.size() + " " + type.getSimpleName() + " reference(s)");

        FindOptions options = new FindOptions(QueryTranslator.idsFilter(ids), null, null, 0, 0, odm.getSettings().batchSize());
        Map<Object, Object> found = new HashMap<>(ids.size() * 2);
        return QuerySetCursor.of(odm.collection(information).find(options), document -> document)
            .forEach(document -> found.put(document.get("_id"), odm.getCodec().decode(document, type)))
            .thenApply(ignored -> found);
    }

    private void substitute(List<Slot> slots, Map<Class<?>, Map<Object, Object>> loaded) {
        BrokenReferencePolicy policy = odm.getSettings().brokenReferencePolicy();
        if (policy == BrokenReferencePolicy.STRICT) {
            for (Slot slot : slots) {
                if (!loaded.get(slot.target()).containsKey(slot.storedId)) {
                    throw new BrokenReferenceException(slot.target(), slot.ref.id());
                }
            }
        }

        for (Slot slot : slots) {
            Object instance = loaded.get(slot.target()).get(slot.storedId);
            Ref<?> replacement = instance != null ? Ref.of(instance) : Ref.broken(slot.target(), slot.ref.id());
            slot.replace(replacement);
        }
    }

    private void collect(Object holder, ModelInformation information, Set<String> paths, List<Slot> slots) {
        Map<String, Set<String>> selected = select(information, paths);

        for (FieldData<?> field : information.getFields()) {
            Set<String> subPaths = selected == null ? Set.of() : selected.get(field.name());
            if (selected != null && subPaths == null) continue;

            Object value = field.getValue(holder);
            if (value == null) continue;

            if (field.isReference()) {
                if (field.list()) {
                    List<?> list = (List<?>) value;
                    for (int index = 0; index < list.size(); index++) {
                        if (list.get(index) instanceof Ref<?> ref && !ref.isResolved()) {
                            slots.add(new Slot(holder, field, index, ref, odm.getCodec().referenceId(ref)));
                        }
                    }
                } else if (value instanceof Ref<?> ref && !ref.isResolved()) {
                    slots.add(new Slot(holder, field, -1, ref, odm.getCodec().referenceId(ref)));
                }
            } else if (field.isEmbedded()) {
                ModelInformation embedded = ModelRegistry.get(field.valueType());
                if (field.list()) {
                    for (Object element : (List<?>) value) {
                        if (element != null) collect(element, embedded, subPaths, slots);
                    }
                } else {
                    collect(value, embedded, subPaths, slots);
                }
            }
        }
    }

    // field name -> remaining paths below it, or null to select every field
    private static Map<String, Set<String>> select(ModelInformation information, Set<String> paths) {
        if (paths.isEmpty()) return null;

        Map<String, Set<String>> selected = new HashMap<>();
        for (String path : paths) {
            int dot = path.indexOf('.');
            String head = dot < 0 ? path : path.substring(0, dot);
            FieldData<?> field = information.getField(head);
            if (field == null || (!field.isReference() && !field.isEmbedded())) {
                throw new QueryTranslationException("'" + head + "' is not a reference or embedded field of " + information.getType().getSimpleName());
            }

            Set<String> rest = selected.computeIfAbsent(head, key -> new LinkedHashSet<>());
            if (dot >= 0) rest.add(path.substring(dot + 1));
        }
        return selected;
    }

    // a field, or list position, holding an unresolved reference
    private static final class Slot {
        private final Object holder;
        private final FieldData<?> field;
        private final int index;
        private final Ref<?> ref;
        private final Object storedId;

        Slot(Object holder, FieldData<?> field, int index, Ref<?> ref, Object storedId) {
            this.holder = holder;
            this.field = field;
            this.index = index;
            this.ref = ref;
            this.storedId = storedId;
        }

        Class<?> target() {
            return ref.type();
        }

        @SuppressWarnings("unchecked")
        void replace(Ref<?> replacement) {
            if (index < 0) {
                field.setValue(holder, replacement);
                return;
            }

            List<Object> list = field.getValue(holder);
            if (!(list instanceof ArrayList<?>)) {
                list = new ArrayList<>(list);
                field.setValue(holder, list);
            }
            list.set(index, replacement);
        }
    }
}
