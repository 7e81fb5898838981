package io.github.flameyossnowy.asyncodm.mongodb.query;

import io.github.flameyossnowy.asyncodm.api.exceptions.DoesNotExistException;
import io.github.flameyossnowy.asyncodm.api.exceptions.MultipleObjectsReturnedException;
import io.github.flameyossnowy.asyncodm.api.options.FilterOption;
import io.github.flameyossnowy.asyncodm.api.options.QuerySpec;
import io.github.flameyossnowy.asyncodm.api.options.SortOption;
import io.github.flameyossnowy.asyncodm.api.options.SortOrder;
import io.github.flameyossnowy.asyncodm.api.reflect.FieldData;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelInformation;
import io.github.flameyossnowy.asyncodm.mongodb.MongoOdm;
import io.github.flameyossnowy.asyncodm.mongodb.collection.DocumentCollection;
import io.github.flameyossnowy.asyncodm.mongodb.collection.FindOptions;
import org.bson.Document;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A lazily evaluated query over the documents of one model.
 * <p>
 * Fluent methods return a new query set and never touch storage. The terminal methods return
 * futures and issue one or more storage operations each time they are called.
 * <pre>{@code
 * QuerySet<User> adults = odm.objects(User.class).filter("age", ">=", 18).orderBy("name", SortOrder.ASCENDING);
 * long count = adults.count().join();
 * User first = adults.first().join();
 * }</pre>
 * Conditions that name unknown fields and instances that fail validation complete the returned
 * futures exceptionally before any storage operation is issued.
 *
 * @param <T> the model type
 */
public final class QuerySet<T> {
    private final MongoOdm odm;
    private final ModelInformation information;
    private final Class<T> type;
    private final QuerySpec spec;

    @ApiStatus.Internal
    public QuerySet(@NotNull MongoOdm odm, @NotNull ModelInformation information, @NotNull Class<T> type) {
        this(odm, information, type, QuerySpec.empty());
    }

    private QuerySet(MongoOdm odm, ModelInformation information, Class<T> type, QuerySpec spec) {
        this.odm = odm;
        this.information = information;
        this.type = type;
        this.spec = spec;
    }

    private QuerySet<T> with(QuerySpec spec) {
        return new QuerySet<>(odm, information, type, spec);
    }

    public QuerySpec spec() {
        return spec;
    }

    public Class<T> type() {
        return type;
    }

    public QuerySet<T> filter(@NotNull String field, @NotNull String operator, @Nullable Object value) {
        return with(spec.filter(field, operator, value));
    }

    public QuerySet<T> filter(@NotNull String field, @Nullable Object value) {
        return with(spec.filter(field, value));
    }

    public QuerySet<T> filter(@NotNull FilterOption option) {
        return with(spec.filter(option));
    }

    public QuerySet<T> raw(@NotNull Map<String, ?> filter) {
        return with(spec.raw(filter));
    }

    public QuerySet<T> only(@NotNull String... fields) {
        return with(spec.only(fields));
    }

    public QuerySet<T> exclude(@NotNull String... fields) {
        return with(spec.exclude(fields));
    }

    public QuerySet<T> orderBy(@NotNull SortOption... options) {
        return with(spec.orderBy(options));
    }

    public QuerySet<T> orderBy(@NotNull String field, @NotNull SortOrder order) {
        return with(spec.orderBy(field, order));
    }

    public QuerySet<T> skip(int skip) {
        return with(spec.skip(skip));
    }

    public QuerySet<T> limit(int limit) {
        return with(spec.limit(limit));
    }

    /**
     * @return the number of matching documents, after skip and limit
     */
    public CompletableFuture<Long> count() {
        return odm.execute("count", () -> collection().count(filterDocument(), spec.skip(), spec.limit()));
    }

    /**
     * @return the first matching instance in sort order
     * @throws DoesNotExistException (through the future) if nothing matches
     */
    public CompletableFuture<T> first() {
        return odm.execute("first", () -> fetch(spec.limit(1)).thenApply(found -> {
            if (found.isEmpty()) throw new DoesNotExistException(type);
            return found.get(0);
        }));
    }

    /**
     * The only instance whose field equals the value.
     * @throws DoesNotExistException (through the future) if nothing matches
     * @throws MultipleObjectsReturnedException (through the future) if more than one instance matches
     */
    public CompletableFuture<T> get(@NotNull String field, @Nullable Object value) {
        return get(FilterOption.eq(field, value));
    }

    /**
     * The only instance matching the raw filter, combined with this query set's conditions.
     */
    public CompletableFuture<T> get(@NotNull Map<String, ?> rawFilter) {
        return odm.execute("get", () -> {
            Map<String, Object> current = spec.rawFilter();
            QuerySpec query = current == null || current.isEmpty()
                ? spec.raw(rawFilter)
                : spec.raw(Map.of("$and", List.of(current, rawFilter)));
            return getOne(query);
        });
    }

    public CompletableFuture<T> get(@NotNull FilterOption... options) {
        return odm.execute("get", () -> {
            QuerySpec query = spec;
            for (FilterOption option : options) query = query.filter(option);
            return getOne(query);
        });
    }

    private CompletableFuture<T> getOne(QuerySpec query) {
        int limit = query.limit() == 0 ? 2 : Math.min(query.limit(), 2);
        return fetch(query.limit(limit)).thenApply(found -> {
            if (found.isEmpty()) throw new DoesNotExistException(type);
            if (found.size() > 1) throw new MultipleObjectsReturnedException(type);
            return found.get(0);
        });
    }

    /**
     * Issues the query and returns a cursor over its results. Every call issues the query again.
     * @return a cursor owned by the caller, to be closed once done
     */
    public QuerySetCursor<T> iterator() {
        FindOptions options;
        try {
            options = findOptions(spec);
        } catch (RuntimeException e) {
            return QuerySetCursor.failed(e);
        }
        return QuerySetCursor.of(collection().find(options), document -> odm.getCodec().decode(document, type));
    }

    public CompletableFuture<List<T>> toList() {
        return toList(false);
    }

    /**
     * @param dereference resolve the references of every result, with one lookup per referenced model
     * @return every matching instance
     */
    public CompletableFuture<List<T>> toList(boolean dereference) {
        return odm.execute("toList", () -> {
            CompletableFuture<List<T>> found = fetch(spec);
            if (!dereference) return found;
            return found.thenCompose(instances -> odm.dereference(instances, List.of()));
        });
    }

    /**
     * @return the matching documents as stored, without decoding
     */
    public CompletableFuture<List<Document>> values() {
        return odm.execute("values", () -> QuerySetCursor.of(collection().find(findOptions(spec)), document -> document).toList());
    }

    /**
     * @param index the position among the matching instances, in sort order
     * @return the instance at the position
     * @throws IndexOutOfBoundsException (through the future) if fewer instances match
     */
    public CompletableFuture<T> at(int index) {
        return odm.execute("at", () -> {
            if (index < 0) throw new IllegalArgumentException("Index cannot be negative: " + index);
            if (spec.limit() != 0 && index >= spec.limit()) {
                return CompletableFuture.failedFuture(new IndexOutOfBoundsException("Index " + index + " is beyond the limit " + spec.limit()));
            }
            return fetch(spec.skip(spec.skip() + index).limit(1)).thenApply(found -> {
                if (found.isEmpty()) throw new IndexOutOfBoundsException("No " + type.getSimpleName() + " at index " + index);
                return found.get(0);
            });
        });
    }

    /**
     * @param from the first position, inclusive
     * @param to the last position, exclusive
     * @return the instances between the positions, fewer if fewer match
     */
    public CompletableFuture<List<T>> slice(int from, int to) {
        return odm.execute("slice", () -> {
            if (from < 0 || to < from) throw new IllegalArgumentException("Invalid slice [" + from + ", " + to + ")");
            int size = to - from;
            if (spec.limit() != 0) size = Math.min(size, spec.limit() - from);
            if (size <= 0) return CompletableFuture.completedFuture(List.of());
            return fetch(spec.skip(spec.skip() + from).limit(size));
        });
    }

    /**
     * Applies update operators, such as {@code Map.of("$set", Map.of("name", "B"))}, to every
     * matching document.
     * @return the number of modified documents
     */
    public CompletableFuture<Long> update(@NotNull Map<String, ?> modifications) {
        return update(modifications, false);
    }

    /**
     * @param upsert insert a document built from the conditions and the update if nothing matches
     * @return the number of modified documents, counting an upserted one
     */
    public CompletableFuture<Long> update(@NotNull Map<String, ?> modifications, boolean upsert) {
        return odm.execute("update", () -> {
            Document update = odm.getTranslator().update(information, modifications);
            if (spec.skip() == 0 && spec.limit() == 0) {
                return collection().updateMany(filterDocument(), update, upsert);
            }
            return ids().thenCompose(ids -> ids.isEmpty()
                ? CompletableFuture.completedFuture(0L)
                : collection().updateMany(QueryTranslator.idsFilter(ids), update, upsert));
        });
    }

    /**
     * Deletes every matching document, applying the delete rules declared on references to this model.
     * @return the number of deleted documents of this model
     */
    public CompletableFuture<Long> delete() {
        return odm.execute("delete", () -> {
            Document filter = filterDocument();
            if (information.getDeleteRules().isEmpty() && spec.skip() == 0 && spec.limit() == 0) {
                return collection().deleteMany(filter);
            }
            return ids().thenCompose(ids -> DeleteRules.deleteWithRules(odm, information, ids));
        });
    }

    /**
     * Inserts the instances in one batch. Every instance is validated before anything is sent.
     * Generated primary keys are written back into the instances.
     * @return the instances, in submission order
     */
    public CompletableFuture<List<T>> bulkCreate(@NotNull List<T> instances) {
        return odm.execute("bulkCreate", () -> {
            if (instances.isEmpty()) return CompletableFuture.completedFuture(List.of());

            List<Document> documents = new ArrayList<>(instances.size());
            for (T instance : instances) {
                if (!type.isInstance(instance)) {
                    throw new IllegalArgumentException("Cannot insert " + instance.getClass().getSimpleName() + " into the collection of " + type.getSimpleName());
                }
                documents.add(odm.getCodec().encode(instance));
            }

            FieldData<?> primaryKey = information.getPrimaryKey();
            return collection().insertMany(documents).thenApply(ids -> {
                for (int i = 0; i < instances.size(); i++) {
                    primaryKey.setValue(instances.get(i), odm.getCodec().getResolvers().decode(primaryKey.type(), ids.get(i)));
                }
                return instances;
            });
        });
    }

    /**
     * Inserts the instances like {@link #bulkCreate(List)}, then loads them back from storage.
     * @return freshly decoded instances, in submission order
     */
    public CompletableFuture<List<T>> bulkCreateAndRetrieve(@NotNull List<T> instances) {
        return bulkCreate(instances).thenCompose(created -> {
            if (created.isEmpty()) return CompletableFuture.completedFuture(List.<T>of());

            FieldData<?> primaryKey = information.getPrimaryKey();
            List<Object> ids = new ArrayList<>(created.size());
            for (T instance : created) ids.add(odm.getCodec().encodeValue(primaryKey.getValue(instance)));

            return odm.execute("bulkCreateAndRetrieve", () -> QuerySetCursor.of(
                collection().find(FindOptions.of(QueryTranslator.idsFilter(ids))), document -> document
            ).toList().thenApply(documents -> {
                Map<Object, Document> byId = new HashMap<>(documents.size() * 2);
                for (Document document : documents) byId.put(document.get("_id"), document);

                List<T> retrieved = new ArrayList<>(ids.size());
                for (Object id : ids) {
                    Document document = byId.get(id);
                    if (document != null) retrieved.add(odm.getCodec().decode(document, type));
                }
                return retrieved;
            }));
        });
    }

    /**
     * Creates the indexes declared on the model. Creating an existing index again has no effect.
     * @return the names of the declared indexes
     */
    public CompletableFuture<List<String>> createIndexes() {
        return odm.execute("createIndexes", () -> collection().createIndexes(odm.getTranslator().indexModels(information)));
    }

    /**
     * Runs an aggregation whose first stages apply this query set's filter, projection, sort,
     * skip and limit.
     * @param stages the further pipeline stages, in stored field names
     * @return the documents the pipeline produced
     */
    @SafeVarargs
    public final CompletableFuture<List<Document>> aggregate(@NotNull Map<String, ?>... stages) {
        return odm.execute("aggregate", () -> {
            QueryTranslator translator = odm.getTranslator();
            List<Document> pipeline = new ArrayList<>(stages.length + 5);

            Document filter = filterDocument();
            if (!filter.isEmpty()) pipeline.add(new Document("$match", filter));
            Document projection = translator.projection(information, spec);
            if (projection != null) pipeline.add(new Document("$project", projection));
            Document sort = translator.sort(information, spec);
            if (sort != null) pipeline.add(new Document("$sort", sort));
            if (spec.skip() > 0) pipeline.add(new Document("$skip", spec.skip()));
            if (spec.limit() > 0) pipeline.add(new Document("$limit", spec.limit()));

            for (Map<String, ?> stage : stages) {
                Document document = new Document();
                document.putAll(stage);
                pipeline.add(document);
            }
            return collection().aggregate(pipeline);
        });
    }

    private CompletableFuture<List<T>> fetch(QuerySpec query) {
        return QuerySetCursor.of(collection().find(findOptions(query)), document -> odm.getCodec().decode(document, type)).toList();
    }

    // primary keys of the matching documents, honouring sort, skip and limit
    private CompletableFuture<List<Object>> ids() {
        FindOptions options = findOptions(spec);
        FindOptions idsOnly = new FindOptions(options.filter(), new Document("_id", 1), options.sort(),
            options.skip(), options.limit(), options.batchSize());

        List<Object> ids = new ArrayList<>();
        return QuerySetCursor.of(collection().find(idsOnly), document -> document.get("_id"))
            .forEach(ids::add)
            .thenApply(ignored -> ids);
    }

    private Document filterDocument() {
        return odm.getTranslator().filter(information, spec);
    }

    private FindOptions findOptions(QuerySpec query) {
        QueryTranslator translator = odm.getTranslator();
        return new FindOptions(
            translator.filter(information, query),
            translator.projection(information, query),
            translator.sort(information, query),
            query.skip(),
            query.limit(),
            odm.getSettings().batchSize()
        );
    }

    private DocumentCollection collection() {
        return odm.collection(information);
    }

    @Override
    public String toString() {
        return "QuerySet{" + type.getSimpleName() + ", " + spec + '}';
    }
}
