package io.github.flameyossnowy.asyncodm.mongodb;

import com.mongodb.reactivestreams.client.MongoClient;
import io.github.flameyossnowy.asyncodm.api.OdmSettings;
import io.github.flameyossnowy.asyncodm.api.exceptions.DoesNotExistException;
import io.github.flameyossnowy.asyncodm.api.exceptions.OdmException;
import io.github.flameyossnowy.asyncodm.api.exceptions.OperationException;
import io.github.flameyossnowy.asyncodm.api.exceptions.QueryTranslationException;
import io.github.flameyossnowy.asyncodm.api.reflect.FieldData;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelInformation;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelRegistry;
import io.github.flameyossnowy.asyncodm.api.utils.Logging;
import io.github.flameyossnowy.asyncodm.mongodb.codec.DocumentCodec;
import io.github.flameyossnowy.asyncodm.mongodb.codec.ValueTypeResolverRegistry;
import io.github.flameyossnowy.asyncodm.mongodb.collection.CollectionProvider;
import io.github.flameyossnowy.asyncodm.mongodb.collection.DocumentCollection;
import io.github.flameyossnowy.asyncodm.mongodb.dereference.Dereferencer;
import io.github.flameyossnowy.asyncodm.mongodb.query.QuerySet;
import io.github.flameyossnowy.asyncodm.mongodb.query.QueryTranslator;
import org.bson.Document;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Entry point of the mapper: query sets, instance operations and dereferencing over one database.
 * <pre>{@code
 * ModelRegistry.register(User.class, Post.class);
 * MongoOdm odm = MongoOdm.builder()
 *     .withConnectionString("mongodb://localhost:27017")
 *     .setDatabase("blog")
 *     .build();
 *
 * User user = new User("a@x.com", "A");
 * odm.save(user).join();
 * List<Post> posts = odm.objects(Post.class).filter("author", user).toList(true).join();
 * }</pre>
 * Closing the mapper closes the client it created or was given.
 */
public class MongoOdm implements AutoCloseable {
    private final MongoClient client;
    private final CollectionProvider collections;
    private final OdmSettings settings;
    private final DocumentCodec codec;
    private final QueryTranslator translator;
    private final Dereferencer dereferencer;

    MongoOdm(@Nullable MongoClient client, @NotNull CollectionProvider collections,
             @NotNull OdmSettings settings, @NotNull ValueTypeResolverRegistry resolvers) {
        this.client = client;
        this.collections = collections;
        this.settings = settings;
        this.codec = new DocumentCodec(resolvers, settings.unknownFieldPolicy());
        this.translator = new QueryTranslator(codec);
        this.dereferencer = new Dereferencer(this);
    }

    @Contract(" -> new")
    public static @NotNull MongoOdmBuilder builder() {
        return new MongoOdmBuilder();
    }

    /**
     * The query set over every document of a top-level model.
     * @param type a registered top-level model
     * @return the query set
     * @throws IllegalArgumentException if the model is not registered or is embedded
     */
    public <T> @NotNull QuerySet<T> objects(@NotNull Class<T> type) {
        ModelInformation information = ModelRegistry.get(type);
        if (information.isEmbedded()) {
            throw new IllegalArgumentException("Embedded model " + type.getSimpleName() + " has no collection");
        }
        return new QuerySet<>(this, information, type);
    }

    /**
     * Inserts the instance if its primary key is unset, otherwise replaces the stored document
     * with the same primary key, inserting it if there is none. A generated primary key is
     * written back into the instance.
     * @param instance the instance to save
     * @return the saved instance
     */
    public <T> CompletableFuture<T> save(@NotNull T instance) {
        return save(instance, false);
    }

    /**
     * @param instance the instance to save
     * @param forceInsert always insert, failing with the driver's duplicate key error if a
     *                    document with the same primary key exists
     * @return the saved instance
     */
    public <T> CompletableFuture<T> save(@NotNull T instance, boolean forceInsert) {
        return execute("save", () -> {
            ModelInformation information = topLevel(instance.getClass());
            FieldData<?> primaryKey = information.getPrimaryKey();
            Document document = codec.encode(instance);
            DocumentCollection collection = collection(information);

            Object id = document.get("_id");
            if (id == null || forceInsert) {
                return collection.insertOne(document).thenApply(generated -> {
                    primaryKey.setValue(instance, codec.getResolvers().decode(primaryKey.type(), generated));
                    return instance;
                });
            }
            return collection.replaceOne(new Document("_id", id), document, true).thenApply(ignored -> instance);
        });
    }

    /**
     * Deletes the stored document of the instance, applying the delete rules declared on
     * references to its model.
     * @return the number of deleted documents of the instance's model
     */
    public CompletableFuture<Long> delete(@NotNull Object instance) {
        Object id;
        try {
            id = requirePrimaryKey(instance, "delete");
        } catch (OdmException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return objects(instance.getClass()).filter("pk", id).delete();
    }

    /**
     * Reloads fields of the instance from its stored document. Fields missing from the stored
     * document become {@code null}.
     * @param instance a saved instance
     * @param fields the Java field names to reload, none for every field
     * @return the instance
     */
    public <T> CompletableFuture<T> refreshFromDb(@NotNull T instance, @NotNull String... fields) {
        return execute("refreshFromDb", () -> {
            ModelInformation information = topLevel(instance.getClass());
            Object id = codec.encodeValue(requirePrimaryKey(instance, "refresh"));
            for (String field : fields) {
                if (information.getField(field) == null) {
                    throw new QueryTranslationException("Unknown field '" + field + "' for model " + information.getType().getSimpleName());
                }
            }

            return collection(information).findOne(new Document("_id", id)).thenApply(document -> {
                if (document == null) throw new DoesNotExistException(information.getType());
                codec.decodeInto(document, instance, Set.of(fields));
                return instance;
            });
        });
    }

    /**
     * Resolves the unresolved references of the instance with one lookup per referenced model.
     * @param fields dotted paths of the reference fields to resolve, none for every reference
     * @return the instance, with resolved references
     */
    public <T> CompletableFuture<T> dereference(@NotNull T instance, @NotNull String... fields) {
        return dereferencer.dereference(List.of(instance), List.of(fields)).thenApply(ignored -> instance);
    }

    public <T> CompletableFuture<List<T>> dereference(@NotNull List<T> instances, @NotNull Collection<String> fields) {
        return dereferencer.dereference(instances, fields);
    }

    /**
     * Loads one instance by primary key.
     * @return the instance, or {@code null} if there is no such document
     */
    public <T> CompletableFuture<T> dereferenceId(@NotNull Class<T> type, @NotNull Object id) {
        return dereferencer.dereferenceId(type, id);
    }

    private Object requirePrimaryKey(Object instance, String operation) {
        Object id = topLevel(instance.getClass()).getPrimaryKey().getValue(instance);
        if (id == null) {
            throw new OperationException("Cannot " + operation + " " + instance.getClass().getSimpleName() + ", it has not been saved yet");
        }
        return id;
    }

    private static ModelInformation topLevel(Class<?> type) {
        ModelInformation information = ModelRegistry.get(type);
        if (information.isEmbedded()) {
            throw new IllegalArgumentException("Embedded model " + type.getSimpleName() + " cannot be stored on its own");
        }
        return information;
    }

    /**
     * Runs a storage operation. Failures detected before I/O become failed futures; storage
     * failures are logged and passed on as the driver raised them.
     */
    @ApiStatus.Internal
    public <R> CompletableFuture<R> execute(String operation, Supplier<CompletableFuture<R>> action) {
        CompletableFuture<R> future;
        try {
            future = action.get();
        } catch (OdmException | IllegalArgumentException | IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((result, error) -> {
            if (error == null) return;
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (!(cause instanceof OdmException)) Logging.error("Storage operation " + operation + " failed", cause);
        });
    }

    @ApiStatus.Internal
    public DocumentCollection collection(@NotNull ModelInformation information) {
        return collections.getCollection(information.getCollectionName());
    }

    public DocumentCollection collection(@NotNull Class<?> type) {
        return collection(topLevel(type));
    }

    public DocumentCodec getCodec() {
        return codec;
    }

    public QueryTranslator getTranslator() {
        return translator;
    }

    public OdmSettings getSettings() {
        return settings;
    }

    @Override
    public void close() {
        if (client != null) client.close();
    }
}
