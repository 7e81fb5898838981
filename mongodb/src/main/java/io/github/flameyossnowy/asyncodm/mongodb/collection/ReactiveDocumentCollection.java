package io.github.flameyossnowy.asyncodm.mongodb.collection;

import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.IndexModel;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.reactivestreams.client.FindPublisher;
import com.mongodb.reactivestreams.client.MongoCollection;
import io.github.flameyossnowy.asyncodm.api.utils.Logging;
import org.bson.Document;
import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A {@link DocumentCollection} backed by the reactive streams driver.
 */
public class ReactiveDocumentCollection implements DocumentCollection {
    private final MongoCollection<Document> collection;

    public ReactiveDocumentCollection(@NotNull MongoCollection<Document> collection) {
        this.collection = collection;
    }

    @Override
    public String name() {
        return collection.getNamespace().getCollectionName();
    }

    @Override
    public DocumentCursor find(FindOptions options) {
        Logging.deepInfo(() -> "find on " + name() + ": " + options);
        FindPublisher<Document> publisher = collection.find(options.filter());
        if (options.projection() != null) publisher = publisher.projection(options.projection());
        if (options.sort() != null) publisher = publisher.sort(options.sort());
        if (options.skip() > 0) publisher = publisher.skip(options.skip());
        if (options.limit() > 0) publisher = publisher.limit(options.limit());
        if (options.batchSize() > 0) publisher = publisher.batchSize(options.batchSize());
        return new PublisherCursor(publisher);
    }

    @Override
    public CompletableFuture<Document> findOne(Document filter) {
        Logging.deepInfo(() -> "findOne on " + name() + ": " + filter.toJson());
        return Mono.from(collection.find(filter).first()).toFuture();
    }

    @Override
    public CompletableFuture<Long> count(Document filter, int skip, int limit) {
        Logging.deepInfo(() -> "count on " + name() + ": " + filter.toJson());
        CountOptions options = new CountOptions();
        if (skip > 0) options.skip(skip);
        if (limit > 0) options.limit(limit);
        return Mono.from(collection.countDocuments(filter, options)).toFuture();
    }

    @Override
    public CompletableFuture<Object> insertOne(Document document) {
        Logging.deepInfo(() -> "insertOne on " + name());
        // the driver adds a generated _id to the document itself
        return Mono.from(collection.insertOne(document))
            .map(result -> document.get("_id"))
            .toFuture();
    }

    @Override
    public CompletableFuture<List<Object>> insertMany(List<Document> documents) {
        Logging.deepInfo(() -> "insertMany on " + name() + ": " + documents.size() + " documents");
        return Mono.from(collection.insertMany(documents))
            .map(result -> {
                List<Object> ids = new ArrayList<>(documents.size());
                for (Document document : documents) ids.add(document.get("_id"));
                return ids;
            })
            .toFuture();
    }

    @Override
    public CompletableFuture<Boolean> replaceOne(Document filter, Document replacement, boolean upsert) {
        Logging.deepInfo(() -> "replaceOne on " + name() + ": " + filter.toJson());
        return Mono.from(collection.replaceOne(filter, replacement, new ReplaceOptions().upsert(upsert)))
            .map(result -> result.getMatchedCount() > 0 || result.getUpsertedId() != null)
            .toFuture();
    }

    @Override
    public CompletableFuture<Long> updateMany(Document filter, Document update, boolean upsert) {
        Logging.deepInfo(() -> "updateMany on " + name() + ": " + filter.toJson() + " -> " + update.toJson());
        return Mono.from(collection.updateMany(filter, update, new UpdateOptions().upsert(upsert)))
            .map(result -> result.getModifiedCount() + (result.getUpsertedId() != null ? 1 : 0))
            .toFuture();
    }

    @Override
    public CompletableFuture<Long> deleteMany(Document filter) {
        Logging.deepInfo(() -> "deleteMany on " + name() + ": " + filter.toJson());
        return Mono.from(collection.deleteMany(filter))
            .map(result -> result.getDeletedCount())
            .toFuture();
    }

    @Override
    public CompletableFuture<List<Document>> aggregate(List<Document> pipeline) {
        Logging.deepInfo(() -> "aggregate on " + name() + ": " + pipeline);
        return Flux.from(collection.aggregate(pipeline)).collectList().toFuture();
    }

    @Override
    public CompletableFuture<List<String>> createIndexes(List<IndexModel> indexes) {
        if (indexes.isEmpty()) return CompletableFuture.completedFuture(List.of());
        Logging.deepInfo(() -> "createIndexes on " + name() + ": " + indexes.size() + " indexes");
        return Flux.from(collection.createIndexes(indexes)).collectList().toFuture();
    }
}
