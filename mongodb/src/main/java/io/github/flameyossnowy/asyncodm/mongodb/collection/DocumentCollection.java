package io.github.flameyossnowy.asyncodm.mongodb.collection;

import com.mongodb.client.model.IndexModel;
import org.bson.Document;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The storage operations the mapper needs from one collection.
 * <p>
 * Every document argument uses stored field names. Failures of the storage driver complete the
 * returned futures exceptionally with the driver's exception.
 */
public interface DocumentCollection {
    String name();

    DocumentCursor find(FindOptions options);

    CompletableFuture<Document> findOne(Document filter);

    /**
     * @param skip the number of matching documents to skip
     * @param limit the maximum count, {@code 0} for none
     * @return the number of matching documents after skip and limit
     */
    CompletableFuture<Long> count(Document filter, int skip, int limit);

    /**
     * @return the primary key of the inserted document, generated if the document had none
     */
    CompletableFuture<Object> insertOne(Document document);

    /**
     * Inserts the documents in one ordered batch.
     * @return the primary keys of the inserted documents, in submission order
     */
    CompletableFuture<List<Object>> insertMany(List<Document> documents);

    /**
     * @return {@code true} if a document was replaced or inserted
     */
    CompletableFuture<Boolean> replaceOne(Document filter, Document replacement, boolean upsert);

    /**
     * @return the number of modified documents, counting an upserted one
     */
    CompletableFuture<Long> updateMany(Document filter, Document update, boolean upsert);

    /**
     * @return the number of deleted documents
     */
    CompletableFuture<Long> deleteMany(Document filter);

    CompletableFuture<List<Document>> aggregate(List<Document> pipeline);

    /**
     * @return the names of the indexes, created or already present
     */
    CompletableFuture<List<String>> createIndexes(List<IndexModel> indexes);
}
