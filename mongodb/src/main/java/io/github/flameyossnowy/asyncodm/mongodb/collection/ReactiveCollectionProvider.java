package io.github.flameyossnowy.asyncodm.mongodb.collection;

import com.mongodb.reactivestreams.client.MongoDatabase;
import org.bson.Document;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provides the collections of one database of the reactive streams driver.
 */
public class ReactiveCollectionProvider implements CollectionProvider {
    private final MongoDatabase database;
    private final Map<String, DocumentCollection> collections = new ConcurrentHashMap<>(4);

    public ReactiveCollectionProvider(@NotNull MongoDatabase database) {
        this.database = database;
    }

    @Override
    public DocumentCollection getCollection(String name) {
        return collections.computeIfAbsent(name, key -> new ReactiveDocumentCollection(database.getCollection(key, Document.class)));
    }
}
