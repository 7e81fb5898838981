package io.github.flameyossnowy.asyncodm.mongodb.collection;

/**
 * Looks up collections by name.
 */
@FunctionalInterface
public interface CollectionProvider {
    DocumentCollection getCollection(String name);
}
