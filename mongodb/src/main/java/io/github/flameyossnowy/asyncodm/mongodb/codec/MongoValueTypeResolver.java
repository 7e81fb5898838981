package io.github.flameyossnowy.asyncodm.mongodb.codec;

/**
 * Converts a Java value type to and from the type it is stored as.
 * @param <E> the stored type
 * @param <D> the Java type
 */
public interface MongoValueTypeResolver<E, D> {
    E encode(D decoded);

    D decode(E encoded);

    Class<E> encodedType();
}
