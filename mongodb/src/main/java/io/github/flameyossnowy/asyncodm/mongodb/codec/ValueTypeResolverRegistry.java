package io.github.flameyossnowy.asyncodm.mongodb.codec;

import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Type coercions between Java field types and the BSON types they are stored as.
 * <p>
 * Types without a resolver are stored as they are and left to the driver's codecs. Numbers are
 * decoded from any stored {@link Number}, since the server may widen or narrow them.
 */
public class ValueTypeResolverRegistry {
    private final Map<Class<?>, MongoValueTypeResolver<?, ?>> resolvers = new HashMap<>();

    public ValueTypeResolverRegistry() {
        register(Integer.class, Number.class, value -> value, Number::intValue);
        register(int.class, Number.class, value -> value, Number::intValue);

        register(Long.class, Number.class, value -> value, Number::longValue);
        register(long.class, Number.class, value -> value, Number::longValue);

        register(Short.class, Number.class, value -> value, Number::shortValue);
        register(short.class, Number.class, value -> value, Number::shortValue);

        register(Float.class, Number.class, Float::doubleValue, Number::floatValue);
        register(float.class, Number.class, Float::doubleValue, Number::floatValue);

        register(Double.class, Number.class, value -> value, Number::doubleValue);
        register(double.class, Number.class, value -> value, Number::doubleValue);

        register(UUID.class, String.class, UUID::toString, UUID::fromString);

        register(Instant.class, Date.class, Date::from, Date::toInstant);

        register(BigDecimal.class, Decimal128.class, Decimal128::new, Decimal128::bigDecimalValue);

        register(byte[].class, Binary.class, Binary::new, Binary::getData);
    }

    public <E, D> void register(Class<D> type, Class<E> encodedType, Encoder<E, D> encoder, Decoder<E, D> decoder) {
        resolvers.put(type, new DefaultMongoValueTypeResolver<>(encodedType, encoder, decoder));
    }

    public <E, D> void register(Class<D> type, MongoValueTypeResolver<E, D> resolver) {
        resolvers.put(type, resolver);
    }

    public <D> @Nullable MongoValueTypeResolver<?, D> getResolver(@NotNull Class<D> type) {
        Objects.requireNonNull(type);
        @SuppressWarnings("unchecked")
        MongoValueTypeResolver<?, D> resolver = (MongoValueTypeResolver<?, D>) resolvers.get(type);
        return resolver;
    }

    /**
     * Converts a Java value to its stored form. Enums are stored by name.
     * @param value the value
     * @return the stored form, or the value itself if its type has no resolver
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Object encode(Object value) {
        if (value == null) return null;
        if (value instanceof Enum<?> constant) return constant.name();
        MongoValueTypeResolver resolver = resolvers.get(value.getClass());
        return resolver == null ? value : resolver.encode(value);
    }

    /**
     * Converts a stored value to the given Java type.
     * @param type the Java type
     * @param stored the stored value
     * @return the Java value
     * @throws IllegalArgumentException if the stored value cannot be converted
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Object decode(Class<?> type, Object stored) {
        if (stored == null) return null;
        if (type.isEnum()) {
            if (type.isInstance(stored)) return stored;
            return Enum.valueOf((Class<? extends Enum>) type, stored.toString());
        }

        MongoValueTypeResolver resolver = resolvers.get(type);
        if (resolver != null && resolver.encodedType().isInstance(stored)) {
            return resolver.decode(stored);
        }
        if (type.isPrimitive() || type.isInstance(stored) || type == Object.class) return stored;

        throw new IllegalArgumentException("Cannot convert stored " + stored.getClass().getSimpleName() + " to " + type.getSimpleName());
    }

    @FunctionalInterface
    public interface Encoder<E, D> {
        E encode(D value);
    }

    @FunctionalInterface
    public interface Decoder<E, D> {
        D decode(E value);
    }

    private record DefaultMongoValueTypeResolver<E, D>(Class<E> encodedType, Encoder<E, D> encoder, Decoder<E, D> decoder) implements MongoValueTypeResolver<E, D> {
        @Override
        public E encode(D value) {
            return encoder.encode(value);
        }

        @Override
        public D decode(E value) {
            return decoder.decode(value);
        }
    }
}
