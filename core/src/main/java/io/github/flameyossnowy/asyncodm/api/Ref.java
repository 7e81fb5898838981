package io.github.flameyossnowy.asyncodm.api;

import io.github.flameyossnowy.asyncodm.api.exceptions.BrokenReferenceException;
import io.github.flameyossnowy.asyncodm.api.reflect.ModelRegistry;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * The value of a reference field: a non-owning pointer to another top-level model's document.
 * <p>
 * A decoded reference only holds the primary key of its target. It is resolved into a model
 * instance on demand, by dereferencing, never implicitly:
 * <pre>{@code
 * Post post = odm.objects(Post.class).get("title", "T").get();
 * post.getAuthor().id();          // "a@x.com"
 * odm.dereference(post).get();
 * post.getAuthor().get().getName(); // "A"
 * }</pre>
 * Two references are equal when they point at the same model type and primary key, whether
 * they are resolved or not.
 *
 * @param <T> the referenced model type
 */
public final class Ref<T> {
    private final Class<T> type;
    private final Object id;
    private final T value;
    private final boolean broken;

    private Ref(Class<T> type, Object id, T value, boolean broken) {
        this.type = type;
        this.id = id;
        this.value = value;
        this.broken = broken;
    }

    /**
     * Creates a resolved reference to the given instance. Its identifier is read from the
     * instance every time, so the instance may be saved after the reference is created.
     * @param instance the referenced instance
     * @return the reference
     */
    @SuppressWarnings("unchecked")
    @Contract("_ -> new")
    public static <T> @NotNull Ref<T> of(@NotNull T instance) {
        Objects.requireNonNull(instance, "instance");
        return new Ref<>((Class<T>) instance.getClass(), null, instance, false);
    }

    /**
     * Creates an unresolved reference holding only the primary key of its target.
     * @param type the referenced model type
     * @param id the primary key of the referenced document
     * @return the reference
     */
    @Contract("_, _ -> new")
    public static <T> @NotNull Ref<T> id(@NotNull Class<T> type, @NotNull Object id) {
        return new Ref<>(Objects.requireNonNull(type, "type"), Objects.requireNonNull(id, "id"), null, false);
    }

    /**
     * Creates a reference whose target was looked up and not found.
     * @param type the referenced model type
     * @param id the primary key that has no document
     * @return the broken reference
     */
    @Contract("_, _ -> new")
    public static <T> @NotNull Ref<T> broken(@NotNull Class<T> type, @NotNull Object id) {
        return new Ref<>(type, id, null, true);
    }

    public @NotNull Class<T> type() {
        return type;
    }

    /**
     * The primary key of the referenced document.
     * @return the primary key, or {@code null} for a resolved reference to an unsaved instance
     */
    public @Nullable Object id() {
        if (value == null) return id;
        return ModelRegistry.get(type).getPrimaryKey().getValue(value);
    }

    public boolean isResolved() {
        return value != null;
    }

    public boolean isBroken() {
        return broken;
    }

    /**
     * The referenced instance.
     * @return the instance
     * @throws IllegalStateException if the reference has not been dereferenced
     * @throws BrokenReferenceException if the reference has no target
     */
    public @NotNull T get() {
        if (value != null) return value;
        if (broken) throw new BrokenReferenceException(type, id);
        throw new IllegalStateException("Reference to " + type.getSimpleName() + " with id " + id + " has not been dereferenced");
    }

    public @NotNull Optional<T> getIfResolved() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ref<?> other)) return false;
        return type.equals(other.type) && Objects.equals(id(), other.id());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id());
    }

    @Override
    public String toString() {
        String state = value != null ? "resolved" : broken ? "broken" : "unresolved";
        return "Ref{" + type.getSimpleName() + "#" + id() + ", " + state + '}';
    }
}
