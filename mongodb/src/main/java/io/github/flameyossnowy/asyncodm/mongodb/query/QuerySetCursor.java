package io.github.flameyossnowy.asyncodm.mongodb.query;

import io.github.flameyossnowy.asyncodm.mongodb.collection.DocumentCursor;
import org.bson.Document;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A lazy, single-pass cursor over the results of a query set.
 * <pre>{@code
 * try (QuerySetCursor<User> cursor = odm.objects(User.class).iterator()) {
 *     cursor.forEach(user -> System.out.println(user.getName())).join();
 * }
 * }</pre>
 * A cursor has exactly one owner; {@link #next()} must not be called again before the
 * previous call completed.
 *
 * @param <T> the element type
 */
public final class QuerySetCursor<T> implements AutoCloseable {
    private final DocumentCursor cursor;
    private final Function<Document, T> decoder;
    private final Throwable failure;

    private QuerySetCursor(DocumentCursor cursor, Function<Document, T> decoder, Throwable failure) {
        this.cursor = cursor;
        this.decoder = decoder;
        this.failure = failure;
    }

    @ApiStatus.Internal
    public static <T> @NotNull QuerySetCursor<T> of(@NotNull DocumentCursor cursor, @NotNull Function<Document, T> decoder) {
        return new QuerySetCursor<>(cursor, decoder, null);
    }

    // a cursor for a query that could not be issued, every call fails with the cause
    static <T> @NotNull QuerySetCursor<T> failed(@NotNull Throwable failure) {
        return new QuerySetCursor<>(null, null, failure);
    }

    /**
     * @return the next element, or an empty optional at the end of the results
     */
    public CompletableFuture<Optional<T>> next() {
        if (failure != null) return CompletableFuture.failedFuture(failure);
        return cursor.next().thenApply(document -> document.map(decoder));
    }

    /**
     * Consumes every remaining element, then closes the cursor.
     * @param action called once per element, in order
     * @return a future completed once the cursor is exhausted
     */
    public CompletableFuture<Void> forEach(@NotNull Consumer<? super T> action) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        step(action, done);
        return done.whenComplete((ignored, error) -> close());
    }

    /**
     * Consumes every remaining element into a list, then closes the cursor.
     * @return the remaining elements
     */
    public CompletableFuture<List<T>> toList() {
        List<T> elements = new ArrayList<>();
        return forEach(elements::add).thenApply(ignored -> elements);
    }

    // Loops while next() completes synchronously, so that buffered results do not grow the stack.
    private void step(Consumer<? super T> action, CompletableFuture<Void> done) {
        while (true) {
            CompletableFuture<Optional<T>> next;
            try {
                next = next();
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
                return;
            }

            if (next.isDone() && !next.isCompletedExceptionally()) {
                Optional<T> element = next.join();
                if (element.isEmpty()) {
                    done.complete(null);
                    return;
                }
                if (!accept(action, element.get(), done)) return;
                continue;
            }

            next.whenComplete((element, error) -> {
                if (error != null) done.completeExceptionally(error);
                else if (element.isEmpty()) done.complete(null);
                else if (accept(action, element.get(), done)) step(action, done);
            });
            return;
        }
    }

    private static <T> boolean accept(Consumer<? super T> action, T element, CompletableFuture<Void> done) {
        try {
            action.accept(element);
            return true;
        } catch (RuntimeException e) {
            done.completeExceptionally(e);
            return false;
        }
    }

    @Override
    public void close() {
        if (cursor != null) cursor.close();
    }
}
