package io.github.flameyossnowy.asyncodm.mongodb.collection;

import org.bson.Document;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A single-pass cursor over stored documents. A cursor has one owner and must not be advanced
 * concurrently.
 */
public interface DocumentCursor extends AutoCloseable {
    /**
     * @return the next document, or an empty optional once the cursor is exhausted
     */
    CompletableFuture<Optional<Document>> next();

    /**
     * Releases the server-side cursor. Pending and later calls to {@link #next()} see the end.
     */
    @Override
    void close();
}
