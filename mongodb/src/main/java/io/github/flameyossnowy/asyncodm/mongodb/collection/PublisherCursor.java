package io.github.flameyossnowy.asyncodm.mongodb.collection;

import org.bson.Document;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Pulls documents from a publisher one demand at a time.
 * <p>
 * The publisher is subscribed by the first {@link #next()} call and one document is requested per
 * call, so nothing is read ahead of the consumer beyond what the driver batches.
 */
final class PublisherCursor extends BaseSubscriber<Document> implements DocumentCursor {
    private final Publisher<Document> publisher;
    private final Object lock = new Object();
    private final Deque<Document> buffer = new ArrayDeque<>(1);

    private CompletableFuture<Optional<Document>> pending;
    private boolean started;
    private boolean done;
    private Throwable error;

    PublisherCursor(Publisher<Document> publisher) {
        this.publisher = publisher;
    }

    @Override
    public CompletableFuture<Optional<Document>> next() {
        CompletableFuture<Optional<Document>> future;
        boolean subscribe = false;
        synchronized (lock) {
            if (pending != null) {
                return CompletableFuture.failedFuture(new IllegalStateException("The previous next() has not completed yet"));
            }
            if (!buffer.isEmpty()) return CompletableFuture.completedFuture(Optional.of(buffer.poll()));
            if (error != null) return CompletableFuture.failedFuture(error);
            if (done) return CompletableFuture.completedFuture(Optional.empty());

            future = pending = new CompletableFuture<>();
            if (!started) {
                started = true;
                subscribe = true;
            }
        }

        if (subscribe) publisher.subscribe(this);
        else request(1);
        return future;
    }

    @Override
    protected void hookOnSubscribe(Subscription subscription) {
        boolean demand;
        synchronized (lock) {
            demand = pending != null;
        }
        if (demand) request(1);
    }

    @Override
    protected void hookOnNext(Document document) {
        CompletableFuture<Optional<Document>> future;
        synchronized (lock) {
            future = pending;
            pending = null;
            if (future == null) buffer.add(document);
        }
        if (future != null) future.complete(Optional.of(document));
    }

    @Override
    protected void hookOnComplete() {
        finish(null);
    }

    @Override
    protected void hookOnError(Throwable throwable) {
        finish(throwable);
    }

    @Override
    protected void hookOnCancel() {
        finish(null);
    }

    private void finish(Throwable throwable) {
        CompletableFuture<Optional<Document>> future;
        synchronized (lock) {
            if (done) return;
            done = true;
            error = throwable;
            future = pending;
            pending = null;
        }
        if (future == null) return;
        if (throwable != null) future.completeExceptionally(throwable);
        else future.complete(Optional.empty());
    }

    @Override
    public void close() {
        synchronized (lock) {
            started = true;
        }
        dispose();
        finish(null);
    }
}
