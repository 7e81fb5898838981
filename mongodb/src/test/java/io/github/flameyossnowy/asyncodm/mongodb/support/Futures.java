package io.github.flameyossnowy.asyncodm.mongodb.support;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.fail;

public final class Futures {
    private Futures() {}

    /**
     * Waits for the future, rethrowing its failure as it was raised.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (InterruptedException | TimeoutException e) {
            throw new AssertionError("Future did not complete", e);
        }
    }

    /**
     * @return the exception the future failed with
     */
    public static Throwable failure(CompletableFuture<?> future) {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return unwrap(e.getCause());
        } catch (InterruptedException | TimeoutException e) {
            throw new AssertionError("Future did not complete", e);
        }
        return fail("Expected the future to fail");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) current = current.getCause();
        return current;
    }

    private static RuntimeException rethrow(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RuntimeException runtime) return runtime;
        if (cause instanceof Error err) throw err;
        return new CompletionException(cause);
    }
}
