package io.github.flameyossnowy.asyncodm.mongodb.collection;

import org.bson.Document;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The arguments of a find operation, in stored field names.
 * @param filter the filter document
 * @param projection the projection document, or {@code null} for whole documents
 * @param sort the sort document, or {@code null} for natural order
 * @param skip the number of documents to skip
 * @param limit the maximum number of documents, {@code 0} for no limit
 * @param batchSize the cursor batch size, {@code 0} for the driver's default
 */
public record FindOptions(Document filter, @Nullable Document projection, @Nullable Document sort, int skip, int limit, int batchSize) {
    public FindOptions {
        Objects.requireNonNull(filter, "filter");
    }

    public static FindOptions of(Document filter) {
        return new FindOptions(filter, null, null, 0, 0, 0);
    }

    public FindOptions withLimit(int limit) {
        return new FindOptions(filter, projection, sort, skip, limit, batchSize);
    }
}
