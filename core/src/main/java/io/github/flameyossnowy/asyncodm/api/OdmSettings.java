package io.github.flameyossnowy.asyncodm.api;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Settings shared by every operation of a mapper instance.
 *
 * @param unknownFieldPolicy    how decoding treats stored fields the model does not declare
 * @param brokenReferencePolicy how dereferencing treats references without a target
 * @param batchSize             the cursor batch size, {@code 0} for the driver's default
 */
public record OdmSettings(UnknownFieldPolicy unknownFieldPolicy, BrokenReferencePolicy brokenReferencePolicy, int batchSize) {
    public OdmSettings {
        Objects.requireNonNull(unknownFieldPolicy, "unknownFieldPolicy");
        Objects.requireNonNull(brokenReferencePolicy, "brokenReferencePolicy");
        if (batchSize < 0) throw new IllegalArgumentException("Batch size cannot be negative: " + batchSize);
    }

    /**
     * Unknown fields are dropped, broken references are left as sentinels and cursors use the
     * driver's batch size.
     * @return the default settings
     */
    @Contract(" -> new")
    public static @NotNull OdmSettings defaults() {
        return builder().build();
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UnknownFieldPolicy unknownFieldPolicy = UnknownFieldPolicy.DROP;
        private BrokenReferencePolicy brokenReferencePolicy = BrokenReferencePolicy.SENTINEL;
        private int batchSize;

        Builder() {}

        public Builder unknownFields(UnknownFieldPolicy policy) {
            this.unknownFieldPolicy = policy;
            return this;
        }

        public Builder brokenReferences(BrokenReferencePolicy policy) {
            this.brokenReferencePolicy = policy;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public OdmSettings build() {
            return new OdmSettings(unknownFieldPolicy, brokenReferencePolicy, batchSize);
        }
    }
}
