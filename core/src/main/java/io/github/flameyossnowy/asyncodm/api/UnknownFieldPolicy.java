package io.github.flameyossnowy.asyncodm.api;

/**
 * What decoding does with stored fields that the model does not declare.
 */
public enum UnknownFieldPolicy {
    /**
     * Ignore unknown fields. They are lost when the instance is saved again.
     */
    DROP,

    /**
     * Keep unknown fields in the model's {@link io.github.flameyossnowy.asyncodm.api.annotations.ExtraFields}
     * map and write them back on encode. Models without such a map cannot be decoded under this policy.
     */
    PRESERVE
}
