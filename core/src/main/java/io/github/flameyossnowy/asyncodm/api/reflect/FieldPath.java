package io.github.flameyossnowy.asyncodm.api.reflect;

import org.jetbrains.annotations.Nullable;

/**
 * A dotted model path resolved against a model.
 * @param wirePath the path as stored, for example {@code _id} or {@code address.zip_code}
 * @param field the field the path ends at, or {@code null} when it ends inside a map or at a list index
 */
public record FieldPath(String wirePath, @Nullable FieldData<?> field) {
}
