package io.github.flameyossnowy.asyncodm.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@code Map<String, Object>} field that receives stored fields unknown to the model
 * when unknown fields are configured to be preserved. Its entries are written back on encode.
 * @see io.github.flameyossnowy.asyncodm.api.UnknownFieldPolicy
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface ExtraFields {
}
