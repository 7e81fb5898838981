package io.github.flameyossnowy.asyncodm.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as an embedded model, which is stored inline inside the document of its parent
 * and never in a collection of its own.
 * <p>
 * Embedded models have no primary key.
 * @see Repository
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Embedded {
}
