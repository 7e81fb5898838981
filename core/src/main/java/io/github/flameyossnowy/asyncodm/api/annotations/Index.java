package io.github.flameyossnowy.asyncodm.api.annotations;

import io.github.flameyossnowy.asyncodm.api.annotations.enums.IndexType;

import java.lang.annotation.*;

/**
 * Declares an index on the collection of a top-level model.
 * <p>
 * Fields are model field names; prefix a field with {@code -} to index it in descending order.
 * Indexes are never created implicitly, call {@code createIndexes()} on the model's query set.
 * @author FlameyosFlow
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Repeatable(Indexes.class)
public @interface Index {
    String name() default "";

    String[] fields();

    IndexType type() default IndexType.NORMAL;
}
