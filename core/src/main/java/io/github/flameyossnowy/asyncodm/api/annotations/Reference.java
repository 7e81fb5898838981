package io.github.flameyossnowy.asyncodm.api.annotations;

import io.github.flameyossnowy.asyncodm.api.annotations.enums.DeleteRule;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Configures a reference field, that is a field of type {@code Ref<T>} or {@code List<Ref<T>>}.
 * <p>
 * Reference fields do not need this annotation; it is only required to declare what happens to
 * the referencing documents when a referenced document is deleted.
 * <p>
 * Example:
 * <pre>
 * &#64;Repository(name = "comments")
 * public class Comment {
 *     private ObjectId id;
 *
 *     &#64;Reference(onDelete = DeleteRule.CASCADE)
 *     private Ref&lt;Post&gt; post;
 * }
 * </pre>
 * @see DeleteRule
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Reference {
    DeleteRule onDelete() default DeleteRule.DO_NOTHING;
}
