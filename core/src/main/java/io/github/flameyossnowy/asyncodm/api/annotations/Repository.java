package io.github.flameyossnowy.asyncodm.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a top-level model, stored as documents of its own MongoDB collection.
 * <p>
 * A top-level model has exactly one primary key, either a field annotated with {@link Id} or,
 * when none is declared, a field named {@code id} of type {@link org.bson.types.ObjectId}.
 * <p>
 * Example:
 * <pre>
 * &#64;Repository(name = "users")
 * public class User {
 *     &#64;Id
 *     private String email;
 *
 *     private String name;
 *
 *     public User() {}
 * }
 * </pre>
 * @author FlameyosFlow
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Repository {
    /**
     * The name of the collection, defaults to the class name in snake case.
     * @return the name of the collection
     */
    String name() default "";
}
