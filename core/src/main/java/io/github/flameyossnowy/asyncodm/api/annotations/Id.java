package io.github.flameyossnowy.asyncodm.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The primary key of a top-level model, always stored under {@code _id}.
 * <p>
 * A primary key of type {@link org.bson.types.ObjectId} may be left {@code null}, in which case
 * one is generated when the document is first inserted. Any other primary key type must be set
 * before saving.
 * <p>
 * Example:
 * <pre>
 * &#64;Repository(name = "posts")
 * public class Post {
 *     &#64;Id
 *     private String title;
 *
 *     private Ref&lt;User&gt; author;
 *
 *     public Post() {}
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Id {

}
