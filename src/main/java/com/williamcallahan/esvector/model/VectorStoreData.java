package com.williamcallahan.esvector.model;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a scalar or array field stored in the document body.
 *
 * <p>Storage names follow Jackson: {@code @JsonProperty} wins, then the mapper's naming strategy.</p>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface VectorStoreData {

    /** Whether the field is indexed for exact-match filtering. */
    boolean indexed() default false;

    /** Whether the field is tokenized for full-text search; takes precedence over {@link #indexed()}. */
    boolean fullTextIndexed() default false;
}
