package com.williamcallahan.esvector.model;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an embedding field stored as a dense vector.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface VectorStoreVector {

    /** Number of vector dimensions; must be positive. */
    int dimensions();

    DistanceFunction distanceFunction() default DistanceFunction.COSINE_SIMILARITY;

    IndexKind indexKind() default IndexKind.INT8_HNSW;
}
