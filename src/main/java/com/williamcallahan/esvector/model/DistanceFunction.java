package com.williamcallahan.esvector.model;

/**
 * Similarity or distance functions a vector property can request.
 *
 * <p>Not every function has a backing-store equivalent; unsupported values are rejected when the
 * index schema is built.</p>
 */
public enum DistanceFunction {
    COSINE_SIMILARITY,
    COSINE_DISTANCE,
    DOT_PRODUCT_SIMILARITY,
    NEGATIVE_DOT_PRODUCT_SIMILARITY,
    EUCLIDEAN_DISTANCE,
    EUCLIDEAN_SQUARED_DISTANCE,
    MAX_INNER_PRODUCT,
    HAMMING_DISTANCE,
    MANHATTAN_DISTANCE;

    /** Applied when a vector property does not name a function. */
    public static final DistanceFunction DEFAULT = COSINE_SIMILARITY;
}
