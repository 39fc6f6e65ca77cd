package com.williamcallahan.esvector.search;

import com.williamcallahan.esvector.filter.FilterExpression;

/**
 * Options for a vector search.
 *
 * @param vectorProperty vector property to search, or {@code null} when the model has exactly one
 * @param filter filter applied inside the nearest-neighbour query, or {@code null}
 * @param skip number of leading results to skip
 * @param includeVectors whether vectors are returned with each record
 */
public record VectorSearchOptions(String vectorProperty, FilterExpression filter, int skip, boolean includeVectors) {

    public VectorSearchOptions {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }
    }

    public static VectorSearchOptions defaults() {
        return new VectorSearchOptions(null, null, 0, false);
    }

    public VectorSearchOptions withVectorProperty(String name) {
        return new VectorSearchOptions(name, filter, skip, includeVectors);
    }

    public VectorSearchOptions withFilter(FilterExpression searchFilter) {
        return new VectorSearchOptions(vectorProperty, searchFilter, skip, includeVectors);
    }

    public VectorSearchOptions withSkip(int skipCount) {
        return new VectorSearchOptions(vectorProperty, filter, skipCount, includeVectors);
    }

    public VectorSearchOptions withIncludeVectors(boolean include) {
        return new VectorSearchOptions(vectorProperty, filter, skip, include);
    }
}
