package com.williamcallahan.esvector.search;

import com.williamcallahan.esvector.filter.FilterExpression;

/**
 * Options for a hybrid vector and keyword search.
 *
 * @param vectorProperty vector property to search, or {@code null} when the model has exactly one
 * @param textProperty full-text property matched against the keywords, or {@code null} when the model has exactly one
 * @param filter filter applied to both retrieval legs, or {@code null}
 * @param skip number of leading fused results to skip
 * @param includeVectors whether vectors are returned with each record
 */
public record HybridSearchOptions(
        String vectorProperty, String textProperty, FilterExpression filter, int skip, boolean includeVectors) {

    public HybridSearchOptions {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }
    }

    public static HybridSearchOptions defaults() {
        return new HybridSearchOptions(null, null, null, 0, false);
    }

    public HybridSearchOptions withVectorProperty(String name) {
        return new HybridSearchOptions(name, textProperty, filter, skip, includeVectors);
    }

    public HybridSearchOptions withTextProperty(String name) {
        return new HybridSearchOptions(vectorProperty, name, filter, skip, includeVectors);
    }

    public HybridSearchOptions withFilter(FilterExpression searchFilter) {
        return new HybridSearchOptions(vectorProperty, textProperty, searchFilter, skip, includeVectors);
    }

    public HybridSearchOptions withSkip(int skipCount) {
        return new HybridSearchOptions(vectorProperty, textProperty, filter, skipCount, includeVectors);
    }

    public HybridSearchOptions withIncludeVectors(boolean include) {
        return new HybridSearchOptions(vectorProperty, textProperty, filter, skip, include);
    }
}
