package com.williamcallahan.esvector.collection;

import com.williamcallahan.esvector.search.HybridSearchOptions;
import com.williamcallahan.esvector.search.VectorSearchResult;
import java.util.Collection;
import java.util.stream.Stream;

/**
 * Search combining vector similarity with keyword matching through reciprocal rank fusion.
 *
 * @param <R> record type
 */
public interface KeywordHybridSearchable<R> {

    /**
     * Runs a hybrid search.
     *
     * @param searchInput numeric vector or input for the vector property's embedding generator
     * @param keywords keywords matched against the full-text property
     * @param top maximum number of results
     * @param options search options, {@code null} for defaults
     * @return fused results in rank order
     */
    Stream<VectorSearchResult<R>> hybridSearch(
            Object searchInput, Collection<String> keywords, int top, HybridSearchOptions options);
}
