package com.williamcallahan.esvector.search;

/**
 * A record returned by a search with its engine score.
 *
 * @param record mapped record
 * @param score relevance score, or {@code null} when the engine returned none
 * @param <R> record type
 */
public record VectorSearchResult<R>(R record, Double score) {}
