package com.williamcallahan.esvector.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * A {@code _search} request fusing a nearest-neighbour retriever and a standard query retriever.
 *
 * @param knnRetriever body of the {@code knn} retriever
 * @param textQuery query of the {@code standard} retriever
 * @param rankFusion fusion parameters
 * @param excludes {@code _source} fields left out of each hit
 * @param from number of leading fused hits to skip
 * @param size maximum number of hits
 */
public record HybridSearchRequest(
        ObjectNode knnRetriever,
        ObjectNode textQuery,
        RankFusion rankFusion,
        List<String> excludes,
        int from,
        int size) {

    public HybridSearchRequest {
        Objects.requireNonNull(knnRetriever, "knnRetriever");
        Objects.requireNonNull(textQuery, "textQuery");
        Objects.requireNonNull(rankFusion, "rankFusion");
        excludes = excludes == null ? List.of() : List.copyOf(excludes);
    }
}
