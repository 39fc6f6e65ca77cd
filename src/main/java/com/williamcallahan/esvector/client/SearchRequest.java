package com.williamcallahan.esvector.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * A {@code _search} request.
 *
 * @param query query clause
 * @param sort sort clauses, empty for relevance order
 * @param excludes {@code _source} fields left out of each hit
 * @param from number of leading hits to skip
 * @param size maximum number of hits
 */
public record SearchRequest(ObjectNode query, List<ObjectNode> sort, List<String> excludes, int from, int size) {

    public SearchRequest {
        Objects.requireNonNull(query, "query");
        sort = sort == null ? List.of() : List.copyOf(sort);
        excludes = excludes == null ? List.of() : List.copyOf(excludes);
    }
}
