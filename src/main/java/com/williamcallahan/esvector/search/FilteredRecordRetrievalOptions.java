package com.williamcallahan.esvector.search;

import java.util.Arrays;
import java.util.List;

/**
 * Options for filter-based record retrieval.
 *
 * @param skip number of leading records to skip
 * @param includeVectors whether vectors are returned with each record
 * @param orderBy sort criteria applied in order
 */
public record FilteredRecordRetrievalOptions(int skip, boolean includeVectors, List<SortField> orderBy) {

    public FilteredRecordRetrievalOptions {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    public static FilteredRecordRetrievalOptions defaults() {
        return new FilteredRecordRetrievalOptions(0, false, List.of());
    }

    public FilteredRecordRetrievalOptions withSkip(int skipCount) {
        return new FilteredRecordRetrievalOptions(skipCount, includeVectors, orderBy);
    }

    public FilteredRecordRetrievalOptions withIncludeVectors(boolean include) {
        return new FilteredRecordRetrievalOptions(skip, include, orderBy);
    }

    public FilteredRecordRetrievalOptions orderedBy(SortField... sortFields) {
        return new FilteredRecordRetrievalOptions(skip, includeVectors, Arrays.asList(sortFields));
    }
}
