package com.williamcallahan.esvector.search;

/**
 * Options for key-based record retrieval.
 *
 * @param includeVectors whether vectors are returned with each record
 */
public record RecordRetrievalOptions(boolean includeVectors) {

    public static RecordRetrievalOptions defaults() {
        return new RecordRetrievalOptions(false);
    }
}
