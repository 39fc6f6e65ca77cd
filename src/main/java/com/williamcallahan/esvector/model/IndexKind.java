package com.williamcallahan.esvector.model;

/**
 * Vector index kinds a vector property can request, including quantized HNSW and flat variants.
 */
public enum IndexKind {
    HNSW,
    INT8_HNSW,
    INT4_HNSW,
    BBQ_HNSW,
    FLAT,
    INT8_FLAT,
    INT4_FLAT,
    BBQ_FLAT,
    DISK_ANN,
    IVF_FLAT,
    QUANTIZED_FLAT,
    DYNAMIC;

    /** Applied when a vector property does not name an index kind, independent of its distance function. */
    public static final IndexKind DEFAULT = INT8_HNSW;
}
