package com.williamcallahan.esvector.fixtures;

import com.williamcallahan.esvector.model.VectorStoreData;
import com.williamcallahan.esvector.model.VectorStoreKey;
import com.williamcallahan.esvector.model.VectorStoreVector;

/**
 * Record whose vector is generated from its text at upsert time.
 */
public record Article(
        @VectorStoreKey Long articleId,
        @VectorStoreData(fullTextIndexed = true) String title,
        @VectorStoreVector(dimensions = 3) String summary) {}
