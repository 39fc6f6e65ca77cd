package com.williamcallahan.esvector.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.esvector.mapping.StorageDocument;

/**
 * One hit of a search response.
 *
 * @param id document identifier
 * @param source document source
 * @param score hit score, or {@code null} when sorting replaced scoring
 */
public record SearchHit(String id, ObjectNode source, Double score) {

    public StorageDocument toDocument() {
        return new StorageDocument(id, source);
    }
}
