package com.williamcallahan.esvector.mapping;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A stored document: the identifier travels beside the body, never inside it.
 *
 * @param id document identifier, or {@code null} to let the store assign one
 * @param body document source without the key field
 */
public record StorageDocument(String id, ObjectNode body) {

    public StorageDocument {
        Objects.requireNonNull(body, "body");
    }
}
