package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Signals a malformed or ambiguous collection model, or a filter that references an unknown property.
 */
public class SchemaException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    public SchemaException(String message) {
        super(message);
    }
}
