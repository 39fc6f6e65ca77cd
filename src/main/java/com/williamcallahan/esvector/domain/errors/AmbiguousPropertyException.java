package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Signals that a search needed to default to the single vector or full-text property but found zero or several.
 */
public class AmbiguousPropertyException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    public AmbiguousPropertyException(String message) {
        super(message);
    }
}
