package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Signals a request for stored vectors from a collection whose vectors come from an embedding generator.
 */
public class UnsupportedCombinationException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    public UnsupportedCombinationException(String message) {
        super(message);
    }
}
