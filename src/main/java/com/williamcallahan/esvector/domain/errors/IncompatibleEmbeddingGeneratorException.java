package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Signals an embedding generator that cannot accept the input it was handed.
 */
public class IncompatibleEmbeddingGeneratorException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    public IncompatibleEmbeddingGeneratorException(String message) {
        super(message);
    }
}
