package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Signals a search input that is not a vector on a property without an embedding generator.
 */
public class NoEmbeddingGeneratorException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    public NoEmbeddingGeneratorException(String message) {
        super(message);
    }
}
