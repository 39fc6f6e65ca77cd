package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Signals that the embedding provider failed or returned a vector of the wrong shape.
 *
 * <p>Thrown instead of storing or searching with a synthetic vector.</p>
 */
public class EmbeddingGenerationException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    public EmbeddingGenerationException(String message) {
        super(message);
    }

    public EmbeddingGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
