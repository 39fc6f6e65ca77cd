package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Root of the failures raised while modelling, mapping, translating, or storing vector records.
 *
 * <p>Structural subclasses signal caller misconfiguration and are never retried.</p>
 */
public class VectorStoreException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the failure
     */
    public VectorStoreException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation of the failure
     * @param cause underlying failure
     */
    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
