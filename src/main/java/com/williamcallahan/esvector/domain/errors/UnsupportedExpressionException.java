package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Signals a filter expression node or shape that cannot be translated into the query DSL.
 */
public class UnsupportedExpressionException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    public UnsupportedExpressionException(String message) {
        super(message);
    }
}
