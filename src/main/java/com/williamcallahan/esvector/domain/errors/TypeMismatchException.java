package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Signals a filter expression that casts a bound property to a type it cannot be converted to.
 */
public class TypeMismatchException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    public TypeMismatchException(String message) {
        super(message);
    }
}
