package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;
import java.lang.reflect.Type;

/**
 * Signals a key, data, or vector property whose declared type is outside the supported set.
 */
public class UnsupportedTypeException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception naming the offending property, its type, and the supported alternatives.
     *
     * @param role property role, for example {@code key} or {@code vector}
     * @param propertyName model name of the offending property
     * @param offendingType declared type
     * @param supportedTypes human-readable list of supported types
     */
    public UnsupportedTypeException(String role, String propertyName, Type offendingType, String supportedTypes) {
        super("Property '" + propertyName + "' has unsupported " + role + " type '" + offendingType.getTypeName()
                + "'. Supported types: " + supportedTypes);
    }

    /**
     * Creates an exception with a preformatted message.
     *
     * @param message explanation of the failure
     */
    public UnsupportedTypeException(String message) {
        super(message);
    }
}
