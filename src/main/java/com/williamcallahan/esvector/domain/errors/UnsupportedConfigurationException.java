package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Signals a vector index configuration (index kind, similarity) with no Elasticsearch equivalent.
 */
public class UnsupportedConfigurationException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    public UnsupportedConfigurationException(String message) {
        super(message);
    }
}
