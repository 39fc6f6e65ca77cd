package com.williamcallahan.esvector.domain.errors;

import java.io.Serial;

/**
 * Wraps a failed backing-store call with the collection and operation it belonged to.
 */
public class StorageOperationException extends VectorStoreException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String collectionName;
    private final String operationName;

    /**
     * Creates a storage failure for one named operation.
     *
     * @param collectionName collection (index) the operation targeted, or a store-level label
     * @param operationName backing-store operation, for example {@code search}
     * @param cause transport failure
     */
    public StorageOperationException(String collectionName, String operationName, Throwable cause) {
        super(describe(collectionName, operationName, cause), cause);
        this.collectionName = collectionName == null ? "" : collectionName;
        this.operationName = operationName == null ? "" : operationName;
    }

    public String collectionName() {
        return collectionName;
    }

    public String operationName() {
        return operationName;
    }

    private static String describe(String collectionName, String operationName, Throwable cause) {
        StringBuilder message = new StringBuilder("Call to vector store failed (operation=")
                .append(operationName);
        if (collectionName != null && !collectionName.isBlank()) {
            message.append(", collection=").append(collectionName);
        }
        message.append(')');
        if (cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()) {
            message.append(": ").append(cause.getMessage());
        }
        return message.toString();
    }
}
