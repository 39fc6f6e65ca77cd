package com.williamcallahan.esvector.client;

import java.io.Serial;

/**
 * Raised by {@link DocumentStoreClient} implementations when a backing-store call fails.
 */
public class DocumentStoreException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    /** Status used when no HTTP response was received. */
    public static final int NO_STATUS = 0;

    private static final int NOT_FOUND = 404;

    private final int status;

    /**
     * Creates a transport failure.
     *
     * @param status HTTP status, or {@link #NO_STATUS}
     * @param message failure description
     * @param cause underlying failure, may be {@code null}
     */
    public DocumentStoreException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public DocumentStoreException(int status, String message) {
        this(status, message, null);
    }

    public int status() {
        return status;
    }

    public boolean isNotFound() {
        return status == NOT_FOUND;
    }
}
