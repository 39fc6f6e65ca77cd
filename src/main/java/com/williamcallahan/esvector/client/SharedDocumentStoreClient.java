package com.williamcallahan.esvector.client;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference-counted handle to a {@link DocumentStoreClient} shared by a store and its collections.
 *
 * <p>The creator holds the first reference. Each sharer calls {@link #retain()} once and
 * {@link #release()} once; an owned client is closed exactly once, when the last reference is
 * released. A borrowed client is never closed by this handle.</p>
 */
public final class SharedDocumentStoreClient {

    private static final Logger log = LoggerFactory.getLogger(SharedDocumentStoreClient.class);

    private final DocumentStoreClient client;
    private final boolean owned;
    private final AtomicInteger references = new AtomicInteger(1);

    private SharedDocumentStoreClient(DocumentStoreClient client, boolean owned) {
        this.client = Objects.requireNonNull(client, "client");
        this.owned = owned;
    }

    /** Wraps a client whose lifetime this handle controls. */
    public static SharedDocumentStoreClient owned(DocumentStoreClient client) {
        return new SharedDocumentStoreClient(client, true);
    }

    /** Wraps a caller-managed client that must outlive every sharer. */
    public static SharedDocumentStoreClient borrowed(DocumentStoreClient client) {
        return new SharedDocumentStoreClient(client, false);
    }

    public DocumentStoreClient client() {
        return client;
    }

    public boolean isOwned() {
        return owned;
    }

    public int referenceCount() {
        return references.get();
    }

    /**
     * Adds a reference.
     *
     * @return this handle
     * @throws IllegalStateException when every reference was already released
     */
    public SharedDocumentStoreClient retain() {
        int previous = references.getAndUpdate(count -> count == 0 ? 0 : count + 1);
        if (previous == 0) {
            throw new IllegalStateException("Document store client was already released");
        }
        return this;
    }

    /**
     * Drops a reference, closing an owned client when none remain.
     *
     * @throws IllegalStateException when called more often than references were taken
     */
    public void release() {
        int remaining = references.getAndUpdate(count -> count == 0 ? 0 : count - 1) - 1;
        if (remaining < 0) {
            throw new IllegalStateException("Document store client released more often than retained");
        }
        if (remaining == 0 && owned) {
            log.debug("[ES] Last reference released; closing document store client");
            client.close();
        }
    }
}
