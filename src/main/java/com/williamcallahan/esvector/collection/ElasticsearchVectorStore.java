package com.williamcallahan.esvector.collection;

import com.williamcallahan.esvector.client.DocumentStoreClient;
import com.williamcallahan.esvector.client.SharedDocumentStoreClient;
import com.williamcallahan.esvector.model.CollectionDefinition;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point handing out collections that share one backing-store client.
 *
 * <p>When the store owns its client, the client is closed once the store and every collection it
 * handed out have been closed.</p>
 */
public class ElasticsearchVectorStore implements AutoCloseable {

    /** Collection label reported by store-level failures such as index listing. */
    static final String STORE_SCOPE = "<store>";

    private final SharedDocumentStoreClient sharedClient;
    private final CollectionOptions defaults;
    private final StoreOperationRunner runner = new StoreOperationRunner(STORE_SCOPE);
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a store.
     *
     * @param client backing-store client
     * @param ownsClient true when the store should close the client after its last user is closed
     * @param defaults options applied to every collection unless overridden
     */
    public ElasticsearchVectorStore(DocumentStoreClient client, boolean ownsClient, CollectionOptions defaults) {
        this.sharedClient = ownsClient
                ? SharedDocumentStoreClient.owned(client)
                : SharedDocumentStoreClient.borrowed(client);
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    /**
     * Lists the names of the collections (indices) in the cluster.
     *
     * @return non-hidden index names
     */
    public List<String> listCollectionNames() {
        ensureOpen();
        return runner.run("indices.list", () -> sharedClient.client().listIndices());
    }

    public <K, R> ElasticsearchCollection<K, R> collection(String name, Class<K> keyType, Class<R> recordType) {
        return collection(name, keyType, recordType, defaults.definition());
    }

    /**
     * Returns a typed collection described by an explicit definition instead of annotations.
     *
     * @param name index name
     * @param keyType key type
     * @param recordType record type
     * @param definition definition, or {@code null} to read annotations
     * @param <K> key type
     * @param <R> record type
     * @return collection sharing this store's client
     */
    public <K, R> ElasticsearchCollection<K, R> collection(
            String name, Class<K> keyType, Class<R> recordType, CollectionDefinition definition) {
        ensureOpen();
        return new ElasticsearchCollection<>(sharedClient, name, keyType, recordType, defaults.withDefinition(definition));
    }

    public ElasticsearchDynamicCollection dynamicCollection(String name, CollectionDefinition definition) {
        ensureOpen();
        return new ElasticsearchDynamicCollection(sharedClient, name, defaults.withDefinition(definition));
    }

    /** Releases the store's reference to the shared client. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            sharedClient.release();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Vector store is closed");
        }
    }
}
