package com.williamcallahan.esvector.collection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.esvector.client.DocumentStoreClient;
import com.williamcallahan.esvector.client.DocumentStoreException;
import com.williamcallahan.esvector.domain.errors.StorageOperationException;
import com.williamcallahan.esvector.fixtures.Hotel;
import com.williamcallahan.esvector.model.CollectionDefinition;
import com.williamcallahan.esvector.model.PropertyDefinition;
import com.williamcallahan.esvector.search.RecordRetrievalOptions;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies collection creation through the store and shared client release.
 */
class ElasticsearchVectorStoreTest {

    @Test
    void listsCollectionsCreatedThroughTheStore() {
        InMemoryDocumentStoreClient client = new InMemoryDocumentStoreClient();
        try (ElasticsearchVectorStore store = new ElasticsearchVectorStore(client, false, CollectionOptions.defaults())) {
            store.collection("hotels", String.class, Hotel.class).ensureCollectionExists();
            store.dynamicCollection(
                            "notes",
                            CollectionDefinition.of(
                                    PropertyDefinition.key("id", String.class),
                                    PropertyDefinition.vector("embedding", float[].class, 2)))
                    .ensureCollectionExists();

            assertEquals(List.of("hotels", "notes"), store.listCollectionNames());
        }
    }

    @Test
    void listingFailureNamesTheStoreScope() {
        DocumentStoreClient client = mock(DocumentStoreClient.class);
        DocumentStoreException clusterDown = new DocumentStoreException(503, "cluster unavailable");
        when(client.listIndices()).thenThrow(clusterDown);
        ElasticsearchVectorStore store = new ElasticsearchVectorStore(client, false, CollectionOptions.defaults());

        StorageOperationException thrown = assertThrows(StorageOperationException.class, store::listCollectionNames);

        assertEquals(ElasticsearchVectorStore.STORE_SCOPE, thrown.collectionName());
        assertEquals("indices.list", thrown.operationName());
        assertTrue(thrown.getMessage().contains("collection=<store>"));
        assertSame(clusterDown, thrown.getCause());
    }

    @Test
    void ownedClientClosesAfterStoreAndEveryCollection() {
        InMemoryDocumentStoreClient client = new InMemoryDocumentStoreClient();
        ElasticsearchVectorStore store = new ElasticsearchVectorStore(client, true, CollectionOptions.defaults());
        ElasticsearchCollection<String, Hotel> first = store.collection("a", String.class, Hotel.class);
        ElasticsearchCollection<String, Hotel> second = store.collection("b", String.class, Hotel.class);

        store.close();
        first.close();
        assertEquals(0, client.closeCount());

        second.close();
        second.close();
        assertEquals(1, client.closeCount());
    }

    @Test
    void borrowedClientIsNeverClosed() {
        InMemoryDocumentStoreClient client = new InMemoryDocumentStoreClient();
        ElasticsearchVectorStore store = new ElasticsearchVectorStore(client, false, CollectionOptions.defaults());
        ElasticsearchCollection<String, Hotel> hotels = store.collection("hotels", String.class, Hotel.class);
        hotels.ensureCollectionExists();

        store.close();
        hotels.upsert(Hotel.of("1", "inn", List.of(), "x", new float[] {1, 0, 0}));
        hotels.close();

        assertEquals(0, client.closeCount());
        assertEquals(1, client.listIndices().size());
    }

    @Test
    void closedStoreRejectsNewCollections() {
        ElasticsearchVectorStore store =
                new ElasticsearchVectorStore(new InMemoryDocumentStoreClient(), false, CollectionOptions.defaults());
        store.close();

        assertThrows(IllegalStateException.class, () -> store.collection("hotels", String.class, Hotel.class));
        assertThrows(IllegalStateException.class, store::listCollectionNames);
    }

    @Test
    void collectionOutlivesItsStoreWithOwnedClient() {
        InMemoryDocumentStoreClient client = new InMemoryDocumentStoreClient();
        ElasticsearchVectorStore store = new ElasticsearchVectorStore(client, true, CollectionOptions.defaults());
        ElasticsearchCollection<String, Hotel> hotels = store.collection("hotels", String.class, Hotel.class);
        store.close();

        hotels.ensureCollectionExists();
        hotels.upsert(Hotel.of("1", "inn", List.of(), "x", new float[] {1, 0, 0}));

        assertEquals("1", hotels.get("1", RecordRetrievalOptions.defaults()).orElseThrow().id());
        hotels.close();
        assertEquals(1, client.closeCount());
    }
}
