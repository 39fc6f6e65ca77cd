package com.williamcallahan.esvector.client;

import com.williamcallahan.esvector.mapping.IndexSchema;
import com.williamcallahan.esvector.mapping.StorageDocument;
import java.util.List;
import java.util.Optional;

/**
 * Boundary to the Elasticsearch index, document, and search APIs.
 *
 * <p>Implementations raise {@link DocumentStoreException} for every failed call and never retry.</p>
 */
public interface DocumentStoreClient extends AutoCloseable {

    boolean indexExists(String index);

    void createIndex(String index, IndexSchema schema);

    /** Deletes an index; a missing index raises a not-found {@link DocumentStoreException}. */
    void deleteIndex(String index);

    /**
     * Reads one document.
     *
     * @param index index name
     * @param id document identifier
     * @param excludes source fields to leave out
     * @return the document, or empty when it does not exist
     */
    Optional<StorageDocument> getDocument(String index, String id, List<String> excludes);

    /**
     * Reads several documents in one round trip.
     *
     * @param index index name
     * @param ids document identifiers
     * @param excludes source fields to leave out
     * @return documents that exist, in request order
     */
    List<StorageDocument> multiGet(String index, List<String> ids, List<String> excludes);

    /**
     * Indexes one document, replacing any existing document with the same identifier.
     *
     * @param index index name
     * @param document document to index
     * @return identifier of the stored document
     */
    String indexDocument(String index, StorageDocument document);

    /**
     * Indexes several documents in one round trip.
     *
     * @param index index name
     * @param documents documents to index
     * @return identifiers of the stored documents, in request order
     */
    List<String> bulkIndex(String index, List<StorageDocument> documents);

    /** Deletes one document; a missing document raises a not-found {@link DocumentStoreException}. */
    void deleteDocument(String index, String id);

    /** Deletes several documents in one round trip; missing documents are ignored. */
    void bulkDelete(String index, List<String> ids);

    List<SearchHit> search(String index, SearchRequest request);

    List<SearchHit> hybridSearch(String index, HybridSearchRequest request);

    List<String> listIndices();

    @Override
    void close();
}
