package com.williamcallahan.esvector.collection;

import com.williamcallahan.esvector.filter.FilterExpression;
import com.williamcallahan.esvector.search.FilteredRecordRetrievalOptions;
import com.williamcallahan.esvector.search.RecordRetrievalOptions;
import com.williamcallahan.esvector.search.VectorSearchOptions;
import com.williamcallahan.esvector.search.VectorSearchResult;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A named collection of records with a key, data fields, and embedding vectors.
 *
 * <p>Operations block on the backing store. Interrupting the calling thread cancels the operation at
 * its next backing-store or embedding call; batch elements that already completed stay committed.</p>
 *
 * @param <K> key type
 * @param <R> record type
 */
public interface VectorStoreCollection<K, R> extends AutoCloseable {

    String name();

    boolean collectionExists();

    /** Creates the backing index from the collection model when it does not exist yet. */
    void ensureCollectionExists();

    /** Deletes the backing index; a missing index is not an error. */
    void ensureCollectionDeleted();

    /**
     * Reads one record by key.
     *
     * @param key record key
     * @param options retrieval options, {@code null} for defaults
     * @return the record, or empty when no record has the key
     */
    Optional<R> get(K key, RecordRetrievalOptions options);

    /**
     * Reads several records in one round trip.
     *
     * @param keys record keys
     * @param options retrieval options, {@code null} for defaults
     * @return records that exist, in key order
     */
    List<R> get(Collection<K> keys, RecordRetrievalOptions options);

    /**
     * Reads records matching a filter without a query vector.
     *
     * @param filter filter, or {@code null} for every record
     * @param top maximum number of records
     * @param options skip, vectors, and ordering, {@code null} for defaults
     * @return matching records
     */
    List<R> get(FilterExpression filter, int top, FilteredRecordRetrievalOptions options);

    /**
     * Inserts or replaces one record, generating embeddings where the model requires them.
     *
     * @param record record to store
     * @return key of the stored record
     */
    K upsert(R record);

    /**
     * Inserts or replaces several records in one round trip.
     *
     * @param records records to store
     * @return keys of the stored records, in input order
     */
    List<K> upsert(Collection<R> records);

    /** Deletes one record; a missing record is not an error. */
    void delete(K key);

    /** Deletes several records in one round trip; missing records are ignored. */
    void delete(Collection<K> keys);

    /**
     * Searches for the records nearest to the search input.
     *
     * @param searchInput numeric vector or input for the vector property's embedding generator
     * @param top maximum number of results
     * @param options search options, {@code null} for defaults
     * @return results in engine rank order
     */
    Stream<VectorSearchResult<R>> search(Object searchInput, int top, VectorSearchOptions options);

    @Override
    void close();
}
