package com.williamcallahan.esvector.collection;

import com.google.common.primitives.Primitives;
import com.williamcallahan.esvector.client.DocumentStoreClient;
import com.williamcallahan.esvector.client.HybridSearchRequest;
import com.williamcallahan.esvector.client.SearchHit;
import com.williamcallahan.esvector.client.SearchRequest;
import com.williamcallahan.esvector.client.SharedDocumentStoreClient;
import com.williamcallahan.esvector.domain.errors.NoEmbeddingGeneratorException;
import com.williamcallahan.esvector.domain.errors.SchemaException;
import com.williamcallahan.esvector.domain.errors.UnsupportedCombinationException;
import com.williamcallahan.esvector.filter.FilterExpression;
import com.williamcallahan.esvector.filter.FilterTranslator;
import com.williamcallahan.esvector.mapping.IndexSchema;
import com.williamcallahan.esvector.mapping.IndexSchemaBuilder;
import com.williamcallahan.esvector.mapping.KeyCodec;
import com.williamcallahan.esvector.mapping.RecordMapper;
import com.williamcallahan.esvector.mapping.StorageDocument;
import com.williamcallahan.esvector.mapping.TypedRecordMapper;
import com.williamcallahan.esvector.model.CollectionModel;
import com.williamcallahan.esvector.model.CollectionModelBuilder;
import com.williamcallahan.esvector.model.DataPropertyModel;
import com.williamcallahan.esvector.model.VectorPropertyModel;
import com.williamcallahan.esvector.search.FilteredRecordRetrievalOptions;
import com.williamcallahan.esvector.search.HybridSearchOptions;
import com.williamcallahan.esvector.search.QueryVectorResolver;
import com.williamcallahan.esvector.search.RecordRetrievalOptions;
import com.williamcallahan.esvector.search.SearchRequestFactory;
import com.williamcallahan.esvector.search.VectorSearchOptions;
import com.williamcallahan.esvector.search.VectorSearchResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collection of typed records stored in one Elasticsearch index.
 *
 * <p>The collection model is built once at construction; every operation reuses it together with
 * the record mapper, filter translator, and request factory derived from it. Backing-store failures
 * surface as {@link com.williamcallahan.esvector.domain.errors.StorageOperationException}.</p>
 *
 * @param <K> key type: {@link String}, {@link Long}, or {@link java.util.UUID}
 * @param <R> record type
 */
public class ElasticsearchCollection<K, R> implements VectorStoreCollection<K, R>, KeywordHybridSearchable<R> {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchCollection.class);

    private final String name;
    private final CollectionModel model;
    private final RecordMapper<R> mapper;
    private final SharedDocumentStoreClient sharedClient;
    private final DocumentStoreClient client;
    private final StoreOperationRunner runner;
    private final SearchRequestFactory requestFactory;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a collection for a statically typed record.
     *
     * @param sharedClient shared backing-store client; this collection takes one reference
     * @param name index name
     * @param keyType key type, which must match the record's key property
     * @param recordType record type
     * @param options construction options
     */
    public ElasticsearchCollection(
            SharedDocumentStoreClient sharedClient,
            String name,
            Class<K> keyType,
            Class<R> recordType,
            CollectionOptions options) {
        this(sharedClient, name, typedModel(keyType, recordType, options), recordType, options);
    }

    /**
     * Creates a collection over a caller-managed client that this collection never closes.
     *
     * @param client backing-store client
     * @param name index name
     * @param keyType key type
     * @param recordType record type
     * @param options construction options
     */
    public ElasticsearchCollection(
            DocumentStoreClient client, String name, Class<K> keyType, Class<R> recordType, CollectionOptions options) {
        this(SharedDocumentStoreClient.borrowed(client), name, keyType, recordType, options);
    }

    private ElasticsearchCollection(
            SharedDocumentStoreClient sharedClient,
            String name,
            CollectionModel model,
            Class<R> recordType,
            CollectionOptions options) {
        this(sharedClient, name, model, new TypedRecordMapper<>(model, recordType, options.objectMapper()), options);
    }

    protected ElasticsearchCollection(
            SharedDocumentStoreClient sharedClient,
            String name,
            CollectionModel model,
            RecordMapper<R> mapper,
            CollectionOptions options) {
        Objects.requireNonNull(sharedClient, "sharedClient");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection name must not be blank");
        }
        this.name = name;
        this.model = Objects.requireNonNull(model, "model");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.runner = new StoreOperationRunner(name);
        this.requestFactory = new SearchRequestFactory(
                model, new FilterTranslator(options.objectMapper()), options.searchSettings(), options.objectMapper());
        this.sharedClient = sharedClient.retain();
        this.client = sharedClient.client();
    }

    private static CollectionModel typedModel(Class<?> keyType, Class<?> recordType, CollectionOptions options) {
        Objects.requireNonNull(keyType, "keyType");
        Objects.requireNonNull(options, "options");
        CollectionModel model = new CollectionModelBuilder(options.objectMapper())
                .build(recordType, options.definition(), options.embeddingGenerator());
        Class<?> declaredKeyType = Primitives.wrap(model.keyProperty().rawType());
        if (Primitives.wrap(keyType) != declaredKeyType) {
            throw new SchemaException("Collection key type " + keyType.getSimpleName() + " does not match key property '"
                    + model.keyProperty().modelName() + "' of type " + declaredKeyType.getSimpleName());
        }
        return model;
    }

    @Override
    public String name() {
        return name;
    }

    /** Returns the model this collection was built with. */
    public CollectionModel model() {
        return model;
    }

    @Override
    public boolean collectionExists() {
        ensureOpen();
        return runner.run("indices.exists", () -> client.indexExists(name));
    }

    @Override
    public void ensureCollectionExists() {
        ensureOpen();
        IndexSchema schema = IndexSchemaBuilder.build(model);
        if (collectionExists()) {
            return;
        }
        runner.execute("indices.create", () -> client.createIndex(name, schema));
    }

    @Override
    public void ensureCollectionDeleted() {
        ensureOpen();
        runner.runIgnoringNotFound("indices.delete", () -> client.deleteIndex(name));
    }

    @Override
    public Optional<R> get(K key, RecordRetrievalOptions options) {
        Objects.requireNonNull(key, "key");
        ensureOpen();
        boolean includeVectors = options != null && options.includeVectors();
        rejectGeneratedVectors(includeVectors);
        String id = KeyCodec.toStorageId(key);
        List<String> excludes = requestFactory.excludes(includeVectors);
        return runner.run("get", () -> client.getDocument(name, id, excludes))
                .map(document -> mapper.fromStorage(document, includeVectors));
    }

    @Override
    public List<R> get(Collection<K> keys, RecordRetrievalOptions options) {
        Objects.requireNonNull(keys, "keys");
        ensureOpen();
        boolean includeVectors = options != null && options.includeVectors();
        rejectGeneratedVectors(includeVectors);
        if (keys.isEmpty()) {
            return List.of();
        }
        List<String> ids = keys.stream().map(KeyCodec::toStorageId).toList();
        List<String> excludes = requestFactory.excludes(includeVectors);
        List<StorageDocument> documents = runner.run("mget", () -> client.multiGet(name, ids, excludes));
        return documents.stream()
                .map(document -> mapper.fromStorage(document, includeVectors))
                .toList();
    }

    @Override
    public List<R> get(FilterExpression filter, int top, FilteredRecordRetrievalOptions options) {
        requirePositiveTop(top);
        ensureOpen();
        FilteredRecordRetrievalOptions effective = options == null ? FilteredRecordRetrievalOptions.defaults() : options;
        rejectGeneratedVectors(effective.includeVectors());
        SearchRequest request = requestFactory.filteredGet(filter, top, effective);
        List<SearchHit> hits = runner.run("search", () -> client.search(name, request));
        return hits.stream()
                .map(hit -> mapper.fromStorage(hit.toDocument(), effective.includeVectors()))
                .toList();
    }

    @Override
    public K upsert(R record) {
        Objects.requireNonNull(record, "record");
        ensureOpen();
        StorageDocument document = toStorage(record);
        String id = runner.run("index", () -> client.indexDocument(name, document));
        log.debug("[ES] Upserted document id={} collection={}", id, name);
        return toKey(id);
    }

    @Override
    public List<K> upsert(Collection<R> records) {
        Objects.requireNonNull(records, "records");
        ensureOpen();
        if (records.isEmpty()) {
            return List.of();
        }
        List<StorageDocument> documents = new ArrayList<>(records.size());
        for (R record : records) {
            documents.add(toStorage(Objects.requireNonNull(record, "record")));
        }
        List<String> ids = runner.run("bulk", () -> client.bulkIndex(name, documents));
        log.debug("[ES] Upserted {} documents collection={}", ids.size(), name);
        return ids.stream().map(this::toKey).toList();
    }

    @Override
    public void delete(K key) {
        Objects.requireNonNull(key, "key");
        ensureOpen();
        String id = KeyCodec.toStorageId(key);
        runner.runIgnoringNotFound("delete", () -> client.deleteDocument(name, id));
    }

    @Override
    public void delete(Collection<K> keys) {
        Objects.requireNonNull(keys, "keys");
        ensureOpen();
        if (keys.isEmpty()) {
            return;
        }
        List<String> ids = keys.stream().map(KeyCodec::toStorageId).toList();
        runner.execute("bulk", () -> client.bulkDelete(name, ids));
    }

    @Override
    public Stream<VectorSearchResult<R>> search(Object searchInput, int top, VectorSearchOptions options) {
        Objects.requireNonNull(searchInput, "searchInput");
        requirePositiveTop(top);
        ensureOpen();
        VectorSearchOptions effective = options == null ? VectorSearchOptions.defaults() : options;
        rejectGeneratedVectors(effective.includeVectors());
        VectorPropertyModel vectorProperty = model.vectorPropertyOrSingle(effective.vectorProperty());
        float[] queryVector = resolveQueryVector(searchInput, vectorProperty);
        SearchRequest request = requestFactory.vectorSearch(vectorProperty, queryVector, top, effective);
        List<SearchHit> hits = runner.run("search", () -> client.search(name, request));
        return toResults(hits, effective.includeVectors());
    }

    @Override
    public Stream<VectorSearchResult<R>> hybridSearch(
            Object searchInput, Collection<String> keywords, int top, HybridSearchOptions options) {
        Objects.requireNonNull(searchInput, "searchInput");
        Objects.requireNonNull(keywords, "keywords");
        requirePositiveTop(top);
        ensureOpen();
        HybridSearchOptions effective = options == null ? HybridSearchOptions.defaults() : options;
        rejectGeneratedVectors(effective.includeVectors());
        VectorPropertyModel vectorProperty = model.vectorPropertyOrSingle(effective.vectorProperty());
        DataPropertyModel textProperty = model.fullTextDataPropertyOrSingle(effective.textProperty());
        float[] queryVector = resolveQueryVector(searchInput, vectorProperty);
        HybridSearchRequest request =
                requestFactory.hybridSearch(vectorProperty, textProperty, queryVector, keywords, top, effective);
        List<SearchHit> hits = runner.run("search", () -> client.hybridSearch(name, request));
        return toResults(hits, effective.includeVectors());
    }

    /** Releases this collection's reference to the shared client; later calls are no-ops. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            sharedClient.release();
        }
    }

    private StorageDocument toStorage(R record) {
        if (model.keyProperty().readValue(record) == null && model.keyProperty().rawType() != String.class) {
            throw new IllegalArgumentException("Record key '" + model.keyProperty().modelName()
                    + "' must be set; only String keys can be assigned by the store");
        }
        return mapper.toStorage(record, generateEmbeddings(record));
    }

    private float[][] generateEmbeddings(R record) {
        List<VectorPropertyModel> vectorProperties = model.vectorProperties();
        float[][] generated = null;
        for (int index = 0; index < vectorProperties.size(); index++) {
            VectorPropertyModel vectorProperty = vectorProperties.get(index);
            if (!vectorProperty.requiresEmbeddingGeneration()) {
                continue;
            }
            Object input = vectorProperty.readValue(record);
            if (input == null) {
                continue;
            }
            runner.checkCancelled("embed");
            float[] embedding = vectorProperty
                    .embeddingGenerator()
                    .orElseThrow(() -> new NoEmbeddingGeneratorException(
                            "Vector property '" + vectorProperty.modelName() + "' has no embedding generator"))
                    .generateFromObject(input, vectorProperty.dimensions());
            if (generated == null) {
                generated = new float[vectorProperties.size()][];
            }
            generated[index] = embedding;
        }
        return generated;
    }

    private float[] resolveQueryVector(Object searchInput, VectorPropertyModel vectorProperty) {
        runner.checkCancelled("embed");
        return QueryVectorResolver.resolve(searchInput, vectorProperty);
    }

    private Stream<VectorSearchResult<R>> toResults(List<SearchHit> hits, boolean includeVectors) {
        return hits.stream()
                .map(hit -> new VectorSearchResult<>(mapper.fromStorage(hit.toDocument(), includeVectors), hit.score()));
    }

    @SuppressWarnings("unchecked")
    private K toKey(String id) {
        return (K) KeyCodec.fromStorageId(id, model.keyProperty().rawType());
    }

    private void rejectGeneratedVectors(boolean includeVectors) {
        if (includeVectors && model.hasEmbeddingGenerators()) {
            throw new UnsupportedCombinationException("Collection " + name
                    + " cannot return vectors because its vector properties use embedding generators");
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Collection " + name + " is closed");
        }
    }

    private static void requirePositiveTop(int top) {
        if (top < 1) {
            throw new IllegalArgumentException("top must be at least 1");
        }
    }
}
