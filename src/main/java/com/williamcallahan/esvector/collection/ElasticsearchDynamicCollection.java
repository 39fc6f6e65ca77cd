package com.williamcallahan.esvector.collection;

import com.williamcallahan.esvector.client.DocumentStoreClient;
import com.williamcallahan.esvector.client.SharedDocumentStoreClient;
import com.williamcallahan.esvector.mapping.DynamicRecordMapper;
import com.williamcallahan.esvector.model.CollectionModel;
import com.williamcallahan.esvector.model.CollectionModelBuilder;
import java.util.Map;
import java.util.Objects;

/**
 * Collection of schemaless records represented as {@code Map<String, Object>} keyed by model name.
 *
 * <p>The options must carry a {@link com.williamcallahan.esvector.model.CollectionDefinition}; keys are
 * whatever type the definition's key property declares.</p>
 */
public class ElasticsearchDynamicCollection extends ElasticsearchCollection<Object, Map<String, Object>> {

    /**
     * Creates a dynamic collection sharing a store client.
     *
     * @param sharedClient shared backing-store client; this collection takes one reference
     * @param name index name
     * @param options construction options including the definition
     */
    public ElasticsearchDynamicCollection(SharedDocumentStoreClient sharedClient, String name, CollectionOptions options) {
        this(sharedClient, name, dynamicModel(options), options);
    }

    /**
     * Creates a dynamic collection over a caller-managed client.
     *
     * @param client backing-store client, never closed by this collection
     * @param name index name
     * @param options construction options including the definition
     */
    public ElasticsearchDynamicCollection(DocumentStoreClient client, String name, CollectionOptions options) {
        this(SharedDocumentStoreClient.borrowed(client), name, options);
    }

    private ElasticsearchDynamicCollection(
            SharedDocumentStoreClient sharedClient, String name, CollectionModel model, CollectionOptions options) {
        super(sharedClient, name, model, new DynamicRecordMapper(model, options.objectMapper()), options);
    }

    private static CollectionModel dynamicModel(CollectionOptions options) {
        Objects.requireNonNull(options, "options");
        return new CollectionModelBuilder(options.objectMapper())
                .buildDynamic(options.definition(), options.embeddingGenerator());
    }
}
