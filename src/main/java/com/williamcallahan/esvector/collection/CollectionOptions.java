package com.williamcallahan.esvector.collection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.esvector.embedding.EmbeddingGenerator;
import com.williamcallahan.esvector.mapping.StorageObjectMappers;
import com.williamcallahan.esvector.model.CollectionDefinition;
import com.williamcallahan.esvector.search.SearchSettings;
import java.util.Objects;

/**
 * Construction options of a collection.
 *
 * @param definition explicit definition, required for dynamic collections and optional otherwise
 * @param embeddingGenerator default generator for vector properties without their own, or {@code null}
 * @param objectMapper storage mapper; its naming strategy is the default storage-name policy
 * @param searchSettings nearest-neighbour and fusion tuning
 */
public record CollectionOptions(
        CollectionDefinition definition,
        EmbeddingGenerator<?> embeddingGenerator,
        ObjectMapper objectMapper,
        SearchSettings searchSettings) {

    public CollectionOptions {
        Objects.requireNonNull(objectMapper, "objectMapper");
        Objects.requireNonNull(searchSettings, "searchSettings");
    }

    public static CollectionOptions defaults() {
        return new CollectionOptions(null, null, StorageObjectMappers.create(), SearchSettings.defaults());
    }

    public CollectionOptions withDefinition(CollectionDefinition collectionDefinition) {
        return new CollectionOptions(collectionDefinition, embeddingGenerator, objectMapper, searchSettings);
    }

    public CollectionOptions withEmbeddingGenerator(EmbeddingGenerator<?> generator) {
        return new CollectionOptions(definition, generator, objectMapper, searchSettings);
    }

    public CollectionOptions withObjectMapper(ObjectMapper mapper) {
        return new CollectionOptions(definition, embeddingGenerator, mapper, searchSettings);
    }

    public CollectionOptions withSearchSettings(SearchSettings settings) {
        return new CollectionOptions(definition, embeddingGenerator, objectMapper, settings);
    }
}
