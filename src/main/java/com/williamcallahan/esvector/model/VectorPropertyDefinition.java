package com.williamcallahan.esvector.model;

import com.williamcallahan.esvector.embedding.EmbeddingGenerator;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Describes a vector property and its index configuration.
 *
 * @param name model name
 * @param type declared type, either a numeric vector type or an input type for the embedding generator
 * @param dimensions vector dimensions
 * @param distanceFunction requested distance function or {@code null} for the default
 * @param indexKind requested index kind or {@code null} for the default
 * @param storageName explicit storage name or {@code null}
 * @param embeddingGenerator property-level embedding generator or {@code null}
 */
public record VectorPropertyDefinition(
        String name,
        Type type,
        int dimensions,
        DistanceFunction distanceFunction,
        IndexKind indexKind,
        String storageName,
        EmbeddingGenerator<?> embeddingGenerator)
        implements PropertyDefinition {

    public VectorPropertyDefinition {
        Objects.requireNonNull(name, "name");
    }

    public VectorPropertyDefinition withDistanceFunction(DistanceFunction requestedFunction) {
        return new VectorPropertyDefinition(
                name, type, dimensions, requestedFunction, indexKind, storageName, embeddingGenerator);
    }

    public VectorPropertyDefinition withIndexKind(IndexKind requestedKind) {
        return new VectorPropertyDefinition(
                name, type, dimensions, distanceFunction, requestedKind, storageName, embeddingGenerator);
    }

    public VectorPropertyDefinition withEmbeddingGenerator(EmbeddingGenerator<?> generator) {
        return new VectorPropertyDefinition(
                name, type, dimensions, distanceFunction, indexKind, storageName, generator);
    }

    public VectorPropertyDefinition storedAs(String explicitStorageName) {
        return new VectorPropertyDefinition(
                name, type, dimensions, distanceFunction, indexKind, explicitStorageName, embeddingGenerator);
    }
}
