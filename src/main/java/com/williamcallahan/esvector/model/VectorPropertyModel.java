package com.williamcallahan.esvector.model;

import com.williamcallahan.esvector.embedding.EmbeddingGenerator;
import java.lang.reflect.Type;
import java.util.Objects;
import java.util.Optional;

/**
 * An embedding property stored as a dense vector.
 */
public final class VectorPropertyModel extends PropertyModel {

    private final int dimensions;
    private final DistanceFunction distanceFunction;
    private final IndexKind indexKind;
    private final EmbeddingGenerator<?> embeddingGenerator;

    public VectorPropertyModel(
            String modelName,
            String storageName,
            Type type,
            PropertyReader reader,
            int dimensions,
            DistanceFunction distanceFunction,
            IndexKind indexKind,
            EmbeddingGenerator<?> embeddingGenerator) {
        super(modelName, storageName, type, reader);
        this.dimensions = dimensions;
        this.distanceFunction = Objects.requireNonNull(distanceFunction, "distanceFunction");
        this.indexKind = Objects.requireNonNull(indexKind, "indexKind");
        this.embeddingGenerator = embeddingGenerator;
    }

    public int dimensions() {
        return dimensions;
    }

    public DistanceFunction distanceFunction() {
        return distanceFunction;
    }

    public IndexKind indexKind() {
        return indexKind;
    }

    public Optional<EmbeddingGenerator<?>> embeddingGenerator() {
        return Optional.ofNullable(embeddingGenerator);
    }

    /**
     * Returns true when the declared type is not a numeric vector, so stored values come from the generator.
     *
     * @return true when upsert must generate the stored vector
     */
    public boolean requiresEmbeddingGeneration() {
        return !VectorTypes.isNativeVectorType(type());
    }
}
