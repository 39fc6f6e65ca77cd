package com.williamcallahan.esvector.search;

import com.williamcallahan.esvector.domain.errors.IncompatibleEmbeddingGeneratorException;
import com.williamcallahan.esvector.domain.errors.NoEmbeddingGeneratorException;
import com.williamcallahan.esvector.embedding.EmbeddingGenerator;
import com.williamcallahan.esvector.model.VectorPropertyModel;
import com.williamcallahan.esvector.model.VectorTypes;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a search input into the numeric query vector for one vector property.
 */
public final class QueryVectorResolver {

    private QueryVectorResolver() {}

    /**
     * Uses numeric inputs directly and embeds anything else with the property's generator.
     *
     * @param searchInput numeric vector or generator input such as text
     * @param vectorProperty resolved vector property
     * @return query vector with the property's dimensions
     */
    public static float[] resolve(Object searchInput, VectorPropertyModel vectorProperty) {
        Objects.requireNonNull(searchInput, "searchInput");
        Optional<float[]> numericInput = VectorTypes.toFloatArray(searchInput);
        float[] queryVector;
        if (numericInput.isPresent()) {
            queryVector = numericInput.get();
        } else {
            EmbeddingGenerator<?> generator = vectorProperty
                    .embeddingGenerator()
                    .orElseThrow(() -> new NoEmbeddingGeneratorException("Search input of type "
                            + searchInput.getClass().getName() + " is not a vector and vector property '"
                            + vectorProperty.modelName() + "' has no embedding generator configured"));
            if (!generator.accepts(searchInput.getClass())) {
                throw new IncompatibleEmbeddingGeneratorException("Embedding generator of vector property '"
                        + vectorProperty.modelName() + "' accepts " + generator.inputType().getName()
                        + " but the search input is " + searchInput.getClass().getName());
            }
            queryVector = generator.generateFromObject(searchInput, vectorProperty.dimensions());
        }
        if (queryVector.length != vectorProperty.dimensions()) {
            throw new IllegalArgumentException("Query vector has " + queryVector.length
                    + " dimensions but vector property '" + vectorProperty.modelName() + "' expects "
                    + vectorProperty.dimensions());
        }
        return queryVector;
    }
}
