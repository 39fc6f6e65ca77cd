package com.williamcallahan.esvector.embedding;

import com.williamcallahan.esvector.domain.errors.EmbeddingGenerationException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Text embedding generator backed by a Spring AI {@link EmbeddingModel}.
 *
 * <p>Fails fast when the provider errors or returns a vector whose length differs from the
 * dimensions declared on the vector property, so no mismatched vector is ever written.</p>
 */
public class SpringAiEmbeddingGenerator implements EmbeddingGenerator<String> {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingGenerator.class);

    private final EmbeddingModel embeddingModel;

    /**
     * Creates a generator delegating to the given embedding model.
     *
     * @param embeddingModel Spring AI embedding model
     */
    public SpringAiEmbeddingGenerator(EmbeddingModel embeddingModel) {
        this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
    }

    @Override
    public Class<String> inputType() {
        return String.class;
    }

    @Override
    public float[] generate(String input, int dimensions) {
        String safeInput = Objects.requireNonNullElse(input, "");
        float[] embeddingVector;
        try {
            embeddingVector = embeddingModel.embed(safeInput);
        } catch (RuntimeException providerFailure) {
            throw new EmbeddingGenerationException(
                    "Embedding provider failed: " + providerFailure.getMessage(), providerFailure);
        }
        if (embeddingVector == null || embeddingVector.length == 0) {
            throw new EmbeddingGenerationException("Embedding provider returned an empty vector");
        }
        if (dimensions > 0 && embeddingVector.length != dimensions) {
            throw new EmbeddingGenerationException("Embedding dimension mismatch: expected " + dimensions
                    + " but received " + embeddingVector.length);
        }
        log.debug("[EMBEDDING] Generated vector of dimension {}", embeddingVector.length);
        return embeddingVector;
    }
}
