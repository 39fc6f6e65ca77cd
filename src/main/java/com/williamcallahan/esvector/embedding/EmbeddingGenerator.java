package com.williamcallahan.esvector.embedding;

import com.google.common.primitives.Primitives;

/**
 * Defines the embedding port used for upsert-time and query-time vector generation.
 *
 * <p>A generator is keyed by the input type it accepts; vector properties whose declared type is
 * not a numeric vector store the generator's output instead of the raw value.</p>
 *
 * @param <I> accepted input type, for example {@link String}
 */
public interface EmbeddingGenerator<I> {

    /**
     * Returns the input type this generator accepts.
     *
     * @return accepted input type
     */
    Class<I> inputType();

    /**
     * Produces a dense embedding vector for one input.
     *
     * @param input value to embed
     * @param dimensions expected vector dimensions, or {@code 0} when unconstrained
     * @return embedding vector
     */
    float[] generate(I input, int dimensions);

    /**
     * Returns true when values of the candidate type can be handed to this generator.
     *
     * @param candidateType declared or runtime input type
     * @return true when the type is accepted
     */
    default boolean accepts(Class<?> candidateType) {
        return candidateType != null && inputType().isAssignableFrom(Primitives.wrap(candidateType));
    }

    /**
     * Embeds an input whose static type is unknown to the caller.
     *
     * @param input value to embed, which must be an instance of {@link #inputType()}
     * @param dimensions expected vector dimensions, or {@code 0} when unconstrained
     * @return embedding vector
     */
    default float[] generateFromObject(Object input, int dimensions) {
        return generate(inputType().cast(input), dimensions);
    }
}
