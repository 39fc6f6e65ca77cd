package com.williamcallahan.esvector.fixtures;

import com.williamcallahan.esvector.embedding.EmbeddingGenerator;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic text generator recording every input it embeds.
 */
public class FakeTextEmbeddingGenerator implements EmbeddingGenerator<String> {

    private final List<String> inputs = new ArrayList<>();

    @Override
    public Class<String> inputType() {
        return String.class;
    }

    @Override
    public float[] generate(String input, int dimensions) {
        inputs.add(input);
        float[] vector = new float[dimensions];
        for (int index = 0; index < dimensions; index++) {
            vector[index] = input.length() + index;
        }
        return vector;
    }

    public List<String> inputs() {
        return inputs;
    }
}
