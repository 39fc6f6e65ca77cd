package com.williamcallahan.esvector.model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.reflect.TypeToken;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.Embedding;

/**
 * Verifies recognition and conversion of numeric vector shapes.
 */
class VectorTypesTest {

    @Test
    void recognizesNativeVectorTypes() {
        assertTrue(VectorTypes.isNativeVectorType(float[].class));
        assertTrue(VectorTypes.isNativeVectorType(Float[].class));
        assertTrue(VectorTypes.isNativeVectorType(Embedding.class));
        assertTrue(VectorTypes.isNativeVectorType(new TypeToken<List<Float>>() {}.getType()));
        assertFalse(VectorTypes.isNativeVectorType(new TypeToken<List<Double>>() {}.getType()));
        assertFalse(VectorTypes.isNativeVectorType(String.class));
        assertFalse(VectorTypes.isNativeVectorType(double[].class));
    }

    @Test
    void convertsRuntimeValuesToFloatArrays() {
        assertArrayEquals(new float[] {1f, 2f}, VectorTypes.toFloatArray(new Float[] {1f, 2f}).orElseThrow());
        assertArrayEquals(new float[] {1f, 2f}, VectorTypes.toFloatArray(List.of(1, 2.0)).orElseThrow());
        assertArrayEquals(
                new float[] {0.5f}, VectorTypes.toFloatArray(new Embedding(new float[] {0.5f}, 0)).orElseThrow());
        assertTrue(VectorTypes.toFloatArray("not a vector").isEmpty());
        assertTrue(VectorTypes.toFloatArray(List.of("a")).isEmpty());
    }

    @Test
    void rebuildsDeclaredVectorType() {
        float[] vector = {0.25f, 0.75f};

        assertArrayEquals(vector, (float[]) VectorTypes.fromFloatArray(vector, float[].class));
        assertArrayEquals(new Float[] {0.25f, 0.75f}, (Float[]) VectorTypes.fromFloatArray(vector, Float[].class));
        assertEquals(List.of(0.25f, 0.75f), VectorTypes.fromFloatArray(vector, new TypeToken<List<Float>>() {}.getType()));
        assertArrayEquals(vector, ((Embedding) VectorTypes.fromFloatArray(vector, Embedding.class)).getOutput());
    }
}
