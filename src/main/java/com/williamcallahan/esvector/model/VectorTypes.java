package com.williamcallahan.esvector.model;

import com.google.common.primitives.Floats;
import com.google.common.reflect.TypeToken;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.ai.embedding.Embedding;

/**
 * Recognizes and converts the numeric vector shapes that can be stored without embedding generation.
 */
public final class VectorTypes {

    public static final String SUPPORTED_TYPES =
            "float[], Float[], List<Float>, Collection<Float>, " + Embedding.class.getName();

    private VectorTypes() {}

    /**
     * Returns true when the declared type is stored as-is in a dense vector field.
     *
     * @param type declared vector property type
     * @return true for numeric vector shapes
     */
    public static boolean isNativeVectorType(Type type) {
        if (type == null) {
            return false;
        }
        Class<?> rawType = TypeToken.of(type).getRawType();
        if (rawType == float[].class || rawType == Float[].class || rawType == Embedding.class) {
            return true;
        }
        if (rawType != List.class && rawType != Collection.class) {
            return false;
        }
        return type instanceof ParameterizedType parameterized
                && parameterized.getActualTypeArguments()[0] == Float.class;
    }

    /**
     * Converts a runtime value to a float array when it is one of the numeric vector shapes.
     *
     * @param value candidate vector
     * @return the numeric vector, or empty when the value is not numeric
     */
    public static Optional<float[]> toFloatArray(Object value) {
        if (value instanceof float[] floats) {
            return Optional.of(floats);
        }
        if (value instanceof Float[] boxed) {
            float[] floats = new float[boxed.length];
            for (int index = 0; index < boxed.length; index++) {
                floats[index] = boxed[index] == null ? 0f : boxed[index];
            }
            return Optional.of(floats);
        }
        if (value instanceof Embedding embedding) {
            return Optional.ofNullable(embedding.getOutput());
        }
        if (value instanceof Collection<?> elements) {
            for (Object element : elements) {
                if (!(element instanceof Number)) {
                    return Optional.empty();
                }
            }
            List<Number> numbers = new ArrayList<>(elements.size());
            for (Object element : elements) {
                numbers.add((Number) element);
            }
            return Optional.of(Floats.toArray(numbers));
        }
        return Optional.empty();
    }

    /**
     * Rebuilds a value of the declared vector type from a stored float array.
     *
     * @param vector stored vector
     * @param targetType declared vector property type
     * @return value assignable to the declared type
     */
    public static Object fromFloatArray(float[] vector, Type targetType) {
        Class<?> rawType = TypeToken.of(targetType).getRawType();
        if (rawType == float[].class) {
            return vector;
        }
        if (rawType == Embedding.class) {
            return new Embedding(vector, 0);
        }
        if (rawType == Float[].class) {
            Float[] boxed = new Float[vector.length];
            for (int index = 0; index < vector.length; index++) {
                boxed[index] = vector[index];
            }
            return boxed;
        }
        return new ArrayList<>(Floats.asList(vector));
    }
}
