package com.williamcallahan.esvector.model;

import com.williamcallahan.esvector.embedding.EmbeddingGenerator;
import java.lang.reflect.Type;

/**
 * Explicit description of one record property, used for dynamic records and to override annotations.
 *
 * <p>A {@code null} storage name defers to the default naming policy.</p>
 */
public sealed interface PropertyDefinition
        permits KeyPropertyDefinition, DataPropertyDefinition, VectorPropertyDefinition {

    /**
     * Returns the application-facing property name.
     *
     * @return model name
     */
    String name();

    /**
     * Returns the declared property type.
     *
     * @return declared type, may be {@code null} for static records where the field type is used
     */
    Type type();

    /**
     * Returns the explicitly requested storage name.
     *
     * @return storage name or {@code null}
     */
    String storageName();

    static KeyPropertyDefinition key(String name, Type type) {
        return new KeyPropertyDefinition(name, type, null);
    }

    static DataPropertyDefinition data(String name, Type type) {
        return new DataPropertyDefinition(name, type, false, false, null);
    }

    static VectorPropertyDefinition vector(String name, Type type, int dimensions) {
        return new VectorPropertyDefinition(name, type, dimensions, null, null, null, null);
    }

    static VectorPropertyDefinition vector(
            String name, Type type, int dimensions, EmbeddingGenerator<?> embeddingGenerator) {
        return new VectorPropertyDefinition(name, type, dimensions, null, null, null, embeddingGenerator);
    }
}
