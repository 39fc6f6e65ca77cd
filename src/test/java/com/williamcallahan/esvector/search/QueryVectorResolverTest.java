package com.williamcallahan.esvector.search;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.esvector.domain.errors.IncompatibleEmbeddingGeneratorException;
import com.williamcallahan.esvector.domain.errors.NoEmbeddingGeneratorException;
import com.williamcallahan.esvector.fixtures.FakeTextEmbeddingGenerator;
import com.williamcallahan.esvector.mapping.StorageObjectMappers;
import com.williamcallahan.esvector.model.CollectionDefinition;
import com.williamcallahan.esvector.model.CollectionModelBuilder;
import com.williamcallahan.esvector.model.PropertyDefinition;
import com.williamcallahan.esvector.model.VectorPropertyModel;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies query vectors are taken as-is or produced by the property's generator.
 */
class QueryVectorResolverTest {

    private static VectorPropertyModel vectorProperty(FakeTextEmbeddingGenerator generator) {
        return new CollectionModelBuilder(StorageObjectMappers.create())
                .buildDynamic(
                        CollectionDefinition.of(
                                PropertyDefinition.key("id", String.class),
                                PropertyDefinition.vector("embedding", float[].class, 3, generator)),
                        null)
                .vectorPropertyOrSingle(null);
    }

    @Test
    void numericInputIsUsedDirectly() {
        FakeTextEmbeddingGenerator generator = new FakeTextEmbeddingGenerator();

        float[] resolved = QueryVectorResolver.resolve(List.of(1, 2, 3), vectorProperty(generator));

        assertArrayEquals(new float[] {1f, 2f, 3f}, resolved);
        assertEquals(List.of(), generator.inputs());
    }

    @Test
    void textInputIsEmbedded() {
        FakeTextEmbeddingGenerator generator = new FakeTextEmbeddingGenerator();

        float[] resolved = QueryVectorResolver.resolve("hello", vectorProperty(generator));

        assertArrayEquals(new float[] {5f, 6f, 7f}, resolved);
        assertEquals(List.of("hello"), generator.inputs());
    }

    @Test
    void nonVectorInputWithoutGeneratorFails() {
        assertThrows(NoEmbeddingGeneratorException.class, () -> QueryVectorResolver.resolve("hello", vectorProperty(null)));
    }

    @Test
    void inputOfUnacceptedTypeFails() {
        assertThrows(
                IncompatibleEmbeddingGeneratorException.class,
                () -> QueryVectorResolver.resolve(42, vectorProperty(new FakeTextEmbeddingGenerator())));
    }

    @Test
    void dimensionMismatchFails() {
        assertThrows(
                IllegalArgumentException.class,
                () -> QueryVectorResolver.resolve(new float[] {1f, 2f}, vectorProperty(null)));
    }
}
