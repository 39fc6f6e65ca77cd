package com.williamcallahan.esvector.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableSet;
import com.google.common.reflect.TypeToken;
import com.williamcallahan.esvector.domain.errors.UnsupportedConfigurationException;
import com.williamcallahan.esvector.fixtures.Hotel;
import com.williamcallahan.esvector.fixtures.Review;
import com.williamcallahan.esvector.model.CollectionDefinition;
import com.williamcallahan.esvector.model.CollectionModel;
import com.williamcallahan.esvector.model.CollectionModelBuilder;
import com.williamcallahan.esvector.model.DistanceFunction;
import com.williamcallahan.esvector.model.IndexKind;
import com.williamcallahan.esvector.model.PropertyDefinition;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Verifies Elasticsearch field mappings derived from collection models.
 */
class IndexSchemaBuilderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CollectionModelBuilder modelBuilder = new CollectionModelBuilder(StorageObjectMappers.create());

    @Test
    void vectorFieldUsesDeclaredDimensionsAndDefaults() throws Exception {
        IndexSchema schema = IndexSchemaBuilder.build(modelBuilder.build(Hotel.class, null, null));

        JsonNode expected = objectMapper.readTree("{\"type\":\"dense_vector\",\"dims\":3,\"index\":true,"
                + "\"similarity\":\"cosine\",\"index_options\":{\"type\":\"int8_hnsw\"}}");
        assertEquals(expected, schema.properties().get("embedding"));
    }

    @Test
    void dataFieldsMapByIndexingMode() {
        IndexSchema schema = IndexSchemaBuilder.build(modelBuilder.build(Hotel.class, null, null));

        assertEquals("keyword", schema.properties().get("category").get("type").asText());
        assertEquals("keyword", schema.properties().get("tags").get("type").asText());
        assertEquals("text", schema.properties().get("description").get("type").asText());
        assertEquals("integer", schema.properties().get("score").get("type").asText());
        assertEquals("boolean", schema.properties().get("open").get("type").asText());
    }

    @Test
    void keyNeverAppearsInMappings() {
        IndexSchema schema = IndexSchemaBuilder.build(modelBuilder.build(Review.class, null, null));

        assertEquals(
                Set.of("review_rating", "createdAt", "body", "bodyEmbedding"),
                ImmutableSet.copyOf(schema.properties().fieldNames()));
        assertEquals("date", schema.properties().get("createdAt").get("type").asText());
        assertEquals(false, schema.properties().get("body").get("index").asBoolean());
        assertEquals("dot_product", schema.properties().get("bodyEmbedding").get("similarity").asText());
        assertEquals("hnsw", schema.properties().get("bodyEmbedding").get("index_options").get("type").asText());
    }

    @Test
    void createIndexBodyWrapsPropertiesInMappings() {
        IndexSchema schema = IndexSchemaBuilder.build(modelBuilder.build(Hotel.class, null, null));

        assertEquals(schema.properties(), schema.toCreateIndexBody().get("mappings").get("properties"));
    }

    @Test
    void exactMatchTypesUnwrapContainers() {
        assertEquals("long", IndexSchemaBuilder.exactMatchType(long[].class));
        assertEquals("unsigned_long", IndexSchemaBuilder.exactMatchType(BigInteger.class));
        assertEquals("date", IndexSchemaBuilder.exactMatchType(new TypeToken<List<LocalDate>>() {}.getType()));
        assertEquals("double", IndexSchemaBuilder.exactMatchType(new TypeToken<Set<Double>>() {}.getType()));
        assertEquals("keyword", IndexSchemaBuilder.exactMatchType(Object.class));
    }

    @Test
    void rejectsDistanceFunctionWithoutElasticsearchEquivalent() {
        CollectionModel model = modelBuilder.buildDynamic(
                CollectionDefinition.of(
                        PropertyDefinition.key("id", String.class),
                        PropertyDefinition.vector("embedding", float[].class, 4)
                                .withDistanceFunction(DistanceFunction.MANHATTAN_DISTANCE)),
                null);

        assertThrows(UnsupportedConfigurationException.class, () -> IndexSchemaBuilder.build(model));
    }

    @Test
    void rejectsIndexKindWithoutElasticsearchEquivalent() {
        CollectionModel model = modelBuilder.buildDynamic(
                CollectionDefinition.of(
                        PropertyDefinition.key("id", String.class),
                        PropertyDefinition.vector("embedding", float[].class, 4).withIndexKind(IndexKind.DISK_ANN)),
                null);

        assertThrows(UnsupportedConfigurationException.class, () -> IndexSchemaBuilder.build(model));
    }

    @Test
    void binaryQuantizationRequiresEnoughDimensions() {
        CollectionModel small = modelBuilder.buildDynamic(
                CollectionDefinition.of(
                        PropertyDefinition.key("id", String.class),
                        PropertyDefinition.vector("embedding", float[].class, 32).withIndexKind(IndexKind.BBQ_HNSW)),
                null);
        CollectionModel large = modelBuilder.buildDynamic(
                CollectionDefinition.of(
                        PropertyDefinition.key("id", String.class),
                        PropertyDefinition.vector("embedding", float[].class, 64).withIndexKind(IndexKind.BBQ_FLAT)),
                null);

        assertThrows(UnsupportedConfigurationException.class, () -> IndexSchemaBuilder.build(small));
        assertEquals(
                "bbq_flat",
                IndexSchemaBuilder.build(large).properties().get("embedding").get("index_options").get("type").asText());
    }
}
