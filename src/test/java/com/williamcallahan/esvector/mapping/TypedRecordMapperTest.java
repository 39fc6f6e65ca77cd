package com.williamcallahan.esvector.mapping;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.esvector.domain.errors.VectorStoreException;
import com.williamcallahan.esvector.fixtures.Article;
import com.williamcallahan.esvector.fixtures.FakeTextEmbeddingGenerator;
import com.williamcallahan.esvector.fixtures.Review;
import com.williamcallahan.esvector.fixtures.Sensor;
import com.williamcallahan.esvector.model.CollectionModelBuilder;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.Embedding;

/**
 * Verifies typed records convert to stored documents and back.
 */
class TypedRecordMapperTest {

    private static final UUID REVIEW_ID = UUID.fromString("3b241101-e2bb-4255-8caf-4136c566a962");

    private final ObjectMapper objectMapper = StorageObjectMappers.create();

    private TypedRecordMapper<Review> reviewMapper() {
        return new TypedRecordMapper<>(
                new CollectionModelBuilder(objectMapper).build(Review.class, null, null), Review.class, objectMapper);
    }

    @Test
    void keyTravelsAsIdentifierNotBodyField() {
        Review review = new Review(
                REVIEW_ID, 4, Instant.parse("2024-05-01T10:15:30Z"), "Great", new Embedding(new float[] {1, 2, 3, 4}, 0));

        StorageDocument document = reviewMapper().toStorage(review, null);

        assertEquals(REVIEW_ID.toString(), document.id());
        assertFalse(document.body().has("reviewId"));
        assertEquals(4, document.body().get("review_rating").asInt());
        assertEquals("2024-05-01T10:15:30Z", document.body().get("createdAt").asText());
        assertEquals(4, document.body().get("bodyEmbedding").size());
    }

    @Test
    void restoresKeyAndOptionallyVectors() {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("review_rating", 5).put("createdAt", "2024-05-01T10:15:30Z").put("body", "Lovely");
        body.putArray("bodyEmbedding").add(0.5f).add(0.5f).add(0f).add(1f);
        StorageDocument document = new StorageDocument(REVIEW_ID.toString(), body);

        Review withoutVector = reviewMapper().fromStorage(document, false);
        Review withVector = reviewMapper().fromStorage(document, true);

        assertEquals(REVIEW_ID, withoutVector.reviewId());
        assertEquals(5, withoutVector.rating());
        assertEquals(Instant.parse("2024-05-01T10:15:30Z"), withoutVector.createdAt());
        assertNull(withoutVector.bodyEmbedding());
        assertArrayEquals(new float[] {0.5f, 0.5f, 0f, 1f}, withVector.bodyEmbedding().getOutput());
        assertTrue(body.has("bodyEmbedding"));
    }

    @Test
    void boxedAndCollectionVectorsRoundTrip() {
        TypedRecordMapper<Sensor> mapper = new TypedRecordMapper<>(
                new CollectionModelBuilder(objectMapper).build(Sensor.class, null, null), Sensor.class, objectMapper);
        Sensor sensor = new Sensor(
                12L,
                "north",
                new Float[] {0.25f, -1f},
                List.of(3f, 4.5f),
                new ArrayList<>(List.of(-0.5f, 8f)));

        StorageDocument document = mapper.toStorage(sensor, null);
        Sensor restored = mapper.fromStorage(document, true);

        assertEquals("12", document.id());
        assertEquals(2, document.body().get("listReading").size());
        assertEquals(12L, restored.sensorId());
        assertEquals("north", restored.label());
        assertArrayEquals(new Float[] {0.25f, -1f}, restored.boxedReading());
        assertEquals(List.of(3f, 4.5f), restored.listReading());
        assertEquals(List.of(-0.5f, 8f), new ArrayList<>(restored.collectionReading()));
    }

    @Test
    void generatedVectorsReplaceGeneratorInput() {
        TypedRecordMapper<Article> mapper = new TypedRecordMapper<>(
                new CollectionModelBuilder(objectMapper).build(Article.class, null, new FakeTextEmbeddingGenerator()),
                Article.class,
                objectMapper);
        Article article = new Article(9L, "Title", "summary text");

        StorageDocument generated = mapper.toStorage(article, new float[][] {{1f, 2f, 3f}});
        StorageDocument notGenerated = mapper.toStorage(article, null);

        assertEquals("9", generated.id());
        assertTrue(generated.body().get("summary").isArray());
        assertFalse(notGenerated.body().has("summary"));
        assertNull(mapper.fromStorage(generated, false).summary());
    }

    @Test
    void unreadableDocumentsFailWithStoreError() {
        ObjectNode body = objectMapper.createObjectNode().put("review_rating", "not a number");

        assertThrows(
                VectorStoreException.class,
                () -> reviewMapper().fromStorage(new StorageDocument(REVIEW_ID.toString(), body), false));
    }
}
