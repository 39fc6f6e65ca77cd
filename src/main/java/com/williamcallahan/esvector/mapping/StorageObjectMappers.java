package com.williamcallahan.esvector.mapping;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import org.springframework.ai.embedding.Embedding;

/**
 * Creates the Jackson mapper used for document bodies.
 *
 * <p>Dates are written as ISO-8601 strings so they index as {@code date} fields, and Spring AI
 * {@link Embedding} values are written as the flat float array a dense vector field expects.</p>
 */
public final class StorageObjectMappers {

    private StorageObjectMappers() {}

    /**
     * Creates a mapper that keeps Java property names as storage names.
     *
     * @return configured mapper
     */
    public static ObjectMapper create() {
        return create(null);
    }

    /**
     * Creates a mapper applying the given naming strategy to every typed record.
     *
     * @param namingStrategy storage naming strategy, or {@code null} to keep property names
     * @return configured mapper
     */
    public static ObjectMapper create(PropertyNamingStrategy namingStrategy) {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(embeddingModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        if (namingStrategy != null) {
            objectMapper.setPropertyNamingStrategy(namingStrategy);
        }
        return objectMapper;
    }

    static SimpleModule embeddingModule() {
        SimpleModule module = new SimpleModule("EmbeddingVectorModule");
        module.addSerializer(Embedding.class, new EmbeddingSerializer());
        module.addDeserializer(Embedding.class, new EmbeddingDeserializer());
        return module;
    }

    private static final class EmbeddingSerializer extends JsonSerializer<Embedding> {
        @Override
        public void serialize(Embedding embedding, JsonGenerator generator, SerializerProvider serializers)
                throws IOException {
            generator.writeStartArray();
            for (float component : embedding.getOutput()) {
                generator.writeNumber(component);
            }
            generator.writeEndArray();
        }
    }

    private static final class EmbeddingDeserializer extends JsonDeserializer<Embedding> {
        @Override
        public Embedding deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            float[] vector = parser.readValueAs(float[].class);
            return new Embedding(vector, 0);
        }
    }
}
