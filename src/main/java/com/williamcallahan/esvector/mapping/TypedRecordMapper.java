package com.williamcallahan.esvector.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.esvector.domain.errors.SchemaException;
import com.williamcallahan.esvector.domain.errors.VectorStoreException;
import com.williamcallahan.esvector.model.CollectionModel;
import com.williamcallahan.esvector.model.KeyPropertyModel;
import com.williamcallahan.esvector.model.VectorPropertyModel;
import java.util.List;
import java.util.Objects;

/**
 * Maps statically typed records through Jackson tree conversion.
 *
 * <p>The record's own Jackson customizations (renames, inclusion rules, custom serializers) apply
 * unchanged; only the key and the vector fields are rewritten around the serializer.</p>
 *
 * @param <R> record type
 */
public final class TypedRecordMapper<R> implements RecordMapper<R> {

    private final CollectionModel model;
    private final Class<R> recordType;
    private final ObjectMapper objectMapper;

    public TypedRecordMapper(CollectionModel model, Class<R> recordType, ObjectMapper objectMapper) {
        this.model = Objects.requireNonNull(model, "model");
        this.recordType = Objects.requireNonNull(recordType, "recordType");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public StorageDocument toStorage(R record, float[][] generatedEmbeddings) {
        Objects.requireNonNull(record, "record");
        JsonNode tree = objectMapper.valueToTree(record);
        if (!(tree instanceof ObjectNode body)) {
            throw new SchemaException(recordType.getSimpleName() + " does not serialize to a JSON object");
        }
        KeyPropertyModel keyProperty = model.keyProperty();
        body.remove(keyProperty.storageName());
        Object key = keyProperty.readValue(record);
        String id = key == null ? null : KeyCodec.toStorageId(key);

        List<VectorPropertyModel> vectorProperties = model.vectorProperties();
        for (int index = 0; index < vectorProperties.size(); index++) {
            VectorPropertyModel vectorProperty = vectorProperties.get(index);
            float[] generated = generatedEmbeddings == null ? null : generatedEmbeddings[index];
            if (generated != null) {
                body.set(vectorProperty.storageName(), toArrayNode(generated));
            } else if (vectorProperty.requiresEmbeddingGeneration()) {
                // raw generator input never lands in a dense_vector field
                body.remove(vectorProperty.storageName());
            }
        }
        return new StorageDocument(id, body);
    }

    @Override
    public R fromStorage(StorageDocument document, boolean includeVectors) {
        ObjectNode body = document.body().deepCopy();
        KeyPropertyModel keyProperty = model.keyProperty();
        if (document.id() != null) {
            Object key = KeyCodec.fromStorageId(document.id(), keyProperty.rawType());
            body.set(keyProperty.storageName(), objectMapper.valueToTree(key));
        }
        for (VectorPropertyModel vectorProperty : model.vectorProperties()) {
            if (!includeVectors || vectorProperty.requiresEmbeddingGeneration()) {
                body.remove(vectorProperty.storageName());
            }
        }
        try {
            return objectMapper.treeToValue(body, recordType);
        } catch (JsonProcessingException mappingFailure) {
            throw new VectorStoreException("Document '" + document.id() + "' cannot be read as "
                    + recordType.getSimpleName() + ": " + mappingFailure.getOriginalMessage(), mappingFailure);
        }
    }

    private ArrayNode toArrayNode(float[] vector) {
        ArrayNode array = objectMapper.createArrayNode();
        for (float component : vector) {
            array.add(component);
        }
        return array;
    }
}
