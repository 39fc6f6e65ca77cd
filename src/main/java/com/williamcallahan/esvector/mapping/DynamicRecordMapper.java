package com.williamcallahan.esvector.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Defaults;
import com.williamcallahan.esvector.domain.errors.TypeMismatchException;
import com.williamcallahan.esvector.model.CollectionModel;
import com.williamcallahan.esvector.model.DataPropertyModel;
import com.williamcallahan.esvector.model.KeyPropertyModel;
import com.williamcallahan.esvector.model.VectorPropertyModel;
import com.williamcallahan.esvector.model.VectorTypes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps dynamic {@code Map<String, Object>} records keyed by model name.
 */
public final class DynamicRecordMapper implements RecordMapper<Map<String, Object>> {

    private final CollectionModel model;
    private final ObjectMapper objectMapper;

    public DynamicRecordMapper(CollectionModel model, ObjectMapper objectMapper) {
        this.model = Objects.requireNonNull(model, "model");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public StorageDocument toStorage(Map<String, Object> record, float[][] generatedEmbeddings) {
        Objects.requireNonNull(record, "record");
        KeyPropertyModel keyProperty = model.keyProperty();
        Object key = record.get(keyProperty.modelName());
        String id = key == null ? null : KeyCodec.toStorageId(key);

        ObjectNode body = objectMapper.createObjectNode();
        for (DataPropertyModel dataProperty : model.dataProperties()) {
            if (record.containsKey(dataProperty.modelName())) {
                body.set(dataProperty.storageName(), objectMapper.valueToTree(record.get(dataProperty.modelName())));
            }
        }
        List<VectorPropertyModel> vectorProperties = model.vectorProperties();
        for (int index = 0; index < vectorProperties.size(); index++) {
            VectorPropertyModel vectorProperty = vectorProperties.get(index);
            float[] generated = generatedEmbeddings == null ? null : generatedEmbeddings[index];
            if (generated != null) {
                body.set(vectorProperty.storageName(), toArrayNode(generated));
                continue;
            }
            if (vectorProperty.requiresEmbeddingGeneration() || !record.containsKey(vectorProperty.modelName())) {
                continue;
            }
            Object value = record.get(vectorProperty.modelName());
            if (value == null) {
                body.putNull(vectorProperty.storageName());
                continue;
            }
            float[] vector = VectorTypes.toFloatArray(value)
                    .orElseThrow(() -> new TypeMismatchException("Vector property '" + vectorProperty.modelName()
                            + "' holds a " + value.getClass().getName() + ", expected one of "
                            + VectorTypes.SUPPORTED_TYPES));
            body.set(vectorProperty.storageName(), toArrayNode(vector));
        }
        return new StorageDocument(id, body);
    }

    @Override
    public Map<String, Object> fromStorage(StorageDocument document, boolean includeVectors) {
        ObjectNode body = document.body();
        Map<String, Object> record = new LinkedHashMap<>();
        KeyPropertyModel keyProperty = model.keyProperty();
        record.put(
                keyProperty.modelName(),
                document.id() == null ? null : KeyCodec.fromStorageId(document.id(), keyProperty.rawType()));

        for (DataPropertyModel dataProperty : model.dataProperties()) {
            JsonNode node = body.get(dataProperty.storageName());
            if (node == null || node.isNull()) {
                record.put(dataProperty.modelName(), Defaults.defaultValue(dataProperty.rawType()));
            } else {
                record.put(
                        dataProperty.modelName(),
                        objectMapper.convertValue(node, objectMapper.constructType(dataProperty.type())));
            }
        }
        if (!includeVectors) {
            return record;
        }
        for (VectorPropertyModel vectorProperty : model.vectorProperties()) {
            if (vectorProperty.requiresEmbeddingGeneration()) {
                continue;
            }
            JsonNode node = body.get(vectorProperty.storageName());
            if (node == null || !node.isArray()) {
                record.put(vectorProperty.modelName(), null);
                continue;
            }
            float[] vector = new float[node.size()];
            for (int index = 0; index < vector.length; index++) {
                vector[index] = node.get(index).floatValue();
            }
            record.put(vectorProperty.modelName(), VectorTypes.fromFloatArray(vector, vectorProperty.type()));
        }
        return record;
    }

    private ArrayNode toArrayNode(float[] vector) {
        ArrayNode array = objectMapper.createArrayNode();
        for (float component : vector) {
            array.add(component);
        }
        return array;
    }
}
