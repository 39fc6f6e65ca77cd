package com.williamcallahan.esvector.model;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.google.common.reflect.TypeToken;
import com.williamcallahan.esvector.domain.errors.SchemaException;
import com.williamcallahan.esvector.domain.errors.UnsupportedTypeException;
import com.williamcallahan.esvector.embedding.EmbeddingGenerator;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds {@link CollectionModel} instances from annotated record types or explicit definitions.
 *
 * <p>Typed records take their storage names from Jackson's own property introspection so that
 * {@code @JsonProperty} overrides and the mapper's naming strategy are honoured exactly as the
 * serializer will write them. Dynamic records have no reflectable members and use the definition's
 * storage name or the default {@link FieldNameInferrer} policy.</p>
 */
public final class CollectionModelBuilder {

    private static final String VECTOR_TYPE_HINT =
            VectorTypes.SUPPORTED_TYPES + ", or an input type accepted by a configured embedding generator";

    private final ObjectMapper objectMapper;
    private final FieldNameInferrer fieldNameInferrer;

    /**
     * Creates a builder bound to the storage mapper used for serialization.
     *
     * @param objectMapper mapper whose naming rules define storage names
     */
    public CollectionModelBuilder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.fieldNameInferrer = FieldNameInferrer.fromObjectMapper(objectMapper);
    }

    /**
     * Builds the model of a statically typed record.
     *
     * @param recordType record class
     * @param definition explicit definition overriding annotations, or {@code null}
     * @param defaultGenerator generator for vector properties without their own, or {@code null}
     * @return validated collection model
     */
    public CollectionModel build(
            Class<?> recordType, CollectionDefinition definition, EmbeddingGenerator<?> defaultGenerator) {
        Objects.requireNonNull(recordType, "recordType");
        if (Map.class.isAssignableFrom(recordType)) {
            throw new SchemaException("Map records must be described by a definition and built with buildDynamic");
        }
        List<PropertyDefinition> declared =
                definition == null ? annotatedProperties(recordType) : definition.properties();
        Map<String, String> serializedNames = serializedNames(recordType);

        List<PropertyModel> properties = new ArrayList<>(declared.size());
        for (PropertyDefinition propertyDefinition : declared) {
            Field field = findField(recordType, propertyDefinition.name());
            String storageName = typedStorageName(recordType, propertyDefinition, serializedNames);
            Type type = propertyDefinition.type() == null ? field.getGenericType() : propertyDefinition.type();
            properties.add(toPropertyModel(
                    propertyDefinition, type, storageName, PropertyReader.forField(field), defaultGenerator));
        }
        return validated(recordType, false, properties);
    }

    /**
     * Builds the model of a dynamic {@code Map<String, Object>} record.
     *
     * @param definition required definition listing every property and its type
     * @param defaultGenerator generator for vector properties without their own, or {@code null}
     * @return validated collection model
     */
    public CollectionModel buildDynamic(CollectionDefinition definition, EmbeddingGenerator<?> defaultGenerator) {
        if (definition == null) {
            throw new SchemaException("Dynamic collections require a collection definition");
        }
        List<PropertyModel> properties = new ArrayList<>(definition.properties().size());
        for (PropertyDefinition propertyDefinition : definition.properties()) {
            if (propertyDefinition.type() == null) {
                throw new SchemaException("Property '" + propertyDefinition.name()
                        + "' of a dynamic collection must declare its type");
            }
            String storageName = propertyDefinition.storageName() != null
                    ? propertyDefinition.storageName()
                    : fieldNameInferrer.storageNameFor(propertyDefinition.name());
            properties.add(toPropertyModel(
                    propertyDefinition,
                    propertyDefinition.type(),
                    storageName,
                    PropertyReader.forMapEntry(propertyDefinition.name()),
                    defaultGenerator));
        }
        return validated(Map.class, true, properties);
    }

    private PropertyModel toPropertyModel(
            PropertyDefinition definition,
            Type type,
            String storageName,
            PropertyReader reader,
            EmbeddingGenerator<?> defaultGenerator) {
        if (definition instanceof KeyPropertyDefinition) {
            if (!KeyPropertyModel.isSupportedKeyType(TypeToken.of(type).getRawType())) {
                throw new UnsupportedTypeException(
                        "key", definition.name(), type, KeyPropertyModel.SUPPORTED_KEY_TYPE_NAMES);
            }
            return new KeyPropertyModel(definition.name(), storageName, type, reader);
        }
        if (definition instanceof DataPropertyDefinition data) {
            return new DataPropertyModel(
                    data.name(), storageName, type, reader, data.indexed(), data.fullTextIndexed());
        }
        VectorPropertyDefinition vector = (VectorPropertyDefinition) definition;
        if (vector.dimensions() <= 0) {
            throw new SchemaException("Vector property '" + vector.name() + "' must declare positive dimensions, got "
                    + vector.dimensions());
        }
        EmbeddingGenerator<?> generator =
                vector.embeddingGenerator() != null ? vector.embeddingGenerator() : defaultGenerator;
        if (!VectorTypes.isNativeVectorType(type)
                && (generator == null || !generator.accepts(TypeToken.of(type).getRawType()))) {
            throw new UnsupportedTypeException("vector", vector.name(), type, VECTOR_TYPE_HINT);
        }
        return new VectorPropertyModel(
                vector.name(),
                storageName,
                type,
                reader,
                vector.dimensions(),
                vector.distanceFunction() == null ? DistanceFunction.DEFAULT : vector.distanceFunction(),
                vector.indexKind() == null ? IndexKind.DEFAULT : vector.indexKind(),
                generator);
    }

    private static CollectionModel validated(Class<?> recordType, boolean dynamic, List<PropertyModel> properties) {
        List<String> keyNames = properties.stream()
                .filter(KeyPropertyModel.class::isInstance)
                .map(PropertyModel::modelName)
                .toList();
        if (keyNames.size() != 1) {
            throw new SchemaException("Collection model for " + recordType.getSimpleName()
                    + " must have exactly one key property, found " + keyNames.size()
                    + (keyNames.isEmpty() ? "" : ": " + String.join(", ", keyNames)));
        }
        Set<String> modelNames = new HashSet<>();
        Set<String> storageNames = new HashSet<>();
        for (PropertyModel property : properties) {
            if (!modelNames.add(property.modelName())) {
                throw new SchemaException("Property '" + property.modelName() + "' is declared more than once");
            }
            if (!storageNames.add(property.storageName())) {
                throw new SchemaException("Storage name '" + property.storageName() + "' of property '"
                        + property.modelName() + "' is already used by another property");
            }
        }
        return new CollectionModel(recordType, dynamic, properties);
    }

    private String typedStorageName(
            Class<?> recordType, PropertyDefinition definition, Map<String, String> serializedNames) {
        String serializedName = serializedNames.get(definition.name());
        if (serializedName == null) {
            throw new SchemaException("Property '" + definition.name() + "' of " + recordType.getSimpleName()
                    + " is not serialized; expose it to Jackson or remove it from the model");
        }
        if (definition.storageName() != null && !definition.storageName().equals(serializedName)) {
            throw new SchemaException("Property '" + definition.name() + "' requests storage name '"
                    + definition.storageName() + "' but is serialized as '" + serializedName
                    + "'; use @JsonProperty to rename typed record fields");
        }
        return serializedName;
    }

    private Map<String, String> serializedNames(Class<?> recordType) {
        BeanDescription description =
                objectMapper.getSerializationConfig().introspect(objectMapper.constructType(recordType));
        Map<String, String> names = new HashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            names.put(property.getInternalName(), property.getName());
        }
        return names;
    }

    private static Field findField(Class<?> recordType, String name) {
        for (Class<?> current = recordType; current != null && current != Object.class;
                current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(name) && !Modifier.isStatic(field.getModifiers())) {
                    return field;
                }
            }
        }
        throw new SchemaException("Property '" + name + "' is not a field of " + recordType.getSimpleName());
    }

    private static List<PropertyDefinition> annotatedProperties(Class<?> recordType) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> current = recordType; current != null && current != Object.class;
                current = current.getSuperclass()) {
            hierarchy.push(current);
        }
        List<PropertyDefinition> definitions = new ArrayList<>();
        for (Class<?> declaringType : hierarchy) {
            for (Field field : declaringType.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers())) {
                    continue;
                }
                annotatedProperty(field).ifPresent(definitions::add);
            }
        }
        return definitions;
    }

    private static Optional<PropertyDefinition> annotatedProperty(Field field) {
        VectorStoreKey key = field.getAnnotation(VectorStoreKey.class);
        VectorStoreData data = field.getAnnotation(VectorStoreData.class);
        VectorStoreVector vector = field.getAnnotation(VectorStoreVector.class);
        List<String> roles = new ArrayList<>();
        if (key != null) {
            roles.add("@VectorStoreKey");
        }
        if (data != null) {
            roles.add("@VectorStoreData");
        }
        if (vector != null) {
            roles.add("@VectorStoreVector");
        }
        if (roles.size() > 1) {
            throw new SchemaException("Field '" + field.getName() + "' carries conflicting annotations: "
                    + String.join(", ", roles));
        }
        Type type = field.getGenericType();
        if (key != null) {
            return Optional.of(PropertyDefinition.key(field.getName(), type));
        }
        if (data != null) {
            return Optional.of(new DataPropertyDefinition(
                    field.getName(), type, data.indexed(), data.fullTextIndexed(), null));
        }
        if (vector != null) {
            return Optional.of(new VectorPropertyDefinition(
                    field.getName(),
                    type,
                    vector.dimensions(),
                    vector.distanceFunction(),
                    vector.indexKind(),
                    null,
                    null));
        }
        return Optional.empty();
    }
}
