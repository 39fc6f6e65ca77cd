package com.williamcallahan.esvector.model;

import com.williamcallahan.esvector.domain.errors.AmbiguousPropertyException;
import com.williamcallahan.esvector.domain.errors.SchemaException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, validated schema of one collection.
 *
 * <p>Built once per collection handle by {@link CollectionModelBuilder} and shared read-only by every
 * operation on that handle.</p>
 */
public final class CollectionModel {

    private final Class<?> recordType;
    private final boolean dynamic;
    private final List<PropertyModel> properties;
    private final Map<String, PropertyModel> propertiesByModelName;
    private final KeyPropertyModel keyProperty;
    private final List<DataPropertyModel> dataProperties;
    private final List<VectorPropertyModel> vectorProperties;

    CollectionModel(Class<?> recordType, boolean dynamic, List<PropertyModel> properties) {
        this.recordType = Objects.requireNonNull(recordType, "recordType");
        this.dynamic = dynamic;
        this.properties = List.copyOf(properties);

        Map<String, PropertyModel> byName = new LinkedHashMap<>();
        KeyPropertyModel key = null;
        List<DataPropertyModel> data = new ArrayList<>();
        List<VectorPropertyModel> vectors = new ArrayList<>();
        for (PropertyModel property : this.properties) {
            byName.put(property.modelName(), property);
            if (property instanceof KeyPropertyModel keyModel) {
                key = keyModel;
            } else if (property instanceof DataPropertyModel dataModel) {
                data.add(dataModel);
            } else if (property instanceof VectorPropertyModel vectorModel) {
                vectors.add(vectorModel);
            }
        }
        this.propertiesByModelName = Map.copyOf(byName);
        this.keyProperty = Objects.requireNonNull(key, "keyProperty");
        this.dataProperties = List.copyOf(data);
        this.vectorProperties = List.copyOf(vectors);
    }

    public Class<?> recordType() {
        return recordType;
    }

    /** True when records are {@code Map<String, Object>} instances described by a definition. */
    public boolean isDynamic() {
        return dynamic;
    }

    public List<PropertyModel> properties() {
        return properties;
    }

    public KeyPropertyModel keyProperty() {
        return keyProperty;
    }

    public List<DataPropertyModel> dataProperties() {
        return dataProperties;
    }

    public List<VectorPropertyModel> vectorProperties() {
        return vectorProperties;
    }

    public Optional<PropertyModel> findProperty(String modelName) {
        return Optional.ofNullable(propertiesByModelName.get(modelName));
    }

    /**
     * Resolves a property by model name.
     *
     * @param modelName application-facing property name
     * @return the property
     * @throws SchemaException when the collection has no such property
     */
    public PropertyModel property(String modelName) {
        return findProperty(modelName)
                .orElseThrow(() -> new SchemaException("Property '" + modelName
                        + "' is not part of the collection model for " + recordType.getSimpleName()));
    }

    /**
     * Resolves the vector property used by a search.
     *
     * @param requestedName explicitly requested property, or {@code null} to use the only vector property
     * @return the vector property
     */
    public VectorPropertyModel vectorPropertyOrSingle(String requestedName) {
        if (requestedName != null) {
            PropertyModel property = property(requestedName);
            if (property instanceof VectorPropertyModel vectorProperty) {
                return vectorProperty;
            }
            throw new SchemaException("Property '" + requestedName + "' is not a vector property");
        }
        if (vectorProperties.size() != 1) {
            throw new AmbiguousPropertyException("Collection model for " + recordType.getSimpleName() + " has "
                    + vectorProperties.size()
                    + " vector properties; name the vector property to search explicitly");
        }
        return vectorProperties.get(0);
    }

    /**
     * Resolves the full-text property used by a hybrid search.
     *
     * @param requestedName explicitly requested property, or {@code null} to use the only full-text property
     * @return the full-text indexed data property
     */
    public DataPropertyModel fullTextDataPropertyOrSingle(String requestedName) {
        if (requestedName != null) {
            PropertyModel property = property(requestedName);
            if (property instanceof DataPropertyModel dataProperty && dataProperty.isFullTextIndexed()) {
                return dataProperty;
            }
            throw new SchemaException("Property '" + requestedName + "' is not a full-text indexed data property");
        }
        List<DataPropertyModel> candidates = dataProperties.stream()
                .filter(DataPropertyModel::isFullTextIndexed)
                .toList();
        if (candidates.size() != 1) {
            throw new AmbiguousPropertyException("Collection model for " + recordType.getSimpleName() + " has "
                    + candidates.size()
                    + " full-text indexed properties; name the text property to search explicitly");
        }
        return candidates.get(0);
    }

    /**
     * Returns true when any vector property has an embedding generator configured.
     *
     * @return true when stored vectors may be generator-derived
     */
    public boolean hasEmbeddingGenerators() {
        return vectorProperties.stream().anyMatch(vector -> vector.embeddingGenerator().isPresent());
    }

    public List<String> vectorStorageNames() {
        return vectorProperties.stream().map(PropertyModel::storageName).toList();
    }
}
