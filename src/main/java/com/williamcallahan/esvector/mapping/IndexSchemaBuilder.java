package com.williamcallahan.esvector.mapping;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.primitives.Primitives;
import com.google.common.reflect.TypeToken;
import com.williamcallahan.esvector.domain.errors.UnsupportedConfigurationException;
import com.williamcallahan.esvector.model.CollectionModel;
import com.williamcallahan.esvector.model.DataPropertyModel;
import com.williamcallahan.esvector.model.VectorPropertyModel;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.Set;

/**
 * Derives Elasticsearch field mappings from a collection model.
 *
 * <p>Vectors map to indexed {@code dense_vector} fields, full-text properties to {@code text},
 * indexed properties to a type-specific exact-match field, and the remaining properties are stored
 * without being indexed. The key is the document id and gets no field.</p>
 */
public final class IndexSchemaBuilder {

    private static final int BBQ_MIN_DIMENSIONS = 64;

    private static final Map<Class<?>, String> EXACT_MATCH_TYPES = Map.ofEntries(
            Map.entry(String.class, "keyword"),
            Map.entry(Character.class, "keyword"),
            Map.entry(Boolean.class, "boolean"),
            Map.entry(Byte.class, "byte"),
            Map.entry(Short.class, "short"),
            Map.entry(Integer.class, "integer"),
            Map.entry(Long.class, "long"),
            Map.entry(BigInteger.class, "unsigned_long"),
            Map.entry(Float.class, "float"),
            Map.entry(Double.class, "double"),
            Map.entry(BigDecimal.class, "double"));

    private static final Set<Class<?>> DATE_TYPES = Set.of(
            Date.class,
            Instant.class,
            LocalDate.class,
            LocalDateTime.class,
            OffsetDateTime.class,
            ZonedDateTime.class);

    private IndexSchemaBuilder() {}

    /**
     * Builds the field mappings for a model.
     *
     * @param model collection model
     * @return index schema
     * @throws UnsupportedConfigurationException when a vector setting has no Elasticsearch equivalent
     */
    public static IndexSchema build(CollectionModel model) {
        ObjectNode properties = JsonNodeFactory.instance.objectNode();
        for (DataPropertyModel dataProperty : model.dataProperties()) {
            properties.set(dataProperty.storageName(), dataMapping(dataProperty));
        }
        for (VectorPropertyModel vectorProperty : model.vectorProperties()) {
            properties.set(vectorProperty.storageName(), vectorMapping(vectorProperty));
        }
        return new IndexSchema(properties);
    }

    private static ObjectNode dataMapping(DataPropertyModel dataProperty) {
        ObjectNode mapping = JsonNodeFactory.instance.objectNode();
        if (dataProperty.isFullTextIndexed()) {
            return mapping.put("type", "text");
        }
        if (dataProperty.isIndexed()) {
            return mapping.put("type", exactMatchType(dataProperty.type()));
        }
        return mapping.put("type", "keyword").put("index", false);
    }

    private static ObjectNode vectorMapping(VectorPropertyModel vectorProperty) {
        String similarity = similarity(vectorProperty);
        String indexType = indexType(vectorProperty);
        ObjectNode mapping = JsonNodeFactory.instance.objectNode()
                .put("type", "dense_vector")
                .put("dims", vectorProperty.dimensions())
                .put("index", true)
                .put("similarity", similarity);
        mapping.putObject("index_options").put("type", indexType);
        return mapping;
    }

    /**
     * Maps a declared data type to an exact-match field type, unwrapping arrays and collections.
     *
     * @param declaredType declared property type
     * @return Elasticsearch field type, {@code keyword} when unrecognized
     */
    static String exactMatchType(Type declaredType) {
        Class<?> elementType = Primitives.wrap(elementType(declaredType));
        String mapped = EXACT_MATCH_TYPES.get(elementType);
        if (mapped != null) {
            return mapped;
        }
        if (DATE_TYPES.contains(elementType)) {
            return "date";
        }
        return "keyword";
    }

    private static Class<?> elementType(Type declaredType) {
        TypeToken<?> token = TypeToken.of(declaredType);
        if (token.isArray()) {
            return token.getComponentType().getRawType();
        }
        if (Collection.class.isAssignableFrom(token.getRawType())) {
            return token.resolveType(Collection.class.getTypeParameters()[0]).getRawType();
        }
        return token.getRawType();
    }

    private static String similarity(VectorPropertyModel vectorProperty) {
        return switch (vectorProperty.distanceFunction()) {
            case COSINE_SIMILARITY -> "cosine";
            case DOT_PRODUCT_SIMILARITY -> "dot_product";
            case EUCLIDEAN_DISTANCE -> "l2_norm";
            case MAX_INNER_PRODUCT -> "max_inner_product";
            default -> throw new UnsupportedConfigurationException("Vector property '" + vectorProperty.modelName()
                    + "' uses distance function " + vectorProperty.distanceFunction()
                    + ", which Elasticsearch does not support. Supported: COSINE_SIMILARITY, "
                    + "DOT_PRODUCT_SIMILARITY, EUCLIDEAN_DISTANCE, MAX_INNER_PRODUCT");
        };
    }

    private static String indexType(VectorPropertyModel vectorProperty) {
        String indexType = switch (vectorProperty.indexKind()) {
            case HNSW -> "hnsw";
            case INT8_HNSW -> "int8_hnsw";
            case INT4_HNSW -> "int4_hnsw";
            case BBQ_HNSW -> "bbq_hnsw";
            case FLAT -> "flat";
            case INT8_FLAT -> "int8_flat";
            case INT4_FLAT -> "int4_flat";
            case BBQ_FLAT -> "bbq_flat";
            default -> throw new UnsupportedConfigurationException("Vector property '" + vectorProperty.modelName()
                    + "' uses index kind " + vectorProperty.indexKind()
                    + ", which Elasticsearch does not support. Supported: HNSW, INT8_HNSW, INT4_HNSW, BBQ_HNSW, "
                    + "FLAT, INT8_FLAT, INT4_FLAT, BBQ_FLAT");
        };
        if (indexType.startsWith("bbq_") && vectorProperty.dimensions() < BBQ_MIN_DIMENSIONS) {
            throw new UnsupportedConfigurationException("Vector property '" + vectorProperty.modelName()
                    + "' uses index kind " + vectorProperty.indexKind() + " which requires at least "
                    + BBQ_MIN_DIMENSIONS + " dimensions, got " + vectorProperty.dimensions());
        }
        return indexType;
    }
}
