package com.williamcallahan.esvector.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.esvector.client.HybridSearchRequest;
import com.williamcallahan.esvector.client.RankFusion;
import com.williamcallahan.esvector.client.SearchRequest;
import com.williamcallahan.esvector.domain.errors.SchemaException;
import com.williamcallahan.esvector.filter.FilterExpression;
import com.williamcallahan.esvector.filter.FilterTranslator;
import com.williamcallahan.esvector.model.CollectionModel;
import com.williamcallahan.esvector.model.DataPropertyModel;
import com.williamcallahan.esvector.model.KeyPropertyModel;
import com.williamcallahan.esvector.model.PropertyModel;
import com.williamcallahan.esvector.model.VectorPropertyModel;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembles nearest-neighbour, hybrid, and filtered search requests for one collection model.
 *
 * <p>Filters are placed inside the {@code knn} clause so they constrain the candidate set rather than
 * post-filter the top hits; hybrid requests apply the same filter to both retrievers.</p>
 */
public final class SearchRequestFactory {

    /** Elasticsearch upper bound for {@code num_candidates}. */
    static final int MAX_NUM_CANDIDATES = 10_000;

    private final CollectionModel model;
    private final FilterTranslator filterTranslator;
    private final SearchSettings settings;
    private final ObjectMapper objectMapper;

    public SearchRequestFactory(
            CollectionModel model, FilterTranslator filterTranslator, SearchSettings settings, ObjectMapper objectMapper) {
        this.model = Objects.requireNonNull(model, "model");
        this.filterTranslator = Objects.requireNonNull(filterTranslator, "filterTranslator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Builds a nearest-neighbour search.
     *
     * @param vectorProperty resolved vector property
     * @param queryVector query vector
     * @param top number of results
     * @param options search options
     * @return search request
     */
    public SearchRequest vectorSearch(
            VectorPropertyModel vectorProperty, float[] queryVector, int top, VectorSearchOptions options) {
        ObjectNode knn = knnClause(vectorProperty, queryVector, options.skip() + top, options.filter());
        ObjectNode query = objectMapper.createObjectNode();
        query.set("knn", knn);
        return new SearchRequest(query, List.of(), excludes(options.includeVectors()), options.skip(), top);
    }

    /**
     * Builds a hybrid search fusing a nearest-neighbour retriever with a keyword match.
     *
     * @param vectorProperty resolved vector property
     * @param textProperty resolved full-text property
     * @param queryVector query vector
     * @param keywords keywords, joined with single spaces into one match query
     * @param top number of results
     * @param options search options
     * @return hybrid search request
     */
    public HybridSearchRequest hybridSearch(
            VectorPropertyModel vectorProperty,
            DataPropertyModel textProperty,
            float[] queryVector,
            Collection<String> keywords,
            int top,
            HybridSearchOptions options) {
        int windowNeeded = options.skip() + top;
        Optional<ObjectNode> filter = filterTranslator.translate(options.filter(), model);
        ObjectNode knn = knnClause(vectorProperty, queryVector, windowNeeded, options.filter());

        ObjectNode match = objectMapper.createObjectNode();
        match.putObject("match").putObject(textProperty.storageName()).put("query", String.join(" ", keywords));
        ObjectNode textQuery = match;
        if (filter.isPresent()) {
            textQuery = objectMapper.createObjectNode();
            ObjectNode bool = textQuery.putObject("bool");
            bool.putArray("must").add(match);
            bool.putArray("filter").add(filter.get());
        }
        RankFusion rankFusion =
                new RankFusion(Math.max(settings.rankWindowSize(), windowNeeded), settings.rankConstant());
        return new HybridSearchRequest(
                knn, textQuery, rankFusion, excludes(options.includeVectors()), options.skip(), top);
    }

    /**
     * Builds a filtered retrieval without a query vector.
     *
     * @param filter filter, or {@code null} to match every record
     * @param top number of records
     * @param options retrieval options
     * @return search request
     */
    public SearchRequest filteredGet(FilterExpression filter, int top, FilteredRecordRetrievalOptions options) {
        ObjectNode query = filterTranslator.translate(filter, model).orElseGet(() -> {
            ObjectNode matchAll = objectMapper.createObjectNode();
            matchAll.putObject("match_all");
            return matchAll;
        });
        List<ObjectNode> sort = new ArrayList<>(options.orderBy().size());
        for (SortField sortField : options.orderBy()) {
            PropertyModel property = model.property(sortField.property());
            if (property instanceof VectorPropertyModel) {
                throw new SchemaException("Vector property '" + sortField.property() + "' cannot be used for sorting");
            }
            // _id has no doc values and Elasticsearch 8 refuses fielddata on it
            if (property instanceof KeyPropertyModel) {
                throw new SchemaException("Key property '" + sortField.property() + "' cannot be used for sorting");
            }
            ObjectNode clause = objectMapper.createObjectNode();
            clause.putObject(property.storageName()).put("order", sortField.ascending() ? "asc" : "desc");
            sort.add(clause);
        }
        return new SearchRequest(query, sort, excludes(options.includeVectors()), options.skip(), top);
    }

    /**
     * Returns the source fields to exclude for a retrieval.
     *
     * @param includeVectors whether vectors are returned
     * @return vector storage names when vectors are not returned, otherwise empty
     */
    public List<String> excludes(boolean includeVectors) {
        return includeVectors ? List.of() : model.vectorStorageNames();
    }

    private ObjectNode knnClause(
            VectorPropertyModel vectorProperty, float[] queryVector, int k, FilterExpression filterExpression) {
        ObjectNode knn = objectMapper.createObjectNode();
        knn.put("field", vectorProperty.storageName());
        ArrayNode vector = knn.putArray("query_vector");
        for (float component : queryVector) {
            vector.add(component);
        }
        knn.put("k", k);
        long candidates = (long) k * settings.numCandidatesFactor();
        knn.put("num_candidates", (int) Math.max(k, Math.min(MAX_NUM_CANDIDATES, candidates)));
        filterTranslator
                .translate(filterExpression, model)
                .ifPresent(filter -> knn.putArray("filter").add(filter));
        return knn;
    }
}
