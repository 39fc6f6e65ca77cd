package com.williamcallahan.esvector.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.esvector.mapping.IndexSchema;
import com.williamcallahan.esvector.mapping.StorageDocument;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link DocumentStoreClient} backed by the Elasticsearch REST API.
 *
 * <p>Bulk writes and deletes use {@code _bulk} with NDJSON bodies, multi-get uses {@code _mget}, and
 * hybrid search uses the {@code rrf} retriever. Failures are raised as {@link DocumentStoreException}
 * carrying the HTTP status; this client never retries.</p>
 */
public class RestDocumentStoreClient implements DocumentStoreClient {

    private static final Logger log = LoggerFactory.getLogger(RestDocumentStoreClient.class);

    private static final String API_KEY_SCHEME = "ApiKey ";
    private static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");
    private static final int NOT_FOUND = 404;
    private static final int MAX_ERROR_SNIPPET = 512;

    private final String baseUrl;
    private final String refresh;
    private final ObjectMapper objectMapper;
    private final RestTemplate restTemplate;

    /**
     * Creates a client for one Elasticsearch endpoint.
     *
     * @param baseUrl cluster URL, for example {@code http://localhost:9200}
     * @param apiKey encoded API key sent as {@code Authorization: ApiKey ...}, blank for none
     * @param connectTimeout connect timeout
     * @param readTimeout read timeout
     * @param refresh {@code refresh} parameter for writes: {@code true}, {@code false}, or {@code wait_for}
     * @param objectMapper mapper used to read and write request bodies
     * @param restTemplateBuilder RestTemplate builder
     */
    public RestDocumentStoreClient(
            String baseUrl,
            String apiKey,
            Duration connectTimeout,
            Duration readTimeout,
            String refresh,
            ObjectMapper objectMapper,
            RestTemplateBuilder restTemplateBuilder) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.refresh = Objects.requireNonNull(refresh, "refresh");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        RestTemplateBuilder builder = restTemplateBuilder
                .rootUri(baseUrl)
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout);
        if (apiKey != null && !apiKey.isBlank()) {
            builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, API_KEY_SCHEME + apiKey);
        }
        this.restTemplate = builder.build();
    }

    @Override
    public boolean indexExists(String index) {
        try {
            restTemplate.exchange("/{index}", HttpMethod.HEAD, HttpEntity.EMPTY, Void.class, index);
            return true;
        } catch (RestClientResponseException apiException) {
            if (apiException.getStatusCode().value() == NOT_FOUND) {
                return false;
            }
            throw failure("HEAD /" + index, apiException);
        } catch (RestClientException transportException) {
            throw failure("HEAD /" + index, transportException);
        }
    }

    @Override
    public void createIndex(String index, IndexSchema schema) {
        execute(HttpMethod.PUT, "/{index}", schema.toCreateIndexBody(), index);
        log.info("[ES] Created index {}", index);
    }

    @Override
    public void deleteIndex(String index) {
        execute(HttpMethod.DELETE, "/{index}", null, index);
        log.info("[ES] Deleted index {}", index);
    }

    @Override
    public Optional<StorageDocument> getDocument(String index, String id, List<String> excludes) {
        try {
            JsonNode response = excludes.isEmpty()
                    ? execute(HttpMethod.GET, "/{index}/_doc/{id}", null, index, id)
                    : execute(
                            HttpMethod.GET,
                            "/{index}/_doc/{id}?_source_excludes={excludes}",
                            null,
                            index,
                            id,
                            String.join(",", excludes));
            return Optional.of(toDocument(response));
        } catch (DocumentStoreException storeException) {
            if (storeException.isNotFound() && isMissingDocument(storeException)) {
                return Optional.empty();
            }
            throw storeException;
        }
    }

    @Override
    public List<StorageDocument> multiGet(String index, List<String> ids, List<String> excludes) {
        if (ids.isEmpty()) {
            return List.of();
        }
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode idArray = body.putArray("ids");
        ids.forEach(idArray::add);
        JsonNode response = excludes.isEmpty()
                ? execute(HttpMethod.POST, "/{index}/_mget", body, index)
                : execute(
                        HttpMethod.POST,
                        "/{index}/_mget?_source_excludes={excludes}",
                        body,
                        index,
                        String.join(",", excludes));
        List<StorageDocument> documents = new ArrayList<>();
        for (JsonNode doc : response.path("docs")) {
            if (doc.path("found").asBoolean(false)) {
                documents.add(toDocument(doc));
            }
        }
        return documents;
    }

    @Override
    public String indexDocument(String index, StorageDocument document) {
        JsonNode response = document.id() == null
                ? execute(HttpMethod.POST, "/{index}/_doc?refresh={refresh}", document.body(), index, refresh)
                : execute(
                        HttpMethod.PUT,
                        "/{index}/_doc/{id}?refresh={refresh}",
                        document.body(),
                        index,
                        document.id(),
                        refresh);
        return response.path("_id").asText();
    }

    @Override
    public List<String> bulkIndex(String index, List<StorageDocument> documents) {
        if (documents.isEmpty()) {
            return List.of();
        }
        StringBuilder ndjson = new StringBuilder();
        for (StorageDocument document : documents) {
            ObjectNode action = objectMapper.createObjectNode();
            ObjectNode metadata = action.putObject("index");
            if (document.id() != null) {
                metadata.put("_id", document.id());
            }
            ndjson.append(write(action)).append('\n').append(write(document.body())).append('\n');
        }
        JsonNode response = executeBulk(index, ndjson.toString());
        List<String> ids = new ArrayList<>(documents.size());
        for (JsonNode item : response.path("items")) {
            JsonNode result = item.path("index");
            failOnItemError(index, "index", result);
            ids.add(result.path("_id").asText());
        }
        log.debug("[ES] Bulk indexed {} documents into {}", ids.size(), index);
        return ids;
    }

    @Override
    public void deleteDocument(String index, String id) {
        execute(HttpMethod.DELETE, "/{index}/_doc/{id}?refresh={refresh}", null, index, id, refresh);
    }

    @Override
    public void bulkDelete(String index, List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        StringBuilder ndjson = new StringBuilder();
        for (String id : ids) {
            ObjectNode action = objectMapper.createObjectNode();
            action.putObject("delete").put("_id", id);
            ndjson.append(write(action)).append('\n');
        }
        JsonNode response = executeBulk(index, ndjson.toString());
        for (JsonNode item : response.path("items")) {
            JsonNode result = item.path("delete");
            if (result.path("status").asInt() != NOT_FOUND) {
                failOnItemError(index, "delete", result);
            }
        }
    }

    @Override
    public List<SearchHit> search(String index, SearchRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("query", request.query());
        if (!request.sort().isEmpty()) {
            ArrayNode sort = body.putArray("sort");
            request.sort().forEach(sort::add);
        }
        body.put("from", request.from());
        body.put("size", request.size());
        applyExcludes(body, request.excludes());
        return toHits(execute(HttpMethod.POST, "/{index}/_search", body, index));
    }

    @Override
    public List<SearchHit> hybridSearch(String index, HybridSearchRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode rrf = body.putObject("retriever").putObject("rrf");
        ArrayNode retrievers = rrf.putArray("retrievers");
        retrievers.addObject().set("knn", request.knnRetriever());
        retrievers.addObject().putObject("standard").set("query", request.textQuery());
        rrf.put("rank_window_size", request.rankFusion().rankWindowSize());
        rrf.put("rank_constant", request.rankFusion().rankConstant());
        body.put("from", request.from());
        body.put("size", request.size());
        applyExcludes(body, request.excludes());
        return toHits(execute(HttpMethod.POST, "/{index}/_search", body, index));
    }

    @Override
    public List<String> listIndices() {
        JsonNode response = execute(HttpMethod.GET, "/_cat/indices?format=json&h=index", null);
        List<String> names = new ArrayList<>();
        for (JsonNode row : response) {
            String name = row.path("index").asText("");
            if (!name.isEmpty() && !name.startsWith(".")) {
                names.add(name);
            }
        }
        return names;
    }

    @Override
    public void close() {
        log.debug("[ES] Closed REST client for {}", baseUrl);
    }

    private JsonNode execute(HttpMethod method, String path, JsonNode body, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> entity = new HttpEntity<>(body == null ? null : write(body), headers);
        return exchange(method, path, entity, uriVariables);
    }

    private JsonNode executeBulk(String index, String ndjson) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(NDJSON);
        JsonNode response = exchange(
                HttpMethod.POST, "/{index}/_bulk?refresh={refresh}", new HttpEntity<>(ndjson, headers), index, refresh);
        if (response.path("errors").asBoolean(false)) {
            log.debug("[ES] Bulk request against {} reported item errors", index);
        }
        return response;
    }

    private JsonNode exchange(HttpMethod method, String path, HttpEntity<String> entity, Object... uriVariables) {
        String description = method + " " + path;
        try {
            log.debug("[ES] {}", description);
            ResponseEntity<String> response = restTemplate.exchange(path, method, entity, String.class, uriVariables);
            String responseBody = response.getBody();
            if (responseBody == null || responseBody.isBlank()) {
                return MissingNode.getInstance();
            }
            return objectMapper.readTree(responseBody);
        } catch (RestClientResponseException apiException) {
            throw failure(description, apiException);
        } catch (RestClientException transportException) {
            throw failure(description, transportException);
        } catch (JsonProcessingException parseException) {
            throw new DocumentStoreException(
                    DocumentStoreException.NO_STATUS, "Unreadable Elasticsearch response to " + description, parseException);
        }
    }

    private void failOnItemError(String index, String action, JsonNode result) {
        if (!result.has("error")) {
            return;
        }
        int status = result.path("status").asInt(DocumentStoreException.NO_STATUS);
        throw new DocumentStoreException(
                status,
                "Bulk " + action + " of document '" + result.path("_id").asText() + "' in " + index + " failed: "
                        + sanitize(result.path("error").toString()));
    }

    private boolean isMissingDocument(DocumentStoreException storeException) {
        if (storeException.getCause() instanceof RestClientResponseException apiException) {
            try {
                JsonNode body = objectMapper.readTree(apiException.getResponseBodyAsString());
                return body.has("found") && !body.path("found").asBoolean();
            } catch (JsonProcessingException parseException) {
                log.debug("[ES] Unreadable 404 body: {}", parseException.getMessage());
                return false;
            }
        }
        return false;
    }

    private StorageDocument toDocument(JsonNode response) {
        JsonNode source = response.path("_source");
        ObjectNode body = source instanceof ObjectNode sourceObject ? sourceObject : objectMapper.createObjectNode();
        return new StorageDocument(response.path("_id").asText(), body);
    }

    private List<SearchHit> toHits(JsonNode response) {
        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            JsonNode source = hit.path("_source");
            JsonNode score = hit.path("_score");
            hits.add(new SearchHit(
                    hit.path("_id").asText(),
                    source instanceof ObjectNode sourceObject ? sourceObject : objectMapper.createObjectNode(),
                    score.isNumber() ? score.doubleValue() : null));
        }
        return hits;
    }

    private static void applyExcludes(ObjectNode body, List<String> excludes) {
        if (excludes.isEmpty()) {
            return;
        }
        ArrayNode excluded = body.putObject("_source").putArray("excludes");
        excludes.forEach(excluded::add);
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException writeException) {
            throw new DocumentStoreException(
                    DocumentStoreException.NO_STATUS, "Request body could not be serialized", writeException);
        }
    }

    private DocumentStoreException failure(String description, RestClientResponseException apiException) {
        int status = apiException.getStatusCode().value();
        String payload = sanitize(apiException.getResponseBodyAsString());
        String message = payload.isBlank()
                ? "Elasticsearch returned HTTP " + status + " for " + description
                : "Elasticsearch returned HTTP " + status + " for " + description + ": " + payload;
        return new DocumentStoreException(status, message, apiException);
    }

    private DocumentStoreException failure(String description, RestClientException transportException) {
        return new DocumentStoreException(
                DocumentStoreException.NO_STATUS,
                "Elasticsearch request " + description + " against " + baseUrl + " failed: "
                        + sanitize(transportException.getMessage()),
                transportException);
    }

    private static String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }
}
