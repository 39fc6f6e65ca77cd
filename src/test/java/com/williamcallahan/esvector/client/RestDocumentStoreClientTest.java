package com.williamcallahan.esvector.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.williamcallahan.esvector.mapping.IndexSchema;
import com.williamcallahan.esvector.mapping.StorageDocument;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;

/**
 * Verifies the REST client's request shapes and response handling against a local HTTP server.
 */
class RestDocumentStoreClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    private ExecutorService serverExecutor;
    private HttpServer httpServer;
    private volatile Responder responder;
    private RestDocumentStoreClient client;

    @BeforeEach
    void startServer() throws IOException {
        serverExecutor = Executors.newSingleThreadExecutor();
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            requests.add(new RecordedRequest(
                    exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(),
                    exchange.getRequestURI().getQuery(),
                    body,
                    exchange.getRequestHeaders().getFirst("Authorization"),
                    exchange.getRequestHeaders().getFirst("Content-Type")));
            responder.respond(exchange);
        });
        httpServer.setExecutor(serverExecutor);
        httpServer.start();
        client = newClient("encoded-key");
    }

    @AfterEach
    void stopServer() {
        httpServer.stop(0);
        serverExecutor.shutdownNow();
    }

    private RestDocumentStoreClient newClient(String apiKey) {
        String baseUrl = "http://" + httpServer.getAddress().getHostString() + ":"
                + httpServer.getAddress().getPort();
        return newClient(baseUrl, apiKey);
    }

    private RestDocumentStoreClient newClient(String baseUrl, String apiKey) {
        return new RestDocumentStoreClient(
                baseUrl,
                apiKey,
                Duration.ofSeconds(2),
                Duration.ofSeconds(5),
                "wait_for",
                objectMapper,
                new RestTemplateBuilder());
    }

    @Test
    void indexExistsMapsHeadStatus() {
        responder = exchange -> respondEmpty(exchange, 200);
        assertTrue(client.indexExists("hotels"));

        responder = exchange -> respondEmpty(exchange, 404);
        assertFalse(client.indexExists("missing"));

        assertEquals("HEAD", requests.get(0).method());
        assertEquals("/hotels", requests.get(0).path());
    }

    @Test
    void createIndexSendsMappingsWithApiKey() throws Exception {
        responder = exchange -> respondJson(exchange, 200, "{\"acknowledged\":true}");
        ObjectNode properties = objectMapper.createObjectNode();
        properties.putObject("category").put("type", "keyword");

        client.createIndex("hotels", new IndexSchema(properties));

        RecordedRequest request = requests.get(0);
        assertEquals("PUT", request.method());
        assertEquals("/hotels", request.path());
        assertEquals("ApiKey encoded-key", request.authorization());
        assertEquals(
                objectMapper.readTree("{\"mappings\":{\"properties\":{\"category\":{\"type\":\"keyword\"}}}}"),
                objectMapper.readTree(request.body()));
    }

    @Test
    void blankApiKeySendsNoAuthorizationHeader() {
        responder = exchange -> respondEmpty(exchange, 200);

        newClient(" ").indexExists("hotels");

        assertNull(requests.get(0).authorization());
    }

    @Test
    void getDocumentReadsSourceAndExcludesVectors() {
        responder = exchange -> respondJson(
                exchange, 200, "{\"_id\":\"7\",\"found\":true,\"_source\":{\"score\":10}}");

        Optional<StorageDocument> document = client.getDocument("hotels", "7", List.of("embedding", "other"));

        assertTrue(document.isPresent());
        assertEquals("7", document.get().id());
        assertEquals(10, document.get().body().get("score").asInt());
        assertEquals("/hotels/_doc/7", requests.get(0).path());
        assertEquals("_source_excludes=embedding,other", requests.get(0).query());
    }

    @Test
    void missingDocumentIsEmptyButMissingIndexFails() {
        responder = exchange -> respondJson(exchange, 404, "{\"_id\":\"7\",\"found\":false}");
        assertTrue(client.getDocument("hotels", "7", List.of()).isEmpty());

        responder = exchange -> respondJson(
                exchange, 404, "{\"error\":{\"type\":\"index_not_found_exception\"},\"status\":404}");
        DocumentStoreException thrown =
                assertThrows(DocumentStoreException.class, () -> client.getDocument("gone", "7", List.of()));
        assertTrue(thrown.isNotFound());
        assertTrue(thrown.getMessage().contains("index_not_found_exception"));
    }

    @Test
    void multiGetReturnsOnlyFoundDocuments() throws Exception {
        responder = exchange -> respondJson(
                exchange,
                200,
                "{\"docs\":[{\"_id\":\"1\",\"found\":true,\"_source\":{\"a\":1}},"
                        + "{\"_id\":\"2\",\"found\":false},{\"_id\":\"3\",\"found\":true,\"_source\":{\"a\":3}}]}");

        List<StorageDocument> documents = client.multiGet("hotels", List.of("1", "2", "3"), List.of());

        assertEquals(List.of("1", "3"), documents.stream().map(StorageDocument::id).toList());
        assertEquals("/hotels/_mget", requests.get(0).path());
        assertEquals(objectMapper.readTree("{\"ids\":[\"1\",\"2\",\"3\"]}"), objectMapper.readTree(requests.get(0).body()));
    }

    @Test
    void indexDocumentUsesPutWithIdAndPostWithout() {
        responder = exchange -> respondJson(exchange, 201, "{\"_id\":\"generated-1\",\"result\":\"created\"}");
        ObjectNode body = objectMapper.createObjectNode().put("score", 1);

        client.indexDocument("hotels", new StorageDocument("7", body));
        String assigned = client.indexDocument("hotels", new StorageDocument(null, body));

        assertEquals("PUT", requests.get(0).method());
        assertEquals("/hotels/_doc/7", requests.get(0).path());
        assertEquals("refresh=wait_for", requests.get(0).query());
        assertEquals("POST", requests.get(1).method());
        assertEquals("/hotels/_doc", requests.get(1).path());
        assertEquals("generated-1", assigned);
    }

    @Test
    void bulkIndexSendsNdjsonAndReturnsIdsInOrder() throws Exception {
        responder = exchange -> respondJson(
                exchange,
                200,
                "{\"errors\":false,\"items\":[{\"index\":{\"_id\":\"a\",\"status\":201}},"
                        + "{\"index\":{\"_id\":\"auto\",\"status\":201}}]}");

        List<String> ids = client.bulkIndex(
                "hotels",
                List.of(
                        new StorageDocument("a", objectMapper.createObjectNode().put("n", 1)),
                        new StorageDocument(null, objectMapper.createObjectNode().put("n", 2))));

        assertEquals(List.of("a", "auto"), ids);
        RecordedRequest request = requests.get(0);
        assertEquals("/hotels/_bulk", request.path());
        assertEquals("refresh=wait_for", request.query());
        assertTrue(request.contentType().startsWith("application/x-ndjson"));
        String[] lines = request.body().split("\n");
        assertEquals(4, lines.length);
        assertEquals(objectMapper.readTree("{\"index\":{\"_id\":\"a\"}}"), objectMapper.readTree(lines[0]));
        assertEquals(objectMapper.readTree("{\"n\":1}"), objectMapper.readTree(lines[1]));
        assertEquals(objectMapper.readTree("{\"index\":{}}"), objectMapper.readTree(lines[2]));
        assertTrue(request.body().endsWith("\n"));
    }

    @Test
    void bulkItemErrorFailsWithItemStatus() {
        responder = exchange -> respondJson(
                exchange,
                200,
                "{\"errors\":true,\"items\":[{\"index\":{\"_id\":\"a\",\"status\":400,"
                        + "\"error\":{\"type\":\"mapper_parsing_exception\"}}}]}");

        DocumentStoreException thrown = assertThrows(
                DocumentStoreException.class,
                () -> client.bulkIndex("hotels", List.of(new StorageDocument("a", objectMapper.createObjectNode()))));

        assertEquals(400, thrown.status());
        assertTrue(thrown.getMessage().contains("mapper_parsing_exception"));
    }

    @Test
    void bulkDeleteIgnoresMissingDocuments() {
        responder = exchange -> respondJson(
                exchange,
                200,
                "{\"errors\":false,\"items\":[{\"delete\":{\"_id\":\"a\",\"status\":200}},"
                        + "{\"delete\":{\"_id\":\"b\",\"status\":404,\"result\":\"not_found\"}}]}");

        client.bulkDelete("hotels", List.of("a", "b"));

        assertEquals("{\"delete\":{\"_id\":\"a\"}}\n{\"delete\":{\"_id\":\"b\"}}\n", requests.get(0).body());
    }

    @Test
    void searchSendsQueryPagingAndExcludes() throws Exception {
        responder = exchange -> respondJson(
                exchange,
                200,
                "{\"hits\":{\"hits\":[{\"_id\":\"1\",\"_score\":0.9,\"_source\":{\"a\":1}},"
                        + "{\"_id\":\"2\",\"_score\":null,\"_source\":{\"a\":2}}]}}");
        ObjectNode query = objectMapper.createObjectNode();
        query.putObject("match_all");
        ObjectNode sort = objectMapper.createObjectNode();
        sort.putObject("_id").put("order", "asc");

        List<SearchHit> hits = client.search("hotels", new SearchRequest(query, List.of(sort), List.of("embedding"), 4, 2));

        assertEquals(2, hits.size());
        assertEquals(0.9, hits.get(0).score());
        assertNull(hits.get(1).score());
        assertEquals(
                objectMapper.readTree("{\"query\":{\"match_all\":{}},\"sort\":[{\"_id\":{\"order\":\"asc\"}}],"
                        + "\"from\":4,\"size\":2,\"_source\":{\"excludes\":[\"embedding\"]}}"),
                objectMapper.readTree(requests.get(0).body()));
        assertEquals("/hotels/_search", requests.get(0).path());
    }

    @Test
    void hybridSearchSendsRrfRetriever() throws Exception {
        responder = exchange -> respondJson(exchange, 200, "{\"hits\":{\"hits\":[]}}");
        ObjectNode knn = objectMapper.createObjectNode().put("field", "embedding").put("k", 3);
        ObjectNode text = objectMapper.createObjectNode();
        text.putObject("match").putObject("description").put("query", "red");

        client.hybridSearch("hotels", new HybridSearchRequest(knn, text, new RankFusion(10, 60), List.of(), 0, 3));

        JsonNode body = objectMapper.readTree(requests.get(0).body());
        JsonNode rrf = body.get("retriever").get("rrf");
        assertEquals(knn, rrf.get("retrievers").get(0).get("knn"));
        assertEquals(text, rrf.get("retrievers").get(1).get("standard").get("query"));
        assertEquals(10, rrf.get("rank_window_size").asInt());
        assertEquals(60, rrf.get("rank_constant").asInt());
        assertEquals(3, body.get("size").asInt());
        assertFalse(body.has("_source"));
    }

    @Test
    void listIndicesSkipsHiddenIndices() {
        responder = exchange -> respondJson(
                exchange, 200, "[{\"index\":\"hotels\"},{\"index\":\".security\"},{\"index\":\"notes\"}]");

        assertEquals(List.of("hotels", "notes"), client.listIndices());
        assertEquals("/_cat/indices", requests.get(0).path());
        assertEquals("format=json&h=index", requests.get(0).query());
    }

    @Test
    void serverErrorsCarryStatusAndBodySnippet() {
        responder = exchange -> respondJson(exchange, 503, "{\"error\":\"cluster_block_exception\"}");

        DocumentStoreException thrown =
                assertThrows(DocumentStoreException.class, () -> client.deleteDocument("hotels", "1"));

        assertEquals(503, thrown.status());
        assertTrue(thrown.getMessage().contains("cluster_block_exception"));
    }

    @Test
    void unreachableServerFailsWithoutStatus() {
        RestDocumentStoreClient unreachable = newClient("http://127.0.0.1:1", "");

        DocumentStoreException thrown =
                assertThrows(DocumentStoreException.class, () -> unreachable.listIndices());

        assertEquals(DocumentStoreException.NO_STATUS, thrown.status());
    }

    @FunctionalInterface
    private interface Responder {
        void respond(HttpExchange exchange) throws IOException;
    }

    private record RecordedRequest(
            String method, String path, String query, String body, String authorization, String contentType) {}

    private static void respondEmpty(HttpExchange exchange, int statusCode) throws IOException {
        exchange.sendResponseHeaders(statusCode, -1);
        exchange.close();
    }

    private static void respondJson(HttpExchange exchange, int statusCode, String responseJson) throws IOException {
        byte[] jsonBytes = responseJson.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, jsonBytes.length);
        try (OutputStream outputStream = exchange.getResponseBody()) {
            outputStream.write(jsonBytes);
        }
    }
}
