package com.simiq.rag.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simiq.product.dto.ProductDTO;
import com.simiq.rag.config.RagConfig;
import com.simiq.rag.dto.IndexedPoint;
import com.simiq.rag.dto.SearchResult;
import com.simiq.rag.exception.VectorIndexException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

/**
 * Vector index backed by a Qdrant collection, accessed through its REST API.
 *
 * <p>Qdrant point ids must be UUIDs or unsigned integers, so each product is stored under a
 * name-based UUID derived from its product id; the product id itself lives in the payload.
 * Qdrant reports cosine similarity as the score; it is converted to distance {@code 1 - score}.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "simiq.rag.vector-search", name = "provider", havingValue = "qdrant", matchIfMissing = true)
public class QdrantVectorIndexGateway implements VectorIndexGateway {

    private static final String SCOPE_FIELD = ProductDTO.SUB_CATEGORY;
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final RagConfig ragConfig;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String collection;
    private final int dimensions;
    private volatile boolean collectionReady = false;

    @Autowired
    public QdrantVectorIndexGateway(RagConfig ragConfig, RestTemplateBuilder restTemplateBuilder) {
        this(ragConfig, restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(ragConfig.getVectorSearch().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(ragConfig.getVectorSearch().getReadTimeoutMs()))
                .build());
    }

    public QdrantVectorIndexGateway(RagConfig ragConfig, RestTemplate restTemplate) {
        this.ragConfig = ragConfig;
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();
        this.collection = ragConfig.getVectorSearch().getCollection();
        this.dimensions = ragConfig.getEmbedding().getDimensions();

        String url = ragConfig.getVectorSearch().getUrl();
        this.baseUrl = url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;

        log.info("Initialized Qdrant vector index: url={}, collection={}, dimensions={}",
                baseUrl, collection, dimensions);
    }

    @Override
    public void ensureCollection(String name, int size) {
        JsonNode existing = execute("list collections", HttpMethod.GET, "/collections", null);
        JsonNode collections = existing.path("result").path("collections");
        if (!collections.isArray()) {
            throw VectorIndexException.malformedResponse("list collections");
        }

        for (JsonNode node : collections) {
            if (name.equals(node.path("name").asText())) {
                log.debug("Collection {} already exists", name);
                ensurePayloadIndex(name);
                markReady(name);
                return;
            }
        }

        ObjectNode vectors = objectMapper.createObjectNode();
        vectors.put("size", size);
        vectors.put("distance", "Cosine");
        ObjectNode createBody = objectMapper.createObjectNode();
        createBody.set("vectors", vectors);

        try {
            execute("create collection", HttpMethod.PUT, "/collections/" + name, createBody);
            log.info("Created Qdrant collection {} (size={}, distance=Cosine)", name, size);
        } catch (VectorIndexException e) {
            // Another writer created it between our list and create calls
            if (e.getCause() instanceof HttpClientErrorException.Conflict) {
                log.info("Collection {} was created concurrently", name);
                ensurePayloadIndex(name);
                markReady(name);
                return;
            }
            throw e;
        }

        createPayloadIndex(name);
        markReady(name);
    }

    /**
     * Create the sub_category keyword index on an existing collection if it is missing,
     * e.g. after an earlier run created the collection but failed on the index.
     */
    private void ensurePayloadIndex(String name) {
        JsonNode info = execute("get collection", HttpMethod.GET, "/collections/" + name, null);
        JsonNode schema = info.path("result").path("payload_schema");
        if (schema.has(SCOPE_FIELD)) {
            return;
        }
        log.warn("Collection {} has no payload index on {}", name, SCOPE_FIELD);
        createPayloadIndex(name);
    }

    private void createPayloadIndex(String name) {
        ObjectNode indexBody = objectMapper.createObjectNode();
        indexBody.put("field_name", SCOPE_FIELD);
        indexBody.put("field_schema", "keyword");
        execute("create payload index", HttpMethod.PUT, "/collections/" + name + "/index?wait=true", indexBody);
        log.info("Created keyword payload index on {}.{}", name, SCOPE_FIELD);
    }

    @Override
    public void upsertOne(IndexedPoint point) {
        upsertMany(List.of(point));
    }

    @Override
    public void upsertMany(List<IndexedPoint> points) {
        if (points.isEmpty()) {
            return;
        }
        for (IndexedPoint point : points) {
            point.validateDimensions(dimensions);
        }
        ensureReady();

        ArrayNode pointArray = objectMapper.createArrayNode();
        for (IndexedPoint point : points) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("id", pointId(point.getId()));
            node.set("vector", toVectorNode(point.getVector()));
            node.set("payload", objectMapper.valueToTree(point.getPayload()));
            pointArray.add(node);
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.set("points", pointArray);

        long startTime = System.currentTimeMillis();
        execute("upsert", HttpMethod.PUT, "/collections/" + collection + "/points?wait=true", body);
        log.debug("Upserted {} points to {} in {}ms", points.size(), collection, System.currentTimeMillis() - startTime);
    }

    @Override
    public Optional<IndexedPoint> getById(String productId, boolean withVector) {
        ensureReady();

        ObjectNode body = objectMapper.createObjectNode();
        body.set("ids", objectMapper.createArrayNode().add(pointId(productId)));
        body.put("with_payload", true);
        body.put("with_vector", withVector);

        JsonNode response = execute("retrieve", HttpMethod.POST, "/collections/" + collection + "/points", body);
        JsonNode result = response.path("result");
        if (!result.isArray()) {
            throw VectorIndexException.malformedResponse("retrieve");
        }
        if (result.isEmpty()) {
            log.debug("Product {} not found in {}", productId, collection);
            return Optional.empty();
        }

        JsonNode point = result.get(0);
        Map<String, Object> payload = objectMapper.convertValue(point.path("payload"), PAYLOAD_TYPE);
        List<Float> vector = withVector ? parseVector(point.get("vector")) : null;

        return Optional.of(IndexedPoint.builder()
                .id(productId)
                .vector(vector)
                .payload(payload)
                .build());
    }

    @Override
    public List<SearchResult> searchSimilar(List<Float> queryVector, int limit, Map<String, Object> equalityFilter) {
        ensureReady();

        ObjectNode body = objectMapper.createObjectNode();
        body.set("vector", toVectorNode(queryVector));
        body.put("limit", limit);
        body.put("with_payload", true);

        if (equalityFilter != null && !equalityFilter.isEmpty()) {
            ArrayNode must = objectMapper.createArrayNode();
            for (Map.Entry<String, Object> condition : equalityFilter.entrySet()) {
                ObjectNode match = objectMapper.createObjectNode();
                match.set("value", objectMapper.valueToTree(condition.getValue()));
                ObjectNode field = objectMapper.createObjectNode();
                field.put("key", condition.getKey());
                field.set("match", match);
                must.add(field);
            }
            ObjectNode filter = objectMapper.createObjectNode();
            filter.set("must", must);
            body.set("filter", filter);
        }

        long startTime = System.currentTimeMillis();
        JsonNode response = execute("search", HttpMethod.POST, "/collections/" + collection + "/points/search", body);
        JsonNode hits = response.path("result");
        if (!hits.isArray()) {
            throw VectorIndexException.malformedResponse("search");
        }

        List<SearchResult> results = new ArrayList<>();
        for (JsonNode hit : hits) {
            Map<String, Object> payload = objectMapper.convertValue(hit.path("payload"), PAYLOAD_TYPE);
            double similarity = hit.path("score").asDouble();
            results.add(SearchResult.builder()
                    .product(ProductDTO.fromPayload(payload != null ? payload : Map.of()))
                    .distance(1.0 - similarity)
                    .build());
        }

        log.debug("Qdrant search: limit={}, filter={}, {} hits in {}ms",
                limit, equalityFilter, results.size(), System.currentTimeMillis() - startTime);
        return results;
    }

    @Override
    public boolean isAvailable() {
        return ragConfig.isEnabled() && baseUrl != null && !baseUrl.isBlank();
    }

    /**
     * Qdrant point id for a product id: a name-based (v3) UUID, stable across runs.
     */
    public static String pointId(String productId) {
        return UUID.nameUUIDFromBytes(productId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private void ensureReady() {
        if (!collectionReady) {
            ensureCollection(collection, dimensions);
        }
    }

    private void markReady(String name) {
        if (collection.equals(name)) {
            collectionReady = true;
        }
    }

    private ArrayNode toVectorNode(List<Float> vector) {
        ArrayNode node = objectMapper.createArrayNode();
        for (Float value : vector) {
            node.add(value.floatValue());
        }
        return node;
    }

    private List<Float> parseVector(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<Float> vector = new ArrayList<>(node.size());
        for (JsonNode value : node) {
            vector.add((float) value.asDouble());
        }
        return vector;
    }

    /**
     * Send one request to Qdrant and parse the JSON response.
     * Any transport or server failure becomes a {@link VectorIndexException}.
     */
    private JsonNode execute(String operation, HttpMethod method, String path, JsonNode body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        String apiKey = ragConfig.getVectorSearch().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("api-key", apiKey);
        }

        try {
            String requestJson = body != null ? objectMapper.writeValueAsString(body) : null;
            HttpEntity<String> entity = new HttpEntity<>(requestJson, headers);

            ResponseEntity<String> response = restTemplate.exchange(baseUrl + path, method, entity, String.class);

            String responseBody = response.getBody();
            if (responseBody == null || responseBody.isBlank()) {
                throw VectorIndexException.malformedResponse(operation);
            }
            return objectMapper.readTree(responseBody);

        } catch (RestClientException e) {
            log.error("Qdrant {} failed: {}", operation, e.getMessage());
            throw VectorIndexException.indexUnavailable(operation, e);
        } catch (JsonProcessingException e) {
            log.error("Could not parse Qdrant {} response: {}", operation, e.getMessage());
            throw new VectorIndexException("Unparseable vector index response during " + operation, e);
        }
    }
}
