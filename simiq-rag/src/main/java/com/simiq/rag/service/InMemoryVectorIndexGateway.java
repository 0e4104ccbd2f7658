package com.simiq.rag.service;

import com.simiq.rag.config.RagConfig;
import com.simiq.rag.dto.IndexedPoint;
import com.simiq.rag.dto.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force cosine index held in memory. Used for local runs and tests
 * (simiq.rag.vector-search.provider=memory); contents are lost on restart.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "simiq.rag.vector-search", name = "provider", havingValue = "memory")
public class InMemoryVectorIndexGateway implements VectorIndexGateway {

    private final Map<String, Map<String, IndexedPoint>> collections = new ConcurrentHashMap<>();
    private final String collection;
    private final int dimensions;

    public InMemoryVectorIndexGateway(RagConfig ragConfig) {
        this.collection = ragConfig.getVectorSearch().getCollection();
        this.dimensions = ragConfig.getEmbedding().getDimensions();
        log.info("Initialized in-memory vector index: collection={}, dimensions={}", collection, dimensions);
    }

    @Override
    public void ensureCollection(String name, int size) {
        collections.computeIfAbsent(name, n -> {
            log.info("Created in-memory collection {} (size={})", n, size);
            return new ConcurrentHashMap<>();
        });
    }

    @Override
    public void upsertOne(IndexedPoint point) {
        upsertMany(List.of(point));
    }

    @Override
    public void upsertMany(List<IndexedPoint> points) {
        for (IndexedPoint point : points) {
            point.validateDimensions(dimensions);
        }
        Map<String, IndexedPoint> store = points();
        for (IndexedPoint point : points) {
            store.put(point.getId(), copyOf(point));
        }
        log.debug("Upserted {} points to {}", points.size(), collection);
    }

    @Override
    public Optional<IndexedPoint> getById(String productId, boolean withVector) {
        IndexedPoint stored = points().get(productId);
        if (stored == null) {
            return Optional.empty();
        }
        IndexedPoint copy = copyOf(stored);
        if (!withVector) {
            copy.setVector(null);
        }
        return Optional.of(copy);
    }

    @Override
    public List<SearchResult> searchSimilar(List<Float> queryVector, int limit, Map<String, Object> equalityFilter) {
        List<SearchResult> results = new ArrayList<>();
        for (IndexedPoint point : points().values()) {
            if (!matches(point.getPayload(), equalityFilter)) {
                continue;
            }
            results.add(SearchResult.builder()
                    .product(point.toProduct().toBuilder().embedding(null).build())
                    .distance(1.0 - cosineSimilarity(queryVector, point.getVector()))
                    .build());
        }
        results.sort(Comparator.comparingDouble(SearchResult::getDistance));
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Number of points in the configured collection.
     */
    public int size() {
        return points().size();
    }

    private Map<String, IndexedPoint> points() {
        ensureCollection(collection, dimensions);
        return collections.get(collection);
    }

    private static boolean matches(Map<String, Object> payload, Map<String, Object> equalityFilter) {
        if (equalityFilter == null || equalityFilter.isEmpty()) {
            return true;
        }
        if (payload == null) {
            return false;
        }
        for (Map.Entry<String, Object> condition : equalityFilter.entrySet()) {
            if (!Objects.equals(payload.get(condition.getKey()), condition.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static IndexedPoint copyOf(IndexedPoint point) {
        return IndexedPoint.builder()
                .id(point.getId())
                .vector(point.getVector() != null ? List.copyOf(point.getVector()) : null)
                .payload(point.getPayload() != null ? new LinkedHashMap<>(point.getPayload()) : null)
                .build();
    }

    static double cosineSimilarity(List<Float> a, List<Float> b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
