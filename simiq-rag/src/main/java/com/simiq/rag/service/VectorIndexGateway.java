package com.simiq.rag.service;

import com.simiq.rag.dto.IndexedPoint;
import com.simiq.rag.dto.SearchResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store of product vectors, queryable by id and by nearest neighbour.
 *
 * <p>Implementations are bound to one configured collection and vector size. Failures of
 * the backing store surface as {@link com.simiq.rag.exception.VectorIndexException};
 * malformed points as {@link com.simiq.product.exception.ProductException} with code
 * VALIDATION_ERROR. An absent id is not a failure.
 *
 * <p>Distance convention: {@link SearchResult#getDistance()} is the cosine distance
 * {@code 1 - cosine_similarity}; results come back in ascending distance.
 */
public interface VectorIndexGateway {

    /**
     * Create the collection with cosine distance if it does not exist yet; no-op otherwise.
     */
    void ensureCollection(String name, int dimensions);

    void upsertOne(IndexedPoint point);

    /**
     * Insert or overwrite points by id in a single round trip.
     * The whole batch is validated first; a bad point means nothing is written.
     */
    void upsertMany(List<IndexedPoint> points);

    /**
     * Fetch a point by product id.
     *
     * @param withVector whether to include the stored vector
     * @return the point, or empty if no such product is indexed
     */
    Optional<IndexedPoint> getById(String productId, boolean withVector);

    default Optional<IndexedPoint> getById(String productId) {
        return getById(productId, false);
    }

    /**
     * Up to {@code limit} nearest points among those whose payload matches every entry of
     * {@code equalityFilter}, nearest first.
     */
    List<SearchResult> searchSimilar(List<Float> queryVector, int limit, Map<String, Object> equalityFilter);

    /**
     * Check if the index backend is configured.
     */
    boolean isAvailable();
}
