package com.simiq.rag.service;

import com.simiq.product.dto.ProductDTO;
import com.simiq.product.dto.RecommendationDTO;
import com.simiq.product.dto.RecommendationsDTO;
import com.simiq.product.exception.ProductException;
import com.simiq.rag.dto.IndexedPoint;
import com.simiq.rag.dto.SearchResult;
import com.simiq.rag.exception.VectorIndexException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recommends products similar to an anchor product.
 *
 * <p>Similarity is the anchor's stored embedding compared against every other product in the
 * same sub-category; the anchor itself is never recommended. Results come back nearest first
 * with their raw cosine distance. Stateless; safe to call concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private final VectorIndexGateway vectorIndexGateway;

    /**
     * Find up to {@code limit} products similar to {@code productId}.
     *
     * @param productId anchor product id
     * @param limit maximum number of recommendations, must be positive
     * @return the recommendations (possibly empty), or empty if the anchor is not indexed
     * @throws ProductException with code VALIDATION_ERROR if {@code limit <= 0}
     * @throws VectorIndexException if the index is unreachable or the anchor has no stored vector
     */
    public Optional<RecommendationsDTO> recommend(String productId, int limit) {
        if (limit <= 0) {
            throw ProductException.invalidLimit(limit);
        }

        long startTime = System.currentTimeMillis();

        Optional<IndexedPoint> anchorOpt = vectorIndexGateway.getById(productId, true);
        if (anchorOpt.isEmpty()) {
            log.debug("Anchor product {} not found", productId);
            return Optional.empty();
        }

        IndexedPoint anchor = anchorOpt.get();
        if (anchor.getVector() == null || anchor.getVector().isEmpty()) {
            throw VectorIndexException.missingVector(productId);
        }
        ProductDTO anchorProduct = anchor.toProduct();
        if (anchorProduct.getSubCategory() == null) {
            throw new VectorIndexException("Stored point for product " + productId + " has no sub_category");
        }

        // One extra so that dropping the anchor still leaves `limit` peers
        int fetch = limit == Integer.MAX_VALUE ? limit : limit + 1;
        List<SearchResult> neighbours = vectorIndexGateway.searchSimilar(
                anchor.getVector(),
                fetch,
                Map.of(ProductDTO.SUB_CATEGORY, anchorProduct.getSubCategory()));

        List<RecommendationDTO> results = neighbours.stream()
                .filter(hit -> !productId.equals(hit.getProductId()))
                .limit(limit)
                .map(hit -> RecommendationDTO.fromProduct(hit.getProduct(), hit.getDistance()))
                .toList();

        log.info("Recommendations for {} (sub_category={}): {} of {} requested in {}ms",
                productId, anchorProduct.getSubCategory(), results.size(), limit,
                System.currentTimeMillis() - startTime);

        return Optional.of(RecommendationsDTO.builder()
                .results(results)
                .build());
    }
}
