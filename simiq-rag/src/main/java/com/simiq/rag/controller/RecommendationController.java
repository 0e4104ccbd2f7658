package com.simiq.rag.controller;

import com.simiq.product.dto.RecommendationsDTO;
import com.simiq.product.exception.ProductException;
import com.simiq.rag.service.RecommendationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationService recommendationService;

    /**
     * Products similar to the given one, nearest first.
     *
     * GET /get-recommendation?product_id=...&limit=5
     */
    @GetMapping("/get-recommendation")
    public ResponseEntity<RecommendationsDTO> getRecommendation(
            @RequestParam("product_id") String productId,
            @RequestParam(value = "limit", defaultValue = "${simiq.rag.retrieval.default-limit:5}") int limit) {
        if (limit < 1) {
            throw ProductException.invalidLimit(limit);
        }

        log.debug("Recommendation request: productId={}, limit={}", productId, limit);

        return recommendationService.recommend(productId, limit)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ProductException.productNotFound(productId));
    }
}
