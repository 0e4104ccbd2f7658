package com.simiq.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One recommended product with its distance to the anchor.
 * Only a subset of the product is surfaced to callers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationDTO {

    private RecommendedProduct product;

    /** Cosine distance to the anchor (0 = identical). */
    private double distance;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecommendedProduct {

        @JsonProperty("product_id")
        private String productId;

        private String category;

        @JsonProperty("sub_category")
        private String subCategory;

        private String price;
    }

    public static RecommendationDTO fromProduct(ProductDTO product, double distance) {
        return RecommendationDTO.builder()
                .product(RecommendedProduct.builder()
                        .productId(product.getProductId())
                        .category(product.getMainCategory())
                        .subCategory(product.getSubCategory())
                        .price(product.getPriceUsd())
                        .build())
                .distance(distance)
                .build();
    }
}
