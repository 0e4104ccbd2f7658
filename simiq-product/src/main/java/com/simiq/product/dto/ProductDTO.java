package com.simiq.product.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog product as it travels between the batch pipeline and the vector index.
 * {@code productId} is the stable identity and doubles as the index key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProductDTO {

    public static final String PRODUCT_ID = "product_id";
    public static final String PRODUCT_NAME = "product_name";
    public static final String MAIN_CATEGORY = "main_category";
    public static final String SUB_CATEGORY = "sub_category";
    public static final String RATINGS = "ratings";
    public static final String NO_OF_RATINGS = "no_of_ratings";
    public static final String PRICE = "price";
    public static final String PRICE_USD = "price_usd";

    @JsonProperty(PRODUCT_ID)
    private String productId;

    @JsonProperty(PRODUCT_NAME)
    private String productName;

    @JsonProperty(MAIN_CATEGORY)
    private String mainCategory;

    /** Similarity scoping key: recommendations never cross sub-categories. */
    @JsonProperty(SUB_CATEGORY)
    private String subCategory;

    @JsonProperty(RATINGS)
    private Double ratings;

    @JsonProperty(NO_OF_RATINGS)
    private Integer noOfRatings;

    /** Price as shown in the source catalog, original currency. */
    @JsonProperty(PRICE)
    private String price;

    /** Normalized display price, e.g. "$279.97". */
    @JsonProperty(PRICE_USD)
    private String priceUsd;

    @JsonProperty("embedding")
    private List<Float> embedding;

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }

    /**
     * Index payload for this product: every field except the vector.
     * Absent optional fields are kept as explicit nulls so the payload schema is stable.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PRODUCT_ID, productId);
        payload.put(PRODUCT_NAME, productName);
        payload.put(MAIN_CATEGORY, mainCategory);
        payload.put(SUB_CATEGORY, subCategory);
        payload.put(RATINGS, ratings);
        payload.put(NO_OF_RATINGS, noOfRatings);
        payload.put(PRICE, price);
        payload.put(PRICE_USD, priceUsd);
        return payload;
    }

    /**
     * Rebuild a product from an index payload. Numbers may come back as any JSON numeric type.
     */
    public static ProductDTO fromPayload(Map<String, ?> payload) {
        return ProductDTO.builder()
                .productId(asString(payload.get(PRODUCT_ID)))
                .productName(asString(payload.get(PRODUCT_NAME)))
                .mainCategory(asString(payload.get(MAIN_CATEGORY)))
                .subCategory(asString(payload.get(SUB_CATEGORY)))
                .ratings(payload.get(RATINGS) instanceof Number n ? n.doubleValue() : null)
                .noOfRatings(payload.get(NO_OF_RATINGS) instanceof Number count ? count.intValue() : null)
                .price(asString(payload.get(PRICE)))
                .priceUsd(asString(payload.get(PRICE_USD)))
                .build();
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
