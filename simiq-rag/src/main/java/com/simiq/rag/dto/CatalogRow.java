package com.simiq.rag.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw catalog row as read from CSV or LDJSON. Every column is kept as text;
 * numeric coercion happens during ingest.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogRow {

    @JsonProperty("product_id")
    private String productId;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("main_category")
    private String mainCategory;

    @JsonProperty("sub_category")
    private String subCategory;

    @JsonProperty("ratings")
    private String ratings;

    @JsonProperty("no_of_ratings")
    private String noOfRatings;

    @JsonProperty("price")
    private String price;

    /**
     * Check if this row has the fields needed to embed it.
     */
    public boolean isValid() {
        return productName != null && !productName.isBlank()
                && mainCategory != null && !mainCategory.isBlank()
                && subCategory != null && !subCategory.isBlank();
    }
}
