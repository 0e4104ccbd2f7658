package com.simiq.rag.dto;

import com.simiq.product.dto.ProductDTO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents a nearest-neighbour hit from the vector index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {

    /** Product rebuilt from the stored payload (no vector) */
    private ProductDTO product;

    /** Cosine distance to the query vector (0 = identical, ascending = nearer first) */
    private double distance;

    public String getProductId() {
        return product != null ? product.getProductId() : null;
    }
}
