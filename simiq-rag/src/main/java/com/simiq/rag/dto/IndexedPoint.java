package com.simiq.rag.dto;

import com.simiq.product.dto.ProductDTO;
import com.simiq.product.exception.ProductException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * The persisted unit of the vector index: product id, its embedding and the
 * denormalized product payload (everything but the vector).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexedPoint {

    /** Product ID; also the index key */
    private String id;

    /** Embedding; null when retrieved without vectors */
    private List<Float> vector;

    private Map<String, Object> payload;

    /**
     * Build a point from a product that carries its embedding.
     *
     * @throws ProductException if the product has no id or no embedding
     */
    public static IndexedPoint fromProduct(ProductDTO product) {
        if (product.getProductId() == null || product.getProductId().isBlank()) {
            throw ProductException.missingProductId();
        }
        if (!product.hasEmbedding()) {
            throw ProductException.missingEmbedding(product.getProductId());
        }
        return IndexedPoint.builder()
                .id(product.getProductId())
                .vector(List.copyOf(product.getEmbedding()))
                .payload(product.toPayload())
                .build();
    }

    /**
     * Check that this point carries a vector of exactly {@code dimensions} values.
     *
     * @throws ProductException with code VALIDATION_ERROR otherwise
     */
    public void validateDimensions(int dimensions) {
        if (vector == null || vector.isEmpty()) {
            throw ProductException.missingEmbedding(id);
        }
        if (vector.size() != dimensions) {
            throw ProductException.dimensionMismatch(id, dimensions, vector.size());
        }
    }

    public ProductDTO toProduct() {
        ProductDTO product = payload != null ? ProductDTO.fromPayload(payload) : new ProductDTO();
        if (product.getProductId() == null) {
            product.setProductId(id);
        }
        product.setEmbedding(vector);
        return product;
    }
}
