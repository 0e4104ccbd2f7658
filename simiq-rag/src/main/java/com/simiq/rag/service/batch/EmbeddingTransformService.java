package com.simiq.rag.service.batch;

import com.simiq.product.dto.ProductDTO;
import com.simiq.rag.config.RagConfig;
import com.simiq.rag.exception.RowTransformException;
import com.simiq.rag.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Step 2 of the batch indexing pipeline: attach an embedding and a USD display price to each product.
 *
 * <p>Failures are per row: a product whose embedding cannot be produced is logged, counted and
 * left out; the remaining products carry on to the index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingTransformService {

    private final EmbeddingService embeddingService;
    private final RagConfig ragConfig;

    public record TransformResult(List<ProductDTO> products, int failed) {
    }

    public TransformResult transform(List<ProductDTO> products) {
        double exchangeRate = ragConfig.getBatchIndexing().getExchangeRate();
        log.info("Transforming {} products (model={}, exchangeRate={})",
                products.size(), embeddingService.getModelName(), exchangeRate);
        long startTime = System.currentTimeMillis();

        List<ProductDTO> transformed = new ArrayList<>(products.size());
        int failed = 0;

        for (ProductDTO product : products) {
            try {
                transformed.add(transformOne(product, exchangeRate));
            } catch (RowTransformException e) {
                failed++;
                // Log first few failures with detail, then only count them
                if (failed <= 5) {
                    log.warn("Skipping product: {}", e.getMessage());
                } else {
                    log.debug("Skipping product: {}", e.getMessage());
                }
            }

            int processed = transformed.size() + failed;
            if (processed % 100 == 0) {
                log.info("Progress: {} of {} products ({} embedded, {} failed)",
                        processed, products.size(), transformed.size(), failed);
            }
        }

        log.info("Transformation complete: {} embedded, {} failed in {}ms",
                transformed.size(), failed, System.currentTimeMillis() - startTime);
        return new TransformResult(transformed, failed);
    }

    /**
     * Embed one product and normalize its price.
     *
     * @throws RowTransformException if no usable embedding could be produced
     */
    ProductDTO transformOne(ProductDTO product, double exchangeRate) {
        String text = embeddingService.buildProductEmbeddingText(
                product.getProductName(), product.getMainCategory(), product.getSubCategory());

        List<Float> embedding;
        try {
            embedding = embeddingService.embedText(text);
        } catch (EmbeddingService.RateLimitException e) {
            throw new RowTransformException(product.getProductId(), "embedding rate limited", e);
        }

        if (embedding == null || embedding.isEmpty()) {
            throw new RowTransformException(product.getProductId(), "no embedding returned");
        }
        int expected = embeddingService.getEmbeddingDimensions();
        if (embedding.size() != expected) {
            throw new RowTransformException(product.getProductId(),
                    String.format("embedding has %d dimensions, expected %d", embedding.size(), expected));
        }

        return product.toBuilder()
                .embedding(embedding)
                .priceUsd(PriceConverter.toUsd(product.getPrice(), exchangeRate))
                .build();
    }
}
