package com.simiq.rag.service.batch;

import com.simiq.product.dto.ProductDTO;
import com.simiq.product.exception.ProductException;
import com.simiq.rag.config.RagConfig;
import com.simiq.rag.dto.IndexedPoint;
import com.simiq.rag.service.VectorIndexGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Step 3 of the batch indexing pipeline: upsert embedded products into the vector index.
 *
 * <p>Products that cannot become valid points are skipped one by one. Index failures are not
 * row failures: a {@link com.simiq.rag.exception.VectorIndexException} aborts the whole update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchIndexUpdateService {

    private final VectorIndexGateway vectorIndexGateway;
    private final RagConfig ragConfig;

    public record PersistResult(int indexed, int skipped) {
    }

    public PersistResult updateIndex(List<ProductDTO> products) {
        int batchSize = Math.max(1, ragConfig.getIndexing().getBatchSize());
        int dimensions = ragConfig.getEmbedding().getDimensions();

        List<IndexedPoint> points = new ArrayList<>(products.size());
        int skipped = 0;
        for (ProductDTO product : products) {
            try {
                IndexedPoint point = IndexedPoint.fromProduct(product);
                point.validateDimensions(dimensions);
                points.add(point);
            } catch (ProductException e) {
                skipped++;
                log.warn("Skipping product {}: {}", product.getProductId(), e.getMessage());
            }
        }

        log.info("Updating index with {} points in batches of {}", points.size(), batchSize);
        long startTime = System.currentTimeMillis();

        int indexed = 0;
        for (int i = 0; i < points.size(); i += batchSize) {
            List<IndexedPoint> batch = points.subList(i, Math.min(i + batchSize, points.size()));
            vectorIndexGateway.upsertMany(batch);
            indexed += batch.size();
            log.debug("Upserted batch {}-{}", i, i + batch.size() - 1);
        }

        log.info("Index update complete: {} indexed, {} skipped in {}ms",
                indexed, skipped, System.currentTimeMillis() - startTime);
        return new PersistResult(indexed, skipped);
    }

    public boolean isAvailable() {
        return vectorIndexGateway.isAvailable();
    }
}
