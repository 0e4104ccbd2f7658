package com.simiq.rag.service.batch;

import com.simiq.product.dto.ProductDTO;
import com.simiq.rag.config.RagConfig;
import com.simiq.rag.service.EmbeddingService;
import com.simiq.rag.service.VectorIndexGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates the full batch indexing pipeline.
 * Coordinates: Ingest -> Transform (embed) -> Persist (upsert) -> Snapshot
 *
 * <p>Every stage is idempotent for identical input, so a failed run can simply be repeated.
 * Only one run may be in progress per process.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchIndexingOrchestrator {

    private final CatalogIngestService catalogIngestService;
    private final EmbeddingTransformService embeddingTransformService;
    private final BatchIndexUpdateService batchIndexUpdateService;
    private final SnapshotService snapshotService;
    private final VectorIndexGateway vectorIndexGateway;
    private final EmbeddingService embeddingService;
    private final RagConfig ragConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Result of a batch indexing run.
     */
    public record BatchIndexingResult(
            String runId,
            String catalogPath,
            String embeddingModel,
            int rowsRead,
            int rowsSkipped,
            int embeddingsFailed,
            int productsIndexed,
            String snapshotPath,
            String snapshotGcsUri,
            long durationMs,
            boolean success,
            String errorMessage
    ) {
        public static BatchIndexingResult failure(String runId, String catalogPath, String embeddingModel,
                                                  long durationMs, String errorMessage) {
            return new BatchIndexingResult(
                    runId, catalogPath, embeddingModel,
                    0, 0, 0, 0, null, null, durationMs, false, errorMessage
            );
        }
    }

    /**
     * Run the full batch indexing pipeline synchronously.
     * Failures are reported in the result rather than thrown.
     *
     * @param catalogPath catalog file (CSV or LDJSON)
     * @return BatchIndexingResult with details of the run
     */
    public BatchIndexingResult runFullPipeline(Path catalogPath) {
        String runId = generateRunId();
        String model = embeddingService.getModelName();

        if (!embeddingService.isAvailable()) {
            log.error("Batch indexing run {} rejected: embedding service is not configured", runId);
            return BatchIndexingResult.failure(runId, catalogPath.toString(), model, 0,
                    "Embedding service is not configured");
        }

        if (!running.compareAndSet(false, true)) {
            log.warn("Batch indexing run {} rejected: another run is in progress", runId);
            return BatchIndexingResult.failure(runId, catalogPath.toString(), model, 0,
                    "Another batch indexing run is already in progress");
        }

        long startTime = System.currentTimeMillis();
        log.info("Starting batch indexing pipeline: runId={}, catalog={}, model={}", runId, catalogPath, model);

        try {
            log.info("Step 1/4: Reading catalog...");
            CatalogIngestService.IngestResult ingest = catalogIngestService.ingest(catalogPath);

            log.info("Step 2/4: Generating embeddings...");
            EmbeddingTransformService.TransformResult transform =
                    embeddingTransformService.transform(ingest.products());
            List<ProductDTO> embedded = transform.products();

            log.info("Step 3/4: Updating vector index...");
            vectorIndexGateway.ensureCollection(
                    ragConfig.getVectorSearch().getCollection(),
                    ragConfig.getEmbedding().getDimensions());
            BatchIndexUpdateService.PersistResult persist = batchIndexUpdateService.updateIndex(embedded);

            log.info("Step 4/4: Writing snapshot...");
            SnapshotService.SnapshotResult snapshot = snapshotService.write(
                    embedded, runId, LocalDate.now(ZoneOffset.UTC), model);

            long duration = System.currentTimeMillis() - startTime;
            log.info("Batch indexing pipeline {} completed in {}ms: {} rows, {} indexed, {} failed embeddings",
                    runId, duration, ingest.rowsRead(), persist.indexed(), transform.failed());

            return new BatchIndexingResult(
                    runId, catalogPath.toString(), model,
                    ingest.rowsRead(), ingest.rowsSkipped() + persist.skipped(), transform.failed(),
                    persist.indexed(), snapshot.localPath().toString(), snapshot.gcsUri(),
                    duration, true, null
            );

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("Batch indexing pipeline {} failed: {}", runId, e.getMessage(), e);
            return BatchIndexingResult.failure(runId, catalogPath.toString(), model, duration, e.getMessage());
        } finally {
            running.set(false);
        }
    }

    /**
     * Run the full batch indexing pipeline asynchronously.
     *
     * @return CompletableFuture with the result
     */
    @Async
    public CompletableFuture<BatchIndexingResult> runFullPipelineAsync(Path catalogPath) {
        return CompletableFuture.completedFuture(runFullPipeline(catalogPath));
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Check if the services the pipeline depends on are configured.
     */
    public boolean isAvailable() {
        return embeddingService.isAvailable() && batchIndexUpdateService.isAvailable();
    }

    private String generateRunId() {
        // Random suffix keeps runs started in the same instant apart
        return Instant.now().toString()
                .replace(":", "-")
                .replace(".", "-")
                + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
