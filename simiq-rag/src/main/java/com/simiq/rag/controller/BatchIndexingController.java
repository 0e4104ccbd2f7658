package com.simiq.rag.controller;

import com.simiq.rag.config.RagConfig;
import com.simiq.rag.service.batch.BatchIndexingOrchestrator;
import com.simiq.rag.service.batch.BatchIndexingOrchestrator.BatchIndexingResult;
import com.simiq.rag.service.batch.SnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * REST controller for batch indexing operations.
 * Protected by API key - only meant for schedulers and CI/CD workflows.
 */
@Slf4j
@RestController
@RequestMapping("/api/internal/indexing/batch")
@RequiredArgsConstructor
public class BatchIndexingController {

    private final BatchIndexingOrchestrator orchestrator;
    private final SnapshotService snapshotService;
    private final RagConfig ragConfig;

    @Value("${simiq.internal.api-key:}")
    private String internalApiKey;

    /**
     * Run the full batch indexing pipeline and wait for it.
     * This is a long-running operation - consider using /start for async execution.
     *
     * POST /api/internal/indexing/batch/run
     */
    @PostMapping("/run")
    public ResponseEntity<?> runFullPipeline(
            @RequestHeader(value = "X-Internal-Api-Key", required = false) String apiKey,
            @RequestParam(required = false) String catalogPath) {
        if (!isValidApiKey(apiKey)) {
            return unauthorizedResponse();
        }

        log.info("Received request to run full batch indexing pipeline");

        ResponseEntity<?> rejection = checkCanStart();
        if (rejection != null) {
            return rejection;
        }

        BatchIndexingResult result = orchestrator.runFullPipeline(resolveCatalog(catalogPath));
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * Start the full batch indexing pipeline asynchronously.
     *
     * POST /api/internal/indexing/batch/start
     */
    @PostMapping("/start")
    public ResponseEntity<?> startFullPipeline(
            @RequestHeader(value = "X-Internal-Api-Key", required = false) String apiKey,
            @RequestParam(required = false) String catalogPath) {
        if (!isValidApiKey(apiKey)) {
            return unauthorizedResponse();
        }

        log.info("Received request to start async batch indexing pipeline");

        ResponseEntity<?> rejection = checkCanStart();
        if (rejection != null) {
            return rejection;
        }

        Path catalog = resolveCatalog(catalogPath);
        // Fire and forget - the orchestrator logs the outcome
        orchestrator.runFullPipelineAsync(catalog);

        return ResponseEntity.accepted()
                .body(Map.of(
                        "message", "Batch indexing pipeline started",
                        "catalogPath", catalog.toString(),
                        "status", "RUNNING"
                ));
    }

    /**
     * GET /api/internal/indexing/batch/health
     */
    @GetMapping("/health")
    public ResponseEntity<?> healthCheck(
            @RequestHeader(value = "X-Internal-Api-Key", required = false) String apiKey) {
        if (!isValidApiKey(apiKey)) {
            return unauthorizedResponse();
        }

        return ResponseEntity.ok(Map.of(
                "available", orchestrator.isAvailable(),
                "running", orchestrator.isRunning(),
                "embeddingModel", ragConfig.getEmbedding().getModel(),
                "collection", ragConfig.getVectorSearch().getCollection(),
                "remoteSnapshots", snapshotService.isRemoteEnabled()
        ));
    }

    private ResponseEntity<?> checkCanStart() {
        if (!orchestrator.isAvailable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Batch indexing services not available"));
        }
        if (orchestrator.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "A batch indexing run is already in progress"));
        }
        return null;
    }

    private Path resolveCatalog(String catalogPath) {
        return Paths.get(catalogPath != null && !catalogPath.isBlank()
                ? catalogPath
                : ragConfig.getBatchIndexing().getCatalogPath());
    }

    /**
     * Validate the internal API key.
     */
    private boolean isValidApiKey(String apiKey) {
        if (internalApiKey == null || internalApiKey.isBlank()) {
            log.warn("Internal API key not configured - rejecting request");
            return false;
        }
        return internalApiKey.equals(apiKey);
    }

    private ResponseEntity<Map<String, Object>> unauthorizedResponse() {
        log.warn("Unauthorized batch indexing request - invalid API key");
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of(
                        "success", false,
                        "message", "Invalid or missing API key"
                ));
    }
}
