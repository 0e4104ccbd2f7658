package com.simiq.pipeline;

import com.simiq.rag.service.batch.BatchIndexingOrchestrator;
import com.simiq.rag.service.batch.BatchIndexingOrchestrator.BatchIndexingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Standalone runner for one pass of the batch embedding pipeline.
 *
 * Usage:
 *   mvn spring-boot:run -pl simiq-pipeline
 *
 *   # With environment variables
 *   CATALOG_PATH=data/amazon.csv EMBEDDING_MODEL=text-embedding-004 mvn spring-boot:run -pl simiq-pipeline
 *
 *   # Or pass the catalog as the first argument
 *   java -jar simiq-pipeline.jar data/amazon.csv
 */
@SpringBootApplication(scanBasePackages = {"com.simiq.pipeline", "com.simiq.rag", "com.simiq.product"})
@RequiredArgsConstructor
@Slf4j
public class PipelineApplication implements CommandLineRunner, ExitCodeGenerator {

    private final BatchIndexingOrchestrator orchestrator;

    @Value("${simiq.rag.batch-indexing.catalog-path:}")
    private String catalogPath;

    @Value("${simiq.rag.embedding.model}")
    private String embeddingModel;

    private int exitCode = 0;

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PipelineApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        exitCode = 0;
        String catalog = args.length > 0 && !args[0].isBlank() ? args[0] : catalogPath;
        if (catalog == null || catalog.isBlank()) {
            log.error("Catalog path is required. Set simiq.rag.batch-indexing.catalog-path or the CATALOG_PATH env var.");
            printUsage();
            exitCode = 2;
            return;
        }

        Path path = Paths.get(catalog);
        if (!Files.isRegularFile(path)) {
            log.error("Catalog file not found: {}", catalog);
            exitCode = 2;
            return;
        }

        log.info("=".repeat(60));
        log.info("SimIQ Embedding Pipeline");
        log.info("=".repeat(60));
        log.info("Catalog: {}", path.toAbsolutePath());
        log.info("Embedding model: {}", embeddingModel);
        log.info("=".repeat(60));

        BatchIndexingResult result = orchestrator.runFullPipeline(path);

        log.info("=".repeat(60));
        if (result.success()) {
            double rate = result.durationMs() > 0 ? result.productsIndexed() / (result.durationMs() / 1000.0) : 0;
            log.info("Pipeline completed!");
            log.info("Run: {}", result.runId());
            log.info("Rows read: {} ({} skipped, {} failed embeddings)",
                    result.rowsRead(), result.rowsSkipped(), result.embeddingsFailed());
            log.info("Products indexed: {}", result.productsIndexed());
            log.info("Snapshot: {}", result.snapshotPath());
            if (result.snapshotGcsUri() != null) {
                log.info("Snapshot copy: {}", result.snapshotGcsUri());
            }
            log.info("Time taken: {} seconds", String.format("%.1f", result.durationMs() / 1000.0));
            log.info("Rate: {} products/second", String.format("%.1f", rate));
        } else {
            log.error("Pipeline failed: {}", result.errorMessage());
            exitCode = 1;
        }
        log.info("=".repeat(60));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printUsage() {
        System.out.println("""

            SimIQ Embedding Pipeline - Usage
            ================================

            Configuration (application.properties):
              simiq.rag.batch-indexing.catalog-path   CSV or LDJSON catalog
              simiq.rag.embedding.model               Embedding model name

            Environment Variables:
              CATALOG_PATH       Path to the catalog file
              EMBEDDING_MODEL    Embedding model (default: text-embedding-004)
              QDRANT_URL         Qdrant REST endpoint (default: http://localhost:6333)
              GCP_PROJECT_ID     Google Cloud project for Vertex AI

            Examples:
              CATALOG_PATH=data/products.csv mvn spring-boot:run -pl simiq-pipeline
            """);
    }
}
