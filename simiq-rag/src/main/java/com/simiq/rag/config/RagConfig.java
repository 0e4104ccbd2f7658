package com.simiq.rag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for embeddings, the vector index and batch indexing.
 * Maps to simiq.rag.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "simiq.rag")
public class RagConfig {

    private boolean enabled = true;

    private Embedding embedding = new Embedding();
    private VectorSearch vectorSearch = new VectorSearch();
    private Retrieval retrieval = new Retrieval();
    private Cache cache = new Cache();
    private Indexing indexing = new Indexing();
    private BatchIndexing batchIndexing = new BatchIndexing();

    @Data
    public static class Embedding {
        /** Embedding model (e.g., text-embedding-004). Changing it requires a full re-index. */
        private String model = "text-embedding-004";
        /** Embedding dimensions (768 for text-embedding-004) */
        private int dimensions = 768;
    }

    @Data
    public static class VectorSearch {
        /** Index backend: "qdrant" or "memory" */
        private String provider = "qdrant";
        /** Qdrant REST base URL */
        private String url = "http://localhost:6333";
        /** Qdrant API key (optional) */
        private String apiKey;
        /** Collection holding product vectors */
        private String collection = "products";
        private int connectTimeoutMs = 3000;
        private int readTimeoutMs = 10000;
    }

    @Data
    public static class Retrieval {
        /** Recommendations returned when the caller gives no limit */
        private int defaultLimit = 5;
    }

    @Data
    public static class Cache {
        /** Cache embeddings in Redis, keyed by model and text */
        private boolean enabled = false;
        /** TTL for cached embeddings */
        private String embeddingTtl = "24h";
    }

    @Data
    public static class Indexing {
        /** Points per upsert request */
        private int batchSize = 100;
    }

    @Data
    public static class BatchIndexing {
        /** Default catalog file (CSV or LDJSON) */
        private String catalogPath = "data/products.csv";
        /** Linear rate applied to catalog prices to get USD */
        private double exchangeRate = 0.035;
        /** Local root of the date-partitioned snapshot archive */
        private String snapshotDir = "snapshots";
        /** GCS bucket for snapshot copies (optional) */
        private String gcsBucket;
        /** Object prefix inside the bucket */
        private String gcsPrefix = "snapshots";
    }
}
