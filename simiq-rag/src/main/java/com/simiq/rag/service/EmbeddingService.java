package com.simiq.rag.service;

import com.google.genai.Client;
import com.google.genai.types.ContentEmbedding;
import com.google.genai.types.EmbedContentResponse;
import com.simiq.rag.config.RagConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Service for generating product embeddings with a Vertex AI text embedding model.
 * Supports optional caching via Redis, keyed by model name and text hash so a model change
 * never serves stale vectors.
 */
@Slf4j
@Service
public class EmbeddingService {

    private static final String EMBEDDING_CACHE_PREFIX = "embedding:";

    @Nullable
    private final Client client;
    private final RagConfig ragConfig;
    @Nullable
    private final RedisTemplate<String, Object> redisTemplate;
    private final String embeddingModel;

    @Autowired
    public EmbeddingService(
            RagConfig ragConfig,
            @Autowired(required = false) @Nullable RedisTemplate<String, Object> redisTemplate,
            @Value("${vertex.ai.project-id:}") String projectId,
            @Value("${vertex.ai.location:us-central1}") String location) {
        this(ragConfig, redisTemplate, createClient(projectId, location, ragConfig.getEmbedding().getModel()));
    }

    EmbeddingService(RagConfig ragConfig,
                     @Nullable RedisTemplate<String, Object> redisTemplate,
                     @Nullable Client client) {
        this.ragConfig = ragConfig;
        this.redisTemplate = ragConfig.getCache().isEnabled() ? redisTemplate : null;
        this.embeddingModel = ragConfig.getEmbedding().getModel();
        this.client = client;

        if (this.redisTemplate == null) {
            log.info("Embedding cache disabled");
        } else {
            log.info("Embedding cache enabled (ttl={})", ragConfig.getCache().getEmbeddingTtl());
        }
    }

    private static Client createClient(String projectId, String location, String model) {
        if (projectId == null || projectId.isBlank()) {
            log.warn("Vertex AI not configured for embeddings - projectId is empty");
            return null;
        }
        try {
            Client client = Client.builder()
                    .project(projectId)
                    .location(location)
                    .vertexAI(true)
                    .build();
            log.info("Initialized embedding client for Vertex AI: project={}, location={}, model={}",
                    projectId, location, model);
            return client;
        } catch (Exception e) {
            log.error("Failed to initialize embedding client: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Generate the embedding for a text.
     *
     * @return embedding vector, or an empty list if the model is unavailable or returned nothing
     * @throws RateLimitException if the embedding API rejected the call with 429
     */
    public List<Float> embedText(String text) {
        String cacheKey = cacheKey(text);
        if (redisTemplate != null) {
            Object cached = redisTemplate.opsForValue().get(cacheKey);
            if (cached instanceof List<?> values && !values.isEmpty()) {
                log.debug("Cache hit for embedding {}", cacheKey);
                return toFloats(values);
            }
        }

        if (client == null) {
            log.warn("Embedding client not initialized, returning empty embedding");
            return List.of();
        }

        try {
            EmbedContentResponse response = client.models.embedContent(embeddingModel, text, null);

            Optional<List<ContentEmbedding>> embeddingsOpt = response.embeddings();
            if (embeddingsOpt.isPresent() && !embeddingsOpt.get().isEmpty()) {
                List<Float> embedding = embeddingsOpt.get().get(0).values().orElse(List.of());

                if (redisTemplate != null && !embedding.isEmpty()) {
                    redisTemplate.opsForValue().set(cacheKey, embedding,
                            parseDuration(ragConfig.getCache().getEmbeddingTtl()));
                    log.debug("Cached embedding {}", cacheKey);
                }
                return embedding;
            }

            log.warn("No embedding returned for text: {}", text.substring(0, Math.min(50, text.length())));
            return List.of();

        } catch (Exception e) {
            String message = e.getMessage();
            log.error("Error generating embedding: {}", message);
            // Rate limits go back to the caller, who decides whether to retry
            if (message != null && message.contains("429")) {
                throw new RateLimitException("Embedding API rate limited: " + message, e);
            }
            return List.of();
        }
    }

    /**
     * Exception for rate limit errors that should be retried.
     */
    public static class RateLimitException extends RuntimeException {
        public RateLimitException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Canonical text embedded for a product: name first, then both category levels.
     */
    public String buildProductEmbeddingText(String name, String mainCategory, String subCategory) {
        return String.format("%s. Category: %s. Sub-category: %s",
                name.trim(), mainCategory.trim(), subCategory.trim());
    }

    public boolean isAvailable() {
        return client != null && ragConfig.isEnabled();
    }

    public String getModelName() {
        return embeddingModel;
    }

    public int getEmbeddingDimensions() {
        return ragConfig.getEmbedding().getDimensions();
    }

    String cacheKey(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return EMBEDDING_CACHE_PREFIX + embeddingModel + ":" + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // JSON round trips turn floats into doubles
    private static List<Float> toFloats(List<?> values) {
        List<Float> floats = new ArrayList<>(values.size());
        for (Object value : values) {
            floats.add(((Number) value).floatValue());
        }
        return floats;
    }

    // Parse duration string like "24h" or "30m" to Duration
    static Duration parseDuration(String durationStr) {
        if (durationStr == null || durationStr.isBlank()) {
            return Duration.ofHours(1);
        }

        try {
            if (durationStr.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(durationStr.replace("h", "")));
            } else if (durationStr.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(durationStr.replace("m", "")));
            } else if (durationStr.endsWith("d")) {
                return Duration.ofDays(Long.parseLong(durationStr.replace("d", "")));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid duration format: {}, using default 1h", durationStr);
        }

        return Duration.ofHours(1);
    }
}
