package com.simiq.app;

import com.simiq.rag.config.RagConfig;
import com.simiq.rag.exception.VectorIndexException;
import com.simiq.rag.service.VectorIndexGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Makes sure the product collection exists once the server is up.
 * If the index is down the server still starts; requests get 503 until it comes back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VectorIndexInitializer {

    private final VectorIndexGateway vectorIndexGateway;
    private final RagConfig ragConfig;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!ragConfig.isEnabled() || !vectorIndexGateway.isAvailable()) {
            log.warn("Vector index not configured - skipping collection check");
            return;
        }

        String collection = ragConfig.getVectorSearch().getCollection();
        try {
            vectorIndexGateway.ensureCollection(collection, ragConfig.getEmbedding().getDimensions());
            log.info("Vector index ready: collection={}, dimensions={}",
                    collection, ragConfig.getEmbedding().getDimensions());
        } catch (VectorIndexException e) {
            log.error("Vector index not reachable at startup, will retry on first request: {}", e.getMessage());
        }
    }
}
