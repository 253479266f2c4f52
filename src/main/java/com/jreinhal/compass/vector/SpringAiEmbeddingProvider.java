package com.jreinhal.compass.vector;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

@Component
public class SpringAiEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);
    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        try {
            return this.embeddingModel.embed(text);
        }
        catch (RuntimeException e) {
            log.error("Embedding request failed", e);
            throw new VectorStoreException("Embedding failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        try {
            return this.embeddingModel.embed(texts);
        }
        catch (RuntimeException e) {
            log.error("Batch embedding request failed for {} texts", texts.size(), e);
            throw new VectorStoreException("Batch embedding failed: " + e.getMessage(), e);
        }
    }
}
