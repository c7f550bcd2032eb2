package com.kbsearch.llm.service;

import com.kbsearch.llm.provider.EmbeddingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Embedding facade used by ingestion and retrieval.
 *
 * - For documents: batch method (generateEmbeddings), one provider call per batch
 * - For queries: single method (generateEmbedding)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

    private final EmbeddingProvider embeddingProvider;

    public boolean isAvailable() {
        return embeddingProvider.isConfigured();
    }

    public int getDimensions() {
        return embeddingProvider.getDimensions();
    }

    public float[] generateEmbedding(String text) {
        log.debug("Generating embedding for text of length: {}", text.length());
        return embeddingProvider.embed(List.of(text)).get(0);
    }

    /**
     * @return one embedding per text, in the same order
     */
    public List<float[]> generateEmbeddings(List<String> texts) {
        log.debug("Generating {} embeddings in one call", texts.size());
        return embeddingProvider.embed(texts);
    }

    /**
     * Convert float array to pgvector format string
     */
    public String toVectorString(float[] embedding) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < embedding.length; i++) {
            sb.append(embedding[i]);
            if (i < embedding.length - 1) {
                sb.append(",");
            }
        }
        sb.append("]");
        return sb.toString();
    }
}
