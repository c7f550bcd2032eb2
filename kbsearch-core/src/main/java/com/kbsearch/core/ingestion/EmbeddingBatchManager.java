package com.kbsearch.core.ingestion;

import com.kbsearch.common.exception.EmbeddingProviderException;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import com.kbsearch.core.model.ChunkingResult;
import com.kbsearch.core.model.EmbeddedChunk;
import com.kbsearch.llm.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups chunks into embedding requests that respect the per-chunk token ceiling and the
 * per-request token budget. Calls are issued one after another; the first failure aborts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbeddingBatchManager {
    
    private final EmbeddingService embeddingService;
    private final KnowledgeBaseProperties properties;
    
    /**
     * @return surviving chunks paired with their vectors, in original order
     */
    public List<EmbeddedChunk> embedChunks(List<ChunkingResult> chunks) {
        List<ChunkingResult> validChunks = dropOversized(chunks);
        List<List<ChunkingResult>> batches = planBatches(validChunks);
        
        log.info("[EMBED] Embedding {} chunks in {} batches (dropped {} oversized)",
            validChunks.size(), batches.size(), chunks.size() - validChunks.size());
        
        List<EmbeddedChunk> embedded = new ArrayList<>(validChunks.size());
        int batchNumber = 0;
        for (List<ChunkingResult> batch : batches) {
            batchNumber++;
            int batchTokens = totalTokens(batch);
            
            if (batchTokens > properties.getIngestion().getMaxRequestTokens()) {
                log.warn("[EMBED] Batch {} has {} tokens, over the request budget; embedding one chunk per call",
                    batchNumber, batchTokens);
                for (ChunkingResult chunk : batch) {
                    embedded.addAll(embedBatch(List.of(chunk)));
                }
            } else {
                embedded.addAll(embedBatch(batch));
            }
            log.debug("[EMBED] Batch {}/{} done | chunks={} | tokens={}",
                batchNumber, batches.size(), batch.size(), batchTokens);
        }
        return embedded;
    }
    
    /**
     * Applies the same token ceiling as {@link #embedChunks} but pairs chunks with no vector.
     */
    public List<EmbeddedChunk> withoutEmbeddings(List<ChunkingResult> chunks) {
        return dropOversized(chunks).stream()
            .map(chunk -> EmbeddedChunk.builder().chunk(chunk).build())
            .toList();
    }
    
    List<ChunkingResult> dropOversized(List<ChunkingResult> chunks) {
        int maxChunkTokens = properties.getIngestion().getMaxChunkTokens();
        List<ChunkingResult> valid = new ArrayList<>(chunks.size());
        for (ChunkingResult chunk : chunks) {
            if (chunk.getTokenCount() > maxChunkTokens) {
                log.warn("[EMBED] Skipping oversized chunk {}: {} tokens (ceiling {})",
                    chunk.getChunkIndex(), chunk.getTokenCount(), maxChunkTokens);
                continue;
            }
            valid.add(chunk);
        }
        return valid;
    }
    
    /**
     * Batches of at most maxBatchSize chunks; a chunk that would push the running total over
     * the request budget closes the current batch and opens the next.
     */
    List<List<ChunkingResult>> planBatches(List<ChunkingResult> chunks) {
        int maxBatchSize = properties.getIngestion().getMaxBatchSize();
        int maxRequestTokens = properties.getIngestion().getMaxRequestTokens();
        
        List<List<ChunkingResult>> batches = new ArrayList<>();
        List<ChunkingResult> current = new ArrayList<>();
        int currentTokens = 0;
        
        for (ChunkingResult chunk : chunks) {
            boolean full = current.size() >= maxBatchSize;
            boolean overBudget = currentTokens + chunk.getTokenCount() > maxRequestTokens;
            if (!current.isEmpty() && (full || overBudget)) {
                batches.add(current);
                current = new ArrayList<>();
                currentTokens = 0;
            }
            current.add(chunk);
            currentTokens += chunk.getTokenCount();
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }
    
    private List<EmbeddedChunk> embedBatch(List<ChunkingResult> batch) {
        List<String> texts = batch.stream().map(ChunkingResult::getContent).toList();
        List<float[]> embeddings = embeddingService.generateEmbeddings(texts);
        
        if (embeddings.size() != batch.size()) {
            throw new EmbeddingProviderException(String.format(
                "Embedding count mismatch: expected %d, got %d", batch.size(), embeddings.size()));
        }
        
        List<EmbeddedChunk> result = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            result.add(EmbeddedChunk.builder()
                .chunk(batch.get(i))
                .embedding(embeddings.get(i))
                .build());
        }
        return result;
    }
    
    private int totalTokens(List<ChunkingResult> batch) {
        return batch.stream().mapToInt(ChunkingResult::getTokenCount).sum();
    }
}
