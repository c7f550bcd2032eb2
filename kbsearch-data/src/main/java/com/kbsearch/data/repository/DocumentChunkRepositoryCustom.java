package com.kbsearch.data.repository;

import com.kbsearch.data.entity.DocumentChunk;

import java.util.List;
import java.util.UUID;

public interface DocumentChunkRepositoryCustom {
    
    /**
     * Inserts chunks (with embeddings, when present) in list order.
     * Transaction is managed by the caller.
     *
     * @return assigned chunk ids, same order as the input
     */
    List<UUID> batchSaveChunksWithEmbeddings(List<DocumentChunk> chunks);
    
    /**
     * Cosine similarity search over chunks of READY documents.
     * @param queryEmbedding query vector in pgvector text form
     * @param threshold minimum similarity (inclusive)
     * @param manufacturerId optional manufacturer filter
     * @param category optional document category filter
     */
    List<ScoredChunk> findSimilarChunks(
        String queryEmbedding,
        double threshold,
        int limit,
        UUID manufacturerId,
        String category
    );
    
    /**
     * Full-text search (english tsvector, plainto_tsquery) over chunks of READY documents,
     * ordered by ts_rank.
     */
    List<ScoredChunk> findChunksByKeywordSearch(
        String searchQuery,
        int limit,
        UUID manufacturerId,
        String category
    );
    
    /**
     * Search row: chunk plus its document title, manufacturer name and score.
     */
    class ScoredChunk {
        private final UUID chunkId;
        private final UUID documentId;
        private final String documentTitle;
        private final String manufacturerName;
        private final String content;
        private final double score;
        
        public ScoredChunk(UUID chunkId, UUID documentId, String documentTitle,
                           String manufacturerName, String content, double score) {
            this.chunkId = chunkId;
            this.documentId = documentId;
            this.documentTitle = documentTitle;
            this.manufacturerName = manufacturerName;
            this.content = content;
            this.score = score;
        }
        
        public UUID getChunkId() { return chunkId; }
        public UUID getDocumentId() { return documentId; }
        public String getDocumentTitle() { return documentTitle; }
        public String getManufacturerName() { return manufacturerName; }
        public String getContent() { return content; }
        public double getScore() { return score; }
    }
}
