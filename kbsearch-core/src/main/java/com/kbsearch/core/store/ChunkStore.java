package com.kbsearch.core.store;

import com.kbsearch.core.model.ChunkRecord;

import java.util.List;
import java.util.UUID;

/**
 * Persists and replaces the chunk set of a document. Callers serialize
 * delete-then-insert per document through the processing claim.
 */
public interface ChunkStore {
    
    /**
     * Idempotent bulk delete.
     * @return number of chunks removed
     */
    int deleteAllForDocument(UUID documentId);
    
    /**
     * Inserts all records in chunk_index order, all or none.
     * @return assigned chunk ids in input order
     */
    List<UUID> insertBatch(UUID documentId, List<ChunkRecord> records);
    
    long countForDocument(UUID documentId);
}
