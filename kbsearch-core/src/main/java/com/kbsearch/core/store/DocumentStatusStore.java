package com.kbsearch.core.store;

import com.kbsearch.common.constants.ProcessingStatus;
import com.kbsearch.data.entity.Document;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Status transitions of knowledge documents. Every write is a single native UPDATE so the
 * lifecycle never depends on a loaded entity being current.
 */
public interface DocumentStatusStore {
    
    Optional<Document> findById(UUID documentId);
    
    /**
     * Moves the document to PROCESSING unless another run claimed it within {@code staleAfter}.
     * @return the claim instant when this caller now holds the document, empty otherwise
     */
    Optional<Instant> claimForProcessing(UUID documentId, Duration staleAfter);
    
    /**
     * @param claimedAt instant returned by {@link #claimForProcessing}
     * @return false when the claim was taken over and nothing was written
     */
    boolean markReady(UUID documentId, int chunkCount, Instant claimedAt);
    
    /** No-op when the claim was taken over. */
    void markError(UUID documentId, String errorMessage, Instant claimedAt);
    
    /** Document count for every status, zero included. */
    Map<ProcessingStatus, Long> countByStatus();
}
