package com.kbsearch.core.store;

import com.kbsearch.common.constants.ProcessingStatus;
import com.kbsearch.data.entity.Document;
import com.kbsearch.data.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaDocumentStatusStore implements DocumentStatusStore {
    
    static final int MAX_ERROR_MESSAGE_LENGTH = 2000;
    
    private final DocumentRepository documentRepository;
    
    @Override
    @Transactional(readOnly = true)
    public Optional<Document> findById(UUID documentId) {
        return documentRepository.findById(documentId);
    }
    
    @Override
    public Optional<Instant> claimForProcessing(UUID documentId, Duration staleAfter) {
        // TIMESTAMPTZ keeps microseconds; the later equality checks compare against this value
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        int updated = documentRepository.claimForProcessing(documentId, now, now.minus(staleAfter));
        log.debug("Claim for document {} {}", documentId, updated == 1 ? "acquired" : "rejected");
        return updated == 1 ? Optional.of(now) : Optional.empty();
    }
    
    @Override
    public boolean markReady(UUID documentId, int chunkCount, Instant claimedAt) {
        int updated = documentRepository.setReadyStatus(documentId, chunkCount, claimedAt, Instant.now());
        if (updated == 0) {
            log.warn("Document {} no longer held by this run (deleted or taken over), not marking READY ({} chunks)",
                documentId, chunkCount);
            return false;
        }
        log.debug("Updated document {} status to READY via native SQL ({} chunks)", documentId, chunkCount);
        return true;
    }
    
    @Override
    public void markError(UUID documentId, String errorMessage, Instant claimedAt) {
        String truncatedError = errorMessage != null && errorMessage.length() > MAX_ERROR_MESSAGE_LENGTH
            ? errorMessage.substring(0, MAX_ERROR_MESSAGE_LENGTH)
            : errorMessage;
        
        int updated = documentRepository.setErrorStatus(documentId, truncatedError, claimedAt, Instant.now());
        if (updated == 0) {
            // deleted mid-run, or a stale takeover now owns the status
            log.warn("Document {} no longer held by this run, not marking as ERROR. Error message: {}", documentId, truncatedError);
        } else {
            log.debug("Updated document {} status to ERROR via native SQL", documentId);
        }
    }
    
    @Override
    @Transactional(readOnly = true)
    public Map<ProcessingStatus, Long> countByStatus() {
        Map<ProcessingStatus, Long> counts = new EnumMap<>(ProcessingStatus.class);
        for (ProcessingStatus status : ProcessingStatus.values()) {
            counts.put(status, documentRepository.countByStatus(status));
        }
        return counts;
    }
}
