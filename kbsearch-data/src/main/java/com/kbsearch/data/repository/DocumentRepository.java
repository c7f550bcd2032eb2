package com.kbsearch.data.repository;

import com.kbsearch.common.constants.ProcessingStatus;
import com.kbsearch.data.entity.Document;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {
    
    long countByStatus(ProcessingStatus status);
    
    /**
     * Compare-and-swap claim of a document for processing. Succeeds (returns 1) unless another
     * run holds the document and its claim is newer than {@code staleBefore}.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE knowledge_documents
        SET status = 'PROCESSING',
            error_message = NULL,
            processing_started_at = :startedAt,
            processing_completed_at = NULL
        WHERE id = :id
          AND (status <> 'PROCESSING'
               OR processing_started_at IS NULL
               OR processing_started_at < :staleBefore)
        """, nativeQuery = true)
    int claimForProcessing(
        @Param("id") UUID id,
        @Param("startedAt") Instant startedAt,
        @Param("staleBefore") Instant staleBefore
    );
    
    /**
     * Marks the document ready. Only the run whose claim wrote {@code startedAt} can finish it;
     * returns 0 once a stale takeover has replaced that claim.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE knowledge_documents
        SET status = 'READY',
            chunk_count = :chunkCount,
            error_message = NULL,
            processing_completed_at = :completedAt
        WHERE id = :id
          AND processing_started_at = :startedAt
        """, nativeQuery = true)
    int setReadyStatus(
        @Param("id") UUID id,
        @Param("chunkCount") int chunkCount,
        @Param("startedAt") Instant startedAt,
        @Param("completedAt") Instant completedAt
    );
    
    /**
     * Marks the document failed, under the same claim check as {@link #setReadyStatus}.
     * chunk_count is recomputed from the chunks that actually remain.
     */
    @Modifying
    @Transactional
    @Query(value = """
        UPDATE knowledge_documents
        SET status = 'ERROR',
            error_message = :errorMessage,
            chunk_count = (SELECT COUNT(*) FROM knowledge_chunks WHERE document_id = :id),
            processing_completed_at = :completedAt
        WHERE id = :id
          AND processing_started_at = :startedAt
        """, nativeQuery = true)
    int setErrorStatus(
        @Param("id") UUID id,
        @Param("errorMessage") String errorMessage,
        @Param("startedAt") Instant startedAt,
        @Param("completedAt") Instant completedAt
    );
}
