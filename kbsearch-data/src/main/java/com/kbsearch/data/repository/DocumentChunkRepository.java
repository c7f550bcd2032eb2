package com.kbsearch.data.repository;

import com.kbsearch.data.entity.DocumentChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Repository
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID>, DocumentChunkRepositoryCustom {
    
    // Native delete so the vector column is never loaded
    @Modifying
    @Transactional
    @Query(value = "DELETE FROM knowledge_chunks WHERE document_id = :documentId", nativeQuery = true)
    int deleteByDocumentId(@Param("documentId") UUID documentId);
    
    @Query(value = """
        SELECT COUNT(*) FROM knowledge_chunks
        WHERE document_id = :documentId
        """, nativeQuery = true)
    long countByDocumentId(@Param("documentId") UUID documentId);
}
