package com.kbsearch.core.store;

import com.kbsearch.common.exception.PersistenceException;
import com.kbsearch.core.model.ChunkRecord;
import com.kbsearch.data.entity.DocumentChunk;
import com.kbsearch.data.repository.DocumentChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class PostgresChunkStore implements ChunkStore {
    
    private final DocumentChunkRepository chunkRepository;
    
    @Override
    @Transactional
    public int deleteAllForDocument(UUID documentId) {
        try {
            int deleted = chunkRepository.deleteByDocumentId(documentId);
            log.debug("Deleted {} existing chunks for document: {}", deleted, documentId);
            return deleted;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to delete chunks for document " + documentId + ": " + e.getMessage(), e);
        }
    }
    
    @Override
    @Transactional
    public List<UUID> insertBatch(UUID documentId, List<ChunkRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        
        List<DocumentChunk> chunks = records.stream()
            .map(record -> DocumentChunk.builder()
                .id(UUID.randomUUID())
                .documentId(documentId)
                .chunkIndex(record.getChunkIndex())
                .content(record.getContent())
                .tokenCount(record.getTokenCount())
                .embedding(record.getEmbedding())
                .metadata(record.getMetadata() != null ? new HashMap<>(record.getMetadata()) : new HashMap<>())
                .build())
            .toList();
        
        try {
            return chunkRepository.batchSaveChunksWithEmbeddings(chunks);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to insert chunks for document " + documentId + ": " + e.getMessage(), e);
        }
    }
    
    @Override
    public long countForDocument(UUID documentId) {
        return chunkRepository.countByDocumentId(documentId);
    }
}
