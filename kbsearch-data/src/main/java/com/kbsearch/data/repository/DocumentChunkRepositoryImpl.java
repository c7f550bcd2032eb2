package com.kbsearch.data.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbsearch.common.exception.PersistenceException;
import com.kbsearch.data.entity.DocumentChunk;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.query.NativeQuery;
import org.hibernate.type.StandardBasicTypes;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
@Slf4j
public class DocumentChunkRepositoryImpl implements DocumentChunkRepositoryCustom {
    
    private static final ObjectMapper METADATA_MAPPER = new ObjectMapper();
    
    @PersistenceContext
    private EntityManager entityManager;
    
    @Override
    public List<UUID> batchSaveChunksWithEmbeddings(List<DocumentChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }
        
        log.info("Batch saving {} chunks with embeddings using native SQL", chunks.size());
        
        String insertSql = """
            INSERT INTO knowledge_chunks
            (id, document_id, chunk_index, content, token_count, embedding, metadata, created_at)
            VALUES (CAST(:id AS uuid), CAST(:docId AS uuid), :chunkIndex, :content, :tokenCount,
                    CAST(:embedding AS vector), CAST(:metadata AS jsonb), NOW())
            """;
        
        List<UUID> ids = new ArrayList<>(chunks.size());
        for (DocumentChunk chunk : chunks) {
            UUID chunkId = chunk.getId() != null ? chunk.getId() : UUID.randomUUID();
            try {
                Query query = entityManager.createNativeQuery(insertSql);
                query.setParameter("id", chunkId.toString());
                query.setParameter("docId", chunk.getDocumentId().toString());
                query.setParameter("chunkIndex", chunk.getChunkIndex());
                query.setParameter("content", chunk.getContent());
                query.setParameter("tokenCount", chunk.getTokenCount());
                // typed so a null vector still binds as text for the cast
                query.unwrap(NativeQuery.class)
                    .setParameter("embedding", toVectorString(chunk.getEmbedding()), StandardBasicTypes.STRING);
                query.setParameter("metadata", toJson(chunk.getMetadata()));
                
                query.executeUpdate();
                ids.add(chunkId);
            } catch (RuntimeException e) {
                log.error("Failed to save chunk at index {}: {}", chunk.getChunkIndex(), e.getMessage(), e);
                throw new PersistenceException("Failed to save chunk " + chunk.getChunkIndex() + ": " + e.getMessage(), e);
            }
        }
        
        log.info("Batch insert completed: {} chunks saved", ids.size());
        return ids;
    }
    
    @Override
    public List<ScoredChunk> findSimilarChunks(
        String queryEmbedding,
        double threshold,
        int limit,
        UUID manufacturerId,
        String category
    ) {
        StringBuilder sqlBuilder = new StringBuilder();
        sqlBuilder.append("SELECT kc.id, kc.document_id, kd.title, km.name, kc.content, ");
        sqlBuilder.append("1 - (kc.embedding <=> CAST(:queryEmbedding AS vector)) AS similarity ");
        appendFromAndFilters(sqlBuilder, manufacturerId, category);
        sqlBuilder.append("AND kc.embedding IS NOT NULL ");
        sqlBuilder.append("AND 1 - (kc.embedding <=> CAST(:queryEmbedding AS vector)) >= :threshold ");
        sqlBuilder.append("ORDER BY kc.embedding <=> CAST(:queryEmbedding AS vector) ");
        sqlBuilder.append("LIMIT :limit");
        
        Query query = entityManager.createNativeQuery(sqlBuilder.toString());
        query.setParameter("queryEmbedding", queryEmbedding);
        query.setParameter("threshold", threshold);
        query.setParameter("limit", limit);
        bindFilters(query, manufacturerId, category);
        
        return mapScoredRows(query);
    }
    
    @Override
    public List<ScoredChunk> findChunksByKeywordSearch(
        String searchQuery,
        int limit,
        UUID manufacturerId,
        String category
    ) {
        StringBuilder sqlBuilder = new StringBuilder();
        sqlBuilder.append("SELECT kc.id, kc.document_id, kd.title, km.name, kc.content, ");
        sqlBuilder.append("ts_rank(to_tsvector('english', kc.content), plainto_tsquery('english', :searchQuery)) AS rank ");
        appendFromAndFilters(sqlBuilder, manufacturerId, category);
        sqlBuilder.append("AND to_tsvector('english', kc.content) @@ plainto_tsquery('english', :searchQuery) ");
        sqlBuilder.append("ORDER BY rank DESC ");
        sqlBuilder.append("LIMIT :limit");
        
        Query query = entityManager.createNativeQuery(sqlBuilder.toString());
        query.setParameter("searchQuery", searchQuery);
        query.setParameter("limit", limit);
        bindFilters(query, manufacturerId, category);
        
        return mapScoredRows(query);
    }
    
    private void appendFromAndFilters(StringBuilder sqlBuilder, UUID manufacturerId, String category) {
        sqlBuilder.append("FROM knowledge_chunks kc ");
        sqlBuilder.append("JOIN knowledge_documents kd ON kc.document_id = kd.id ");
        sqlBuilder.append("LEFT JOIN knowledge_manufacturers km ON kd.manufacturer_id = km.id ");
        sqlBuilder.append("WHERE kd.status = 'READY' ");
        if (manufacturerId != null) {
            sqlBuilder.append("AND kd.manufacturer_id = :manufacturerId ");
        }
        if (category != null) {
            sqlBuilder.append("AND kd.category = :category ");
        }
    }
    
    private void bindFilters(Query query, UUID manufacturerId, String category) {
        if (manufacturerId != null) {
            query.setParameter("manufacturerId", manufacturerId);
        }
        if (category != null) {
            query.setParameter("category", category);
        }
    }
    
    private List<ScoredChunk> mapScoredRows(Query query) {
        @SuppressWarnings("unchecked")
        List<Object[]> rows = query.getResultList();
        
        List<ScoredChunk> results = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            results.add(new ScoredChunk(
                UUID.fromString(row[0].toString()),
                UUID.fromString(row[1].toString()),
                (String) row[2],
                (String) row[3],
                (String) row[4],
                row[5] != null ? ((Number) row[5]).doubleValue() : 0.0
            ));
        }
        return results;
    }
    
    /**
     * Convert float[] embedding to PostgreSQL vector string format: [f1,f2,f3,...]
     */
    private String toVectorString(float[] embedding) {
        if (embedding == null || embedding.length == 0) {
            return null;
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                sb.append(",");
            }
            sb.append(embedding[i]);
        }
        sb.append("]");
        return sb.toString();
    }
    
    private String toJson(Map<String, Object> metadata) {
        try {
            return METADATA_MAPPER.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Chunk metadata is not serializable: " + e.getMessage(), e);
        }
    }
}
