package com.kbsearch.core.service;

import com.kbsearch.common.exception.ConfigurationException;
import com.kbsearch.common.exception.DocumentBusyException;
import com.kbsearch.common.exception.DocumentNotFoundException;
import com.kbsearch.common.exception.ExtractionException;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import com.kbsearch.core.ingestion.EmbeddingBatchManager;
import com.kbsearch.core.model.ChunkRecord;
import com.kbsearch.core.model.ChunkingResult;
import com.kbsearch.core.model.EmbeddedChunk;
import com.kbsearch.core.model.ExtractedText;
import com.kbsearch.core.model.ProcessingResult;
import com.kbsearch.core.model.RawTextResult;
import com.kbsearch.core.processor.DocumentSourceFetcher;
import com.kbsearch.core.processor.TextExtractor;
import com.kbsearch.core.processor.TextExtractorFactory;
import com.kbsearch.core.store.ChunkStore;
import com.kbsearch.core.store.DocumentStatusStore;
import com.kbsearch.data.entity.Document;
import com.kbsearch.llm.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Document lifecycle: claim, extract, chunk, embed, replace chunks, mark READY.
 *
 * Status writes are single native UPDATEs outside any long transaction, so no database
 * connection is held during the embedding calls. Any failure after the claim is written
 * to error_message and rethrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {
    
    static final String SOURCE_PROVIDED = "provided";
    
    private final DocumentStatusStore statusStore;
    private final ChunkStore chunkStore;
    private final TextExtractorFactory extractorFactory;
    private final DocumentSourceFetcher sourceFetcher;
    private final ChunkingService chunkingService;
    private final EmbeddingBatchManager batchManager;
    private final EmbeddingService embeddingService;
    private final KnowledgeBaseProperties properties;
    
    /**
     * Process a stored document.
     *
     * @param documentId   knowledge document id
     * @param providedText text supplied by the caller; takes precedence over the document's file_url
     * @throws DocumentNotFoundException when the id is unknown (no status write)
     * @throws DocumentBusyException     when another run holds a fresh claim (no status write), or
     *                                   took this run's claim over before it finished
     */
    public ProcessingResult processDocument(UUID documentId, String providedText) {
        Document document = statusStore.findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
        
        Duration staleAfter = Duration.ofMinutes(properties.getIngestion().getStaleProcessingMinutes());
        Instant claimedAt = statusStore.claimForProcessing(documentId, staleAfter).orElseThrow(() -> {
            log.warn("[PROCESS] Document is already being processed | documentId={}", documentId);
            return new DocumentBusyException(documentId);
        });
        
        long startTime = System.currentTimeMillis();
        try {
            log.info("[PROCESS] Starting | documentId={} | fileName={} | fileType={}",
                documentId, document.getFileName(), document.getFileType());
            
            ExtractedText extracted = resolveText(document, providedText);
            String text = extracted.getText() != null ? extracted.getText() : "";
            
            String normalized = chunkingService.normalize(text);
            if (normalized.length() < properties.getIngestion().getMinTextLength()) {
                throw new ExtractionException("Extracted text is too short or empty");
            }
            
            List<ChunkingResult> chunks = chunkingService.chunkText(normalized);
            if (chunks.isEmpty()) {
                throw new ExtractionException("No chunks could be produced from the extracted text");
            }
            
            List<EmbeddedChunk> embedded = embedOrSkip(chunks);
            if (embedded.isEmpty()) {
                throw new ExtractionException("All chunks exceeded the embedding token limit");
            }
            
            List<ChunkRecord> records = toRecords(embedded, document, extracted.getSource());
            
            // Reprocessing replaces the whole chunk set
            int deleted = chunkStore.deleteAllForDocument(documentId);
            chunkStore.insertBatch(documentId, records);
            if (!statusStore.markReady(documentId, records.size(), claimedAt)) {
                log.warn("[PROCESS] Claim taken over before completion | documentId={} | claimedAt={}",
                    documentId, claimedAt);
                throw new DocumentBusyException(documentId);
            }
            
            long duration = System.currentTimeMillis() - startTime;
            log.info("[PROCESS] Completed | documentId={} | chunks={} | replaced={} | characters={} | durationMs={}",
                documentId, records.size(), deleted, text.length(), duration);
            
            return ProcessingResult.builder()
                .documentId(documentId)
                .chunksCreated(records.size())
                .totalCharacters(text.length())
                .durationMs(duration)
                .build();
            
        } catch (RuntimeException e) {
            log.error("[PROCESS] Failed | documentId={} | error={}", documentId, e.getMessage(), e);
            markFailed(documentId, claimedAt, e);
            throw e;
        }
    }
    
    /**
     * Chunk and embed text without persisting anything. Without a configured provider the
     * chunks are returned with no vectors.
     */
    public RawTextResult processRawText(String text) {
        List<ChunkingResult> chunks = chunkingService.chunkText(text);
        
        List<EmbeddedChunk> embedded;
        if (embeddingService.isAvailable()) {
            embedded = batchManager.embedChunks(chunks);
        } else {
            log.warn("[RAW_TEXT] Embedding provider not configured, returning chunks without embeddings");
            embedded = batchManager.withoutEmbeddings(chunks);
        }
        
        List<RawTextResult.RawTextChunk> rawChunks = new ArrayList<>(embedded.size());
        for (EmbeddedChunk item : embedded) {
            rawChunks.add(RawTextResult.RawTextChunk.builder()
                .index(rawChunks.size())
                .content(item.getChunk().getContent())
                .tokenCount(item.getChunk().getTokenCount())
                .embeddingDimensions(item.getEmbeddingDimensions())
                .build());
        }
        
        log.info("[RAW_TEXT] Chunked {} characters into {} chunks", text != null ? text.length() : 0, rawChunks.size());
        return RawTextResult.builder()
            .chunkCount(rawChunks.size())
            .chunks(rawChunks)
            .build();
    }
    
    private ExtractedText resolveText(Document document, String providedText) {
        if (providedText != null && !providedText.isBlank()) {
            log.debug("Using caller-supplied text ({} characters) for document {}", providedText.length(), document.getId());
            return ExtractedText.builder()
                .text(providedText)
                .title(document.getTitle())
                .source(SOURCE_PROVIDED)
                .build();
        }
        
        if (document.getFileUrl() == null || document.getFileUrl().isBlank()) {
            throw new ExtractionException("No file URL or text provided");
        }
        
        TextExtractor extractor = extractorFactory.getExtractor(document.getFileType());
        byte[] content = sourceFetcher.fetch(document.getFileUrl());
        try (InputStream stream = new ByteArrayInputStream(content)) {
            return extractor.extract(stream, document.getFileType());
        } catch (IOException e) {
            throw new ExtractionException("Failed to read " + document.getFileType() + " content: " + e.getMessage(), e);
        }
    }
    
    private List<EmbeddedChunk> embedOrSkip(List<ChunkingResult> chunks) {
        if (embeddingService.isAvailable()) {
            return batchManager.embedChunks(chunks);
        }
        if (properties.getIngestion().isRequireEmbeddings()) {
            throw new ConfigurationException("Embedding provider not configured. Set OPENAI_API_KEY or openai.api-key");
        }
        log.warn("[PROCESS] Embedding provider not configured, storing {} chunks without embeddings", chunks.size());
        return batchManager.withoutEmbeddings(chunks);
    }
    
    private List<ChunkRecord> toRecords(List<EmbeddedChunk> embedded, Document document, String textSource) {
        List<ChunkRecord> records = new ArrayList<>(embedded.size());
        for (EmbeddedChunk item : embedded) {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("fileName", document.getFileName());
            metadata.put("fileType", document.getFileType());
            metadata.put("textSource", textSource);
            
            // Contiguous indexes over the chunks that survived the token ceiling
            records.add(ChunkRecord.builder()
                .chunkIndex(records.size())
                .content(item.getChunk().getContent())
                .tokenCount(item.getChunk().getTokenCount())
                .embedding(item.getEmbedding())
                .metadata(metadata)
                .build());
        }
        return records;
    }
    
    private void markFailed(UUID documentId, Instant claimedAt, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            statusStore.markError(documentId, message, claimedAt);
        } catch (RuntimeException statusError) {
            log.error("[PROCESS] Could not record failure for document {}: {}", documentId, statusError.getMessage());
            cause.addSuppressed(statusError);
        }
    }
}
