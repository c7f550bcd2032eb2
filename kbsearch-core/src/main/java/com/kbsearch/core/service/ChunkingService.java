package com.kbsearch.core.service;

import com.kbsearch.common.util.TokenCounter;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import com.kbsearch.core.model.ChunkingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Paragraph-first chunker with character overlap and a sentence-level post-split for
 * oversized chunks. All sizes are token estimates converted to characters (4 chars/token).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkingService {
    
    static final int MIN_CHUNK_CHARS = 50;
    private static final double OVERSIZE_FACTOR = 1.5;
    private static final String PARAGRAPH_SEPARATOR = "\n\n";
    
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\n\n+");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    
    private final KnowledgeBaseProperties properties;
    
    /**
     * CRLF to LF, 3+ newlines collapsed to a blank line, trimmed.
     */
    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.replace("\r\n", "\n");
        normalized = EXCESS_NEWLINES.matcher(normalized).replaceAll(PARAGRAPH_SEPARATOR);
        return normalized.trim();
    }
    
    public List<ChunkingResult> chunkText(String text) {
        KnowledgeBaseProperties.Ingestion ingestion = properties.getIngestion();
        return chunkText(text, ingestion.getChunkSizeTokens(), ingestion.getOverlapTokens());
    }
    
    /**
     * Chunk text by paragraphs, carrying the tail of each emitted chunk into the next one.
     * Empty or whitespace-only input yields no chunks.
     */
    public List<ChunkingResult> chunkText(String text, int targetTokens, int overlapTokens) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        
        int maxChars = TokenCounter.maxCharsForTokens(targetTokens);
        int overlapChars = TokenCounter.maxCharsForTokens(overlapTokens);
        
        List<String> paragraphChunks = accumulateParagraphs(normalized, maxChars, overlapChars);
        
        List<ChunkingResult> chunks = new ArrayList<>();
        for (String chunk : paragraphChunks) {
            List<String> pieces = chunk.length() > maxChars * OVERSIZE_FACTOR
                ? splitBySentences(chunk, maxChars)
                : List.of(chunk);
            
            for (String piece : pieces) {
                if (piece.length() < MIN_CHUNK_CHARS) {
                    log.debug("Dropping {}-character fragment", piece.length());
                    continue;
                }
                chunks.add(ChunkingResult.builder()
                    .content(piece)
                    .tokenCount(TokenCounter.countTokens(piece))
                    .chunkIndex(chunks.size())
                    .build());
            }
        }
        
        log.info("Created {} chunks from {} characters ({} paragraph chunks)",
            chunks.size(), normalized.length(), paragraphChunks.size());
        return chunks;
    }
    
    private List<String> accumulateParagraphs(String normalized, int maxChars, int overlapChars) {
        List<String> chunks = new ArrayList<>();
        StringBuilder currentChunk = new StringBuilder();
        
        for (String paragraph : PARAGRAPH_BREAK.split(normalized)) {
            if (currentChunk.length() + paragraph.length() > maxChars && currentChunk.length() > 0) {
                chunks.add(currentChunk.toString().trim());
                
                String overlap = getLastNChars(currentChunk.toString(), overlapChars);
                currentChunk = new StringBuilder(overlap)
                    .append(PARAGRAPH_SEPARATOR)
                    .append(paragraph);
            } else {
                if (currentChunk.length() > 0) {
                    currentChunk.append(PARAGRAPH_SEPARATOR);
                }
                currentChunk.append(paragraph);
            }
        }
        
        if (!currentChunk.toString().isBlank()) {
            chunks.add(currentChunk.toString().trim());
        }
        return chunks;
    }
    
    /**
     * Greedy sentence accumulation without overlap. A single sentence longer than the
     * target is kept whole.
     */
    private List<String> splitBySentences(String chunk, int maxChars) {
        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        
        for (String sentence : SENTENCE_BREAK.split(chunk)) {
            int separator = current.length() > 0 ? 1 : 0;
            if (current.length() + separator + sentence.length() > maxChars && current.length() > 0) {
                pieces.add(current.toString().trim());
                current = new StringBuilder(sentence);
            } else {
                if (current.length() > 0) {
                    current.append(' ');
                }
                current.append(sentence);
            }
        }
        if (current.length() > 0) {
            pieces.add(current.toString().trim());
        }
        return pieces;
    }
    
    private String getLastNChars(String text, int n) {
        if (text.length() <= n) {
            return text;
        }
        return text.substring(text.length() - n);
    }
}
