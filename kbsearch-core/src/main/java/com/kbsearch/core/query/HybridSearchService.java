package com.kbsearch.core.query;

import com.kbsearch.common.exception.SearchException;
import com.kbsearch.core.query.model.SearchMode;
import com.kbsearch.core.query.model.SearchResult;
import com.kbsearch.data.repository.DocumentChunkRepository;
import com.kbsearch.data.repository.DocumentChunkRepositoryCustom;
import com.kbsearch.llm.service.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Vector, full-text and hybrid search over chunks of READY documents.
 *
 * Hybrid runs both branches concurrently on the search executor and merges by chunk id:
 * vector entries win collisions, text-only entries copy rank into similarity, and the merged
 * list is sorted by score with vector entries ahead on ties.
 */
@Service
@Slf4j
public class HybridSearchService {
    
    private final DocumentChunkRepository chunkRepository;
    private final EmbeddingService embeddingService;
    private final Executor searchExecutor;
    
    public HybridSearchService(
        DocumentChunkRepository chunkRepository,
        EmbeddingService embeddingService,
        @Qualifier("searchExecutor") Executor searchExecutor
    ) {
        this.chunkRepository = chunkRepository;
        this.embeddingService = embeddingService;
        this.searchExecutor = searchExecutor;
    }
    
    /**
     * Embeds the query and returns chunks with cosine similarity at or above the threshold.
     */
    public List<SearchResult> vectorSearch(String query, UUID manufacturerId, String category, int limit, double threshold) {
        long startTime = System.currentTimeMillis();
        String queryEmbedding = embeddingService.toVectorString(embeddingService.generateEmbedding(query));
        
        List<SearchResult> results = chunkRepository
            .findSimilarChunks(queryEmbedding, threshold, limit, manufacturerId, category)
            .stream()
            .map(this::toVectorResult)
            .collect(Collectors.toList());
        
        log.info("[VECTOR_SEARCH] Completed | resultsCount={} | limit={} | threshold={} | durationMs={}",
            results.size(), limit, threshold, System.currentTimeMillis() - startTime);
        return results;
    }
    
    /**
     * PostgreSQL full-text search (english tsvector) ordered by ts_rank.
     */
    public List<SearchResult> textSearch(String query, UUID manufacturerId, String category, int limit) {
        long startTime = System.currentTimeMillis();
        
        List<SearchResult> results = chunkRepository
            .findChunksByKeywordSearch(query, limit, manufacturerId, category)
            .stream()
            .map(this::toTextResult)
            .collect(Collectors.toList());
        
        log.info("[TEXT_SEARCH] Completed | resultsCount={} | limit={} | durationMs={}",
            results.size(), limit, System.currentTimeMillis() - startTime);
        return results;
    }
    
    /**
     * Both branches fetch {@code limit * 2} candidates. A failing branch is logged and the
     * other branch's results are used; if both fail a {@link SearchException} is thrown.
     */
    public List<SearchResult> hybridSearch(String query, UUID manufacturerId, String category, int limit, double threshold) {
        long startTime = System.currentTimeMillis();
        String searchId = "hybrid-" + startTime + "-" + Thread.currentThread().getId();
        int candidateLimit = limit * 2;
        
        log.info("[HYBRID_SEARCH] Starting hybrid search | searchId={} | queryLength={} | limit={} | hasManufacturer={}",
            searchId, query.length(), limit, manufacturerId != null);
        
        CompletableFuture<List<SearchResult>> vectorFuture =
            submit(() -> vectorSearch(query, manufacturerId, category, candidateLimit, threshold));
        CompletableFuture<List<SearchResult>> textFuture =
            submit(() -> textSearch(query, manufacturerId, category, candidateLimit));
        
        RuntimeException vectorError = null;
        RuntimeException textError = null;
        List<SearchResult> vectorResults = List.of();
        List<SearchResult> textResults = List.of();
        
        try {
            vectorResults = vectorFuture.join();
        } catch (CompletionException e) {
            vectorError = unwrap(e);
            log.warn("[HYBRID_SEARCH] Vector branch failed, using text results only | searchId={} | error={}",
                searchId, vectorError.getMessage());
        }
        try {
            textResults = textFuture.join();
        } catch (CompletionException e) {
            textError = unwrap(e);
            log.warn("[HYBRID_SEARCH] Text branch failed, using vector results only | searchId={} | error={}",
                searchId, textError.getMessage());
        }
        
        if (vectorError != null && textError != null) {
            SearchException failure = new SearchException(
                "Hybrid search failed: vector branch: " + vectorError.getMessage()
                    + "; text branch: " + textError.getMessage(), vectorError);
            failure.addSuppressed(textError);
            throw failure;
        }
        
        List<SearchResult> merged = merge(vectorResults, textResults, limit);
        
        log.info("[HYBRID_SEARCH] Hybrid search completed | searchId={} | vectorResults={} | textResults={} | finalResults={} | totalDurationMs={}",
            searchId, vectorResults.size(), textResults.size(), merged.size(), System.currentTimeMillis() - startTime);
        return merged;
    }
    
    /**
     * Deduplicates by chunk id, vector entries first, then a stable descending sort on
     * similarity (rank for text-only entries).
     */
    List<SearchResult> merge(List<SearchResult> vectorResults, List<SearchResult> textResults, int limit) {
        Map<UUID, SearchResult> combined = new LinkedHashMap<>();
        
        for (SearchResult result : vectorResults) {
            combined.putIfAbsent(result.getChunkId(), result);
        }
        for (SearchResult result : textResults) {
            if (!combined.containsKey(result.getChunkId())) {
                combined.put(result.getChunkId(), result.toBuilder()
                    .similarity(result.getRank())
                    .build());
            }
        }
        
        List<SearchResult> sorted = new ArrayList<>(combined.values());
        // List.sort is stable, so insertion order breaks ties
        sorted.sort(Comparator.comparingDouble(SearchResult::sortScore).reversed());
        
        return sorted.stream()
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    private SearchResult toVectorResult(DocumentChunkRepositoryCustom.ScoredChunk row) {
        return SearchResult.builder()
            .chunkId(row.getChunkId())
            .documentId(row.getDocumentId())
            .documentTitle(row.getDocumentTitle())
            .manufacturer(row.getManufacturerName())
            .content(row.getContent())
            .similarity(roundTwoDecimals(row.getScore()))
            .relevanceScore((int) Math.round(row.getScore() * 100))
            .source(SearchMode.VECTOR)
            .build();
    }
    
    private SearchResult toTextResult(DocumentChunkRepositoryCustom.ScoredChunk row) {
        return SearchResult.builder()
            .chunkId(row.getChunkId())
            .documentId(row.getDocumentId())
            .documentTitle(row.getDocumentTitle())
            .manufacturer(row.getManufacturerName())
            .content(row.getContent())
            .rank(roundTwoDecimals(row.getScore()))
            .source(SearchMode.TEXT)
            .build();
    }
    
    static double roundTwoDecimals(double value) {
        return Math.round(value * 100) / 100.0;
    }
    
    /** A full search executor fails the branch instead of the whole request. */
    private CompletableFuture<List<SearchResult>> submit(Supplier<List<SearchResult>> branch) {
        try {
            return CompletableFuture.supplyAsync(branch, searchExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
    
    private RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause instanceof RuntimeException ? (RuntimeException) cause : new CompletionException(cause);
    }
}
