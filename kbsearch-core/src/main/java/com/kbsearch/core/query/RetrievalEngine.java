package com.kbsearch.core.query;

import com.kbsearch.common.constants.DocumentCategories;
import com.kbsearch.common.exception.ConfigurationException;
import com.kbsearch.common.exception.SearchException;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import com.kbsearch.core.query.model.SearchFilters;
import com.kbsearch.core.query.model.SearchMode;
import com.kbsearch.core.query.model.SearchQuery;
import com.kbsearch.core.query.model.SearchResponse;
import com.kbsearch.core.query.model.SearchResult;
import com.kbsearch.data.entity.Manufacturer;
import com.kbsearch.data.repository.ManufacturerRepository;
import com.kbsearch.llm.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for knowledge search. Applies defaults, resolves manufacturer slugs and
 * degrades vector/hybrid to text search when no embedding provider is configured.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalEngine {
    
    private final HybridSearchService hybridSearchService;
    private final EmbeddingService embeddingService;
    private final ManufacturerRepository manufacturerRepository;
    private final KnowledgeBaseProperties properties;
    
    public SearchResponse search(SearchQuery request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        
        long startTime = System.currentTimeMillis();
        String query = request.getQuery().trim();
        SearchFilters filters = request.getFilters() != null ? request.getFilters() : SearchFilters.none();
        SearchMode mode = request.getMode() != null ? request.getMode() : SearchMode.VECTOR;
        int limit = resolveLimit(request.getLimit());
        double threshold = request.getThreshold() != null
            ? request.getThreshold()
            : properties.getSearch().getDefaultThreshold();
        
        if (mode.needsEmbedding() && !embeddingService.isAvailable()) {
            log.warn("[RETRIEVAL] Embedding provider not configured, falling back to text search | requestedMode={}",
                mode.getValue());
            mode = SearchMode.TEXT;
        }
        
        // a blank category means no category filter
        String category = filters.getCategory() != null && !filters.getCategory().isBlank()
            ? filters.getCategory().trim()
            : null;
        
        log.info("[RETRIEVAL] Starting search | mode={} | queryLength={} | limit={} | threshold={} | category={}",
            mode.getValue(), query.length(), limit, threshold, category);
        
        if (category != null && !DocumentCategories.isValid(category)) {
            log.warn("[RETRIEVAL] Unknown category, returning no results | category={}", category);
            return buildResponse(query, mode, List.of());
        }
        
        UUID mfgId = filters.getManufacturerId();
        String slug = filters.getManufacturerSlug();
        if (mfgId == null && slug != null && !slug.isBlank()) {
            Optional<Manufacturer> manufacturer =
                manufacturerRepository.findBySlug(slug.trim().toLowerCase(Locale.ROOT));
            if (manufacturer.isEmpty()) {
                log.warn("[RETRIEVAL] Unknown manufacturer slug, returning no results | slug={}", slug);
                return buildResponse(query, mode, List.of());
            }
            mfgId = manufacturer.get().getId();
        }
        
        List<SearchResult> results;
        try {
            results = execute(mode, query, mfgId, category, limit, threshold);
        } catch (ConfigurationException e) {
            log.warn("[RETRIEVAL] {} search needs an embedding provider, falling back to text search | error={}",
                mode.getValue(), e.getMessage());
            mode = SearchMode.TEXT;
            results = execute(mode, query, mfgId, category, limit, threshold);
        }
        
        log.info("[RETRIEVAL] Search completed | mode={} | resultsCount={} | durationMs={}",
            mode.getValue(), results.size(), System.currentTimeMillis() - startTime);
        return buildResponse(query, mode, results);
    }
    
    private List<SearchResult> execute(SearchMode mode, String query, UUID manufacturerId, String category,
                                       int limit, double threshold) {
        try {
            switch (mode) {
                case TEXT:
                    return hybridSearchService.textSearch(query, manufacturerId, category, limit);
                case HYBRID:
                    return hybridSearchService.hybridSearch(query, manufacturerId, category, limit, threshold);
                case VECTOR:
                default:
                    return hybridSearchService.vectorSearch(query, manufacturerId, category, limit, threshold);
            }
        } catch (DataAccessException e) {
            log.error("[RETRIEVAL] {} search query failed | error={}", mode.getValue(), e.getMessage(), e);
            throw new SearchException("Search failed: " + e.getMessage(), e);
        }
    }
    
    int resolveLimit(Integer requested) {
        KnowledgeBaseProperties.Search search = properties.getSearch();
        if (requested == null) {
            return search.getDefaultLimit();
        }
        return Math.max(1, Math.min(requested, search.getMaxLimit()));
    }
    
    private SearchResponse buildResponse(String query, SearchMode mode, List<SearchResult> results) {
        return SearchResponse.builder()
            .query(query)
            .mode(mode)
            .resultCount(results.size())
            .results(results)
            .build();
    }
}
