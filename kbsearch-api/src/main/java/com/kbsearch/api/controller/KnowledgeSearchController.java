package com.kbsearch.api.controller;

import com.kbsearch.api.dto.request.SearchRequest;
import com.kbsearch.api.dto.request.SummaryRequest;
import com.kbsearch.core.query.KnowledgeSummaryFormatter;
import com.kbsearch.core.query.RetrievalEngine;
import com.kbsearch.core.query.model.KnowledgeSummary;
import com.kbsearch.core.query.model.SearchFilters;
import com.kbsearch.core.query.model.SearchMode;
import com.kbsearch.core.query.model.SearchQuery;
import com.kbsearch.core.query.model.SearchResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/knowledge")
@RequiredArgsConstructor
@Slf4j
public class KnowledgeSearchController {
    
    private final RetrievalEngine retrievalEngine;
    private final KnowledgeSummaryFormatter summaryFormatter;
    
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        SearchQuery query = SearchQuery.builder()
            .query(request.getQuery())
            .mode(SearchMode.fromValue(request.getMode()))
            .filters(SearchFilters.builder()
                .manufacturerId(request.getManufacturerId())
                .manufacturerSlug(request.getManufacturerSlug())
                .category(request.getCategory())
                .build())
            .limit(request.getLimit())
            .threshold(request.getThreshold())
            .build();
        
        log.debug("Search request - mode: {}, limit: {}", query.getMode().getValue(), request.getLimit());
        return ResponseEntity.ok(retrievalEngine.search(query));
    }
    
    @PostMapping("/search/summary")
    public ResponseEntity<KnowledgeSummary> summary(@Valid @RequestBody SummaryRequest request) {
        return ResponseEntity.ok(summaryFormatter.summarize(request.getQuery(), request.getManufacturerSlug()));
    }
}
