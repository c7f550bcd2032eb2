package com.kbsearch.core.query.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SearchQuery {
    private String query;
    
    @Builder.Default
    private SearchMode mode = SearchMode.VECTOR;
    
    @Builder.Default
    private SearchFilters filters = SearchFilters.none();
    
    /** Null means the configured default. */
    private Integer limit;
    
    /** Minimum cosine similarity for vector matches; null means the configured default. */
    private Double threshold;
}
