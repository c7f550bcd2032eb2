package com.kbsearch.core.query.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {
    private String query;
    
    /** Effective mode; reports text when vector or hybrid fell back. */
    private SearchMode mode;
    
    private int resultCount;
    private List<SearchResult> results;
}
