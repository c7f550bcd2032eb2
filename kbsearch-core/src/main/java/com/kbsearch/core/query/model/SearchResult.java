package com.kbsearch.core.query.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * One retrieved chunk. Vector hits carry similarity and relevanceScore, text hits carry rank;
 * in hybrid results text-only hits also copy rank into similarity.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResult {
    private UUID chunkId;
    private UUID documentId;
    private String documentTitle;
    private String manufacturer;
    private String content;
    private Double similarity;
    private Double rank;
    private Integer relevanceScore;
    
    /** Which branch produced the hit. */
    private SearchMode source;
    
    /**
     * Score used for ordering: similarity when present, else rank.
     */
    public double sortScore() {
        if (similarity != null) {
            return similarity;
        }
        return rank != null ? rank : 0.0;
    }
}
