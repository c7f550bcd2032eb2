package com.kbsearch.core.query.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Search results condensed for a conversational caller: the best match plus a short
 * spoken-style summary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KnowledgeSummary {
    private boolean found;
    private String message;
    private String content;
    private String documentTitle;
    private String manufacturer;
    private Integer relevance;
    private List<String> sources;
    private Integer resultCount;
    private String spokenSummary;
}
