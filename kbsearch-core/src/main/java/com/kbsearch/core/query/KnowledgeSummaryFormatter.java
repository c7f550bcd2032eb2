package com.kbsearch.core.query;

import com.kbsearch.core.query.model.KnowledgeSummary;
import com.kbsearch.core.query.model.SearchFilters;
import com.kbsearch.core.query.model.SearchMode;
import com.kbsearch.core.query.model.SearchQuery;
import com.kbsearch.core.query.model.SearchResponse;
import com.kbsearch.core.query.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Condenses a search into a single best answer for conversational callers (voice assistants,
 * chat widgets): top match, up to two source titles and a short spoken summary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeSummaryFormatter {
    
    static final int SUMMARY_LIMIT = 3;
    static final double SUMMARY_THRESHOLD = 0.65;
    static final int MAX_SOURCES = 2;
    static final int TRUNCATE_ABOVE_CHARS = 500;
    static final int SPOKEN_MAX_CHARS = 450;
    
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    
    private final RetrievalEngine retrievalEngine;
    
    public KnowledgeSummary summarize(String query, String manufacturerSlug) {
        SearchResponse response = retrievalEngine.search(SearchQuery.builder()
            .query(query)
            .mode(SearchMode.VECTOR)
            .filters(SearchFilters.builder().manufacturerSlug(manufacturerSlug).build())
            .limit(SUMMARY_LIMIT)
            .threshold(SUMMARY_THRESHOLD)
            .build());
        return format(query, response.getResults());
    }
    
    public KnowledgeSummary format(String query, List<SearchResult> results) {
        if (results == null || results.isEmpty()) {
            log.debug("No knowledge found for summary query");
            return KnowledgeSummary.builder()
                .found(false)
                .message("I couldn't find any documentation about \"" + query + "\".")
                .build();
        }
        
        SearchResult top = results.get(0);
        List<String> sources = results.stream()
            .map(SearchResult::getDocumentTitle)
            .filter(title -> title != null && !title.isBlank())
            .distinct()
            .limit(MAX_SOURCES)
            .toList();
        
        return KnowledgeSummary.builder()
            .found(true)
            .content(top.getContent())
            .documentTitle(top.getDocumentTitle())
            .manufacturer(top.getManufacturer())
            .relevance(relevanceOf(top))
            .sources(sources)
            .resultCount(results.size())
            .spokenSummary(spokenSummary(top))
            .build();
    }
    
    String spokenSummary(SearchResult top) {
        String summary = top.getContent() != null ? top.getContent() : "";
        
        if (summary.length() > TRUNCATE_ABOVE_CHARS) {
            StringBuilder shortened = new StringBuilder();
            for (String sentence : SENTENCE_BREAK.split(summary)) {
                if (shortened.length() + sentence.length() > SPOKEN_MAX_CHARS) {
                    break;
                }
                shortened.append(sentence).append(' ');
            }
            // First sentence alone is too long; cut at the last word boundary instead
            if (shortened.length() == 0) {
                String head = summary.substring(0, SPOKEN_MAX_CHARS);
                int lastSpace = head.lastIndexOf(' ');
                shortened.append(lastSpace > 0 ? head.substring(0, lastSpace) : head);
            }
            summary = shortened.toString().trim();
        }
        
        if (top.getDocumentTitle() != null && !top.getDocumentTitle().isBlank()) {
            summary += " This is from " + top.getDocumentTitle() + ".";
        }
        return summary;
    }
    
    private Integer relevanceOf(SearchResult result) {
        if (result.getRelevanceScore() != null) {
            return result.getRelevanceScore();
        }
        return (int) Math.round(result.sortScore() * 100);
    }
}
