package com.kbsearch.core.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExtractedText {
    private String text;
    private String title;
    private Integer totalPages;
    
    /** Which extractor produced the text, or "provided" for caller-supplied text. */
    private String source;
}
