package com.kbsearch.core.processor.impl;

import com.kbsearch.common.exception.ExtractionException;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import com.kbsearch.core.model.ExtractedText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort PDF text recovery: collects the bodies of {@code stream ... endstream} sections
 * and keeps printable ASCII. Compressed streams come out as noise, which the minimum-length
 * check usually rejects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegexPdfTextFallback {
    
    static final String FAILURE_MESSAGE = "PDF text extraction failed. Please provide the text content directly.";
    
    private static final Pattern STREAM_SECTION = Pattern.compile("stream[\\s\\S]*?endstream");
    private static final Pattern STREAM_MARKERS = Pattern.compile("stream|endstream");
    private static final Pattern NON_PRINTABLE = Pattern.compile("[^\\x20-\\x7E\\s]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    
    private final KnowledgeBaseProperties properties;
    
    public ExtractedText extract(byte[] pdfBytes) {
        // one char per byte so offsets survive binary content
        String raw = new String(pdfBytes, StandardCharsets.ISO_8859_1);
        
        StringJoiner joined = new StringJoiner(" ");
        Matcher matcher = STREAM_SECTION.matcher(raw);
        int sections = 0;
        while (matcher.find()) {
            joined.add(STREAM_MARKERS.matcher(matcher.group()).replaceAll(""));
            sections++;
        }
        
        String extracted = NON_PRINTABLE.matcher(joined.toString()).replaceAll(" ");
        extracted = WHITESPACE_RUN.matcher(extracted).replaceAll(" ").trim();
        
        int minLength = properties.getExtraction().getMinPdfFallbackLength();
        if (extracted.length() < minLength) {
            log.warn("[PDF_FALLBACK] Recovered only {} characters from {} stream sections (minimum {})",
                extracted.length(), sections, minLength);
            throw new ExtractionException(FAILURE_MESSAGE);
        }
        
        log.info("[PDF_FALLBACK] Recovered {} characters from {} stream sections", extracted.length(), sections);
        return ExtractedText.builder()
            .text(extracted)
            .source("regex")
            .build();
    }
}
