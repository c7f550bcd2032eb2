package com.kbsearch.core.processor;

import com.kbsearch.common.exception.ExtractionException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class TextExtractorFactory {
    
    private final List<TextExtractor> extractors;
    
    public TextExtractor getExtractor(String fileType) {
        return extractors.stream()
            .filter(e -> fileType != null && e.supports(fileType))
            .findFirst()
            .orElseThrow(() -> new ExtractionException("Unsupported file type: " + fileType));
    }
}
