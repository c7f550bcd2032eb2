package com.kbsearch.core.processor.impl;

import com.kbsearch.common.constants.FileTypes;
import com.kbsearch.core.model.ExtractedText;
import com.kbsearch.core.processor.TextExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * txt and md pass through unchanged; markdown syntax is left for the chunker to carry.
 */
@Component
@Slf4j
public class PlainTextExtractor implements TextExtractor {
    
    @Override
    public boolean supports(String fileType) {
        return FileTypes.isText(fileType);
    }
    
    @Override
    public ExtractedText extract(InputStream inputStream, String fileType) throws IOException {
        String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        
        String title = null;
        String firstLine = content.strip().lines().findFirst().orElse("");
        if (!firstLine.isBlank() && firstLine.length() < 200) {
            title = firstLine.replaceFirst("^#+\\s*", "").trim();
        }
        
        log.debug("Read {} characters of {} text", content.length(), fileType);
        return ExtractedText.builder()
            .text(content)
            .title(title != null ? title : "Untitled")
            .totalPages(1)
            .source("plain")
            .build();
    }
}
