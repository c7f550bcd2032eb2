package com.kbsearch.core.processor.impl;

import com.kbsearch.common.constants.FileTypes;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import com.kbsearch.core.model.ExtractedText;
import com.kbsearch.core.processor.TextExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * PDFBox text extraction with the regex scan as fallback for files PDFBox rejects,
 * or for every file when {@code kbsearch.extraction.pdf-parser=regex}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfTextExtractor implements TextExtractor {
    
    static final String PARSER_REGEX = "regex";
    
    private final RegexPdfTextFallback fallback;
    private final KnowledgeBaseProperties properties;
    
    @Override
    public boolean supports(String fileType) {
        return FileTypes.isPdf(fileType);
    }
    
    @Override
    public ExtractedText extract(InputStream inputStream, String fileType) throws IOException {
        byte[] bytes = inputStream.readAllBytes();
        
        if (PARSER_REGEX.equalsIgnoreCase(properties.getExtraction().getPdfParser())) {
            return fallback.extract(bytes);
        }
        
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(document);
            int totalPages = document.getNumberOfPages();
            
            log.debug("PDFBox extracted {} characters from {} pages", text.length(), totalPages);
            return ExtractedText.builder()
                .text(text)
                .title(resolveTitle(document, text))
                .totalPages(totalPages)
                .source("pdfbox")
                .build();
        } catch (IOException e) {
            log.warn("[PDF] PDFBox could not parse document ({}), using fallback extraction", e.getMessage());
            return fallback.extract(bytes);
        }
    }
    
    private String resolveTitle(PDDocument document, String text) {
        PDDocumentInformation info = document.getDocumentInformation();
        if (info != null && info.getTitle() != null && !info.getTitle().isBlank()) {
            return info.getTitle().trim();
        }
        // First line as potential title
        String firstLine = text.strip().lines().findFirst().orElse("");
        return !firstLine.isBlank() && firstLine.length() < 200 ? firstLine.trim() : null;
    }
}
