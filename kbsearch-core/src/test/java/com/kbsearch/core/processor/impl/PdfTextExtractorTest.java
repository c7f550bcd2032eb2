package com.kbsearch.core.processor.impl;

import com.kbsearch.common.exception.ExtractionException;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import com.kbsearch.core.model.ExtractedText;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PdfTextExtractor Tests")
class PdfTextExtractorTest {
    
    private KnowledgeBaseProperties properties;
    private PdfTextExtractor extractor;
    
    @BeforeEach
    void setUp() {
        properties = new KnowledgeBaseProperties();
        extractor = new PdfTextExtractor(new RegexPdfTextFallback(properties), properties);
    }
    
    private byte[] createPdf(String title, String... lines) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.setLeading(14);
                content.newLineAtOffset(72, 720);
                for (String line : lines) {
                    content.showText(line);
                    content.newLine();
                }
                content.endText();
            }
            if (title != null) {
                document.getDocumentInformation().setTitle(title);
            }
            document.save(out);
            return out.toByteArray();
        }
    }
    
    @Test
    @DisplayName("Should support only pdf")
    void shouldSupportPdf() {
        assertThat(extractor.supports("pdf")).isTrue();
        assertThat(extractor.supports("PDF")).isTrue();
        assertThat(extractor.supports("txt")).isFalse();
        assertThat(extractor.supports("docx")).isFalse();
    }
    
    @Test
    @DisplayName("Should extract text and title with PDFBox")
    void shouldExtractWithPdfBox() throws IOException {
        byte[] pdf = createPdf("Thermostat Guide", "Set the schedule from the main menu.", "Hold the fan key to reset.");
        
        ExtractedText result = extractor.extract(new ByteArrayInputStream(pdf), "pdf");
        
        assertThat(result.getSource()).isEqualTo("pdfbox");
        assertThat(result.getTitle()).isEqualTo("Thermostat Guide");
        assertThat(result.getTotalPages()).isEqualTo(1);
        assertThat(result.getText())
            .contains("Set the schedule from the main menu.")
            .contains("Hold the fan key to reset.");
    }
    
    @Test
    @DisplayName("Should take the first line as title when metadata has none")
    void shouldUseFirstLineAsTitle() throws IOException {
        byte[] pdf = createPdf(null, "Installation Manual", "Mount the bracket first.");
        
        ExtractedText result = extractor.extract(new ByteArrayInputStream(pdf), "pdf");
        
        assertThat(result.getTitle()).isEqualTo("Installation Manual");
    }
    
    @Test
    @DisplayName("Should fail with the fallback message for unreadable bytes")
    void shouldFailForGarbage() {
        byte[] garbage = "this is not a pdf document".getBytes(StandardCharsets.US_ASCII);
        
        assertThatThrownBy(() -> extractor.extract(new ByteArrayInputStream(garbage), "pdf"))
            .isInstanceOf(ExtractionException.class)
            .hasMessage(RegexPdfTextFallback.FAILURE_MESSAGE);
    }
    
    @Test
    @DisplayName("Should use the regex scan directly when configured")
    void shouldUseRegexParser() throws IOException {
        properties.getExtraction().setPdfParser("regex");
        String body = "Open the battery door, remove the old cells and insert two fresh AA batteries "
            + "with the polarity marks facing up.";
        byte[] pdf = ("%PDF-1.4\n1 0 obj\nstream\n" + body + "\nendstream\nendobj\n")
            .getBytes(StandardCharsets.ISO_8859_1);
        
        ExtractedText result = extractor.extract(new ByteArrayInputStream(pdf), "pdf");
        
        assertThat(result.getSource()).isEqualTo("regex");
        assertThat(result.getText()).isEqualTo(body);
    }
}
