package com.kbsearch.core.processor.impl;

import com.kbsearch.common.exception.ExtractionException;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import com.kbsearch.core.model.ExtractedText;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RegexPdfTextFallback Tests")
class RegexPdfTextFallbackTest {
    
    private static final String BODY = "Press and hold the program button on the hub until the light blinks green, "
        + "then open the companion app and follow the pairing steps shown on screen.";
    
    private KnowledgeBaseProperties properties;
    private RegexPdfTextFallback fallback;
    
    @BeforeEach
    void setUp() {
        properties = new KnowledgeBaseProperties();
        fallback = new RegexPdfTextFallback(properties);
    }
    
    private byte[] pdfWithStreams(String... bodies) {
        StringBuilder pdf = new StringBuilder("%PDF-1.4\n");
        int obj = 1;
        for (String body : bodies) {
            pdf.append(obj++).append(" 0 obj\n<< /Length ").append(body.length()).append(" >>\nstream\n")
                .append(body).append("\nendstream\nendobj\n");
        }
        pdf.append("%%EOF\n");
        return pdf.toString().getBytes(StandardCharsets.ISO_8859_1);
    }
    
    @Test
    @DisplayName("Should recover text between stream markers")
    void shouldRecoverStreamText() {
        ExtractedText result = fallback.extract(pdfWithStreams(BODY));
        
        assertThat(result.getText()).isEqualTo(BODY);
        assertThat(result.getSource()).isEqualTo("regex");
    }
    
    @Test
    @DisplayName("Should join several streams with single spaces")
    void shouldJoinStreams() {
        String first = BODY.substring(0, 60).trim();
        String second = BODY.substring(60).trim();
        
        ExtractedText result = fallback.extract(pdfWithStreams(first, second));
        
        assertThat(result.getText()).isEqualTo(first + " " + second);
    }
    
    @Test
    @DisplayName("Should replace binary bytes and collapse whitespace")
    void shouldStripBinary() {
        byte[] body = (BODY + "éÿ\n\n\t  end of text").getBytes(StandardCharsets.ISO_8859_1);
        byte[] prefix = "stream\n".getBytes(StandardCharsets.ISO_8859_1);
        byte[] suffix = "\nendstream".getBytes(StandardCharsets.ISO_8859_1);
        byte[] pdf = new byte[prefix.length + body.length + suffix.length];
        System.arraycopy(prefix, 0, pdf, 0, prefix.length);
        System.arraycopy(body, 0, pdf, prefix.length, body.length);
        System.arraycopy(suffix, 0, pdf, prefix.length + body.length, suffix.length);
        
        ExtractedText result = fallback.extract(pdf);
        
        assertThat(result.getText()).isEqualTo(BODY + " end of text");
    }
    
    @Test
    @DisplayName("Should fail when too little text is recovered")
    void shouldFailOnShortText() {
        assertThatThrownBy(() -> fallback.extract(pdfWithStreams("BT /F1 12 Tf (Hi) Tj ET")))
            .isInstanceOf(ExtractionException.class)
            .hasMessage(RegexPdfTextFallback.FAILURE_MESSAGE);
    }
    
    @Test
    @DisplayName("Should fail for input without streams")
    void shouldFailWithoutStreams() {
        assertThatThrownBy(() -> fallback.extract("plain bytes".getBytes(StandardCharsets.ISO_8859_1)))
            .isInstanceOf(ExtractionException.class)
            .hasMessage("PDF text extraction failed. Please provide the text content directly.");
    }
    
    @Test
    @DisplayName("Should honor a configured minimum length")
    void shouldHonorMinimumLength() {
        properties.getExtraction().setMinPdfFallbackLength(10);
        
        assertThat(fallback.extract(pdfWithStreams("Reset the hub now")).getText())
            .isEqualTo("Reset the hub now");
    }
}
