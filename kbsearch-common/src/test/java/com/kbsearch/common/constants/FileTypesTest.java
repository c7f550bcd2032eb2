package com.kbsearch.common.constants;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FileTypes and DocumentCategories Tests")
class FileTypesTest {
    
    @Test
    @DisplayName("Should normalize extensions before matching")
    void shouldNormalizeExtensions() {
        assertThat(FileTypes.normalize(" .PDF ")).isEqualTo("pdf");
        assertThat(FileTypes.isPdf(".pdf")).isTrue();
        assertThat(FileTypes.isText("MD")).isTrue();
        assertThat(FileTypes.isText("docx")).isFalse();
        assertThat(FileTypes.isPdf(null)).isFalse();
    }
    
    @Test
    @DisplayName("Should accept only known categories")
    void shouldValidateCategories() {
        assertThat(DocumentCategories.isValid("user-manual")).isTrue();
        assertThat(DocumentCategories.isValid("User-Manual")).isFalse();
        assertThat(DocumentCategories.isValid(null)).isFalse();
    }
}
