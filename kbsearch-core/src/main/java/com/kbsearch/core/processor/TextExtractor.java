package com.kbsearch.core.processor;

import com.kbsearch.core.model.ExtractedText;

import java.io.IOException;
import java.io.InputStream;

public interface TextExtractor {
    boolean supports(String fileType);
    ExtractedText extract(InputStream inputStream, String fileType) throws IOException;
}
