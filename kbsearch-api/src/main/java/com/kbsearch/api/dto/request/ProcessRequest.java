package com.kbsearch.api.dto.request;

import lombok.Data;

import java.util.UUID;

/**
 * With a documentId the stored document is (re)processed, optionally from the supplied text.
 * With text alone the text is chunked and embedded without persisting anything.
 */
@Data
public class ProcessRequest {
    
    private UUID documentId;
    
    private String text;
}
