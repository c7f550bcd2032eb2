package com.kbsearch.api.controller;

import com.kbsearch.api.dto.request.ProcessRequest;
import com.kbsearch.api.dto.response.ProcessResponse;
import com.kbsearch.core.model.ProcessingResult;
import com.kbsearch.core.model.RawTextResult;
import com.kbsearch.core.service.DocumentProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion runs synchronously within the request; the response reports the final outcome.
 */
@RestController
@RequestMapping("/api/v1/knowledge")
@RequiredArgsConstructor
@Slf4j
public class KnowledgeProcessController {
    
    private final DocumentProcessingService processingService;
    
    @PostMapping("/process")
    public ResponseEntity<ProcessResponse> process(@RequestBody ProcessRequest request) {
        if (request.getDocumentId() != null) {
            log.info("Process request for document: {}", request.getDocumentId());
            ProcessingResult result = processingService.processDocument(request.getDocumentId(), request.getText());
            return ResponseEntity.ok(ProcessResponse.from(result));
        }
        
        if (request.getText() != null && !request.getText().isBlank()) {
            log.info("Process request for raw text ({} characters)", request.getText().length());
            RawTextResult result = processingService.processRawText(request.getText());
            return ResponseEntity.ok(ProcessResponse.from(result));
        }
        
        throw new IllegalArgumentException("documentId or text required");
    }
}
