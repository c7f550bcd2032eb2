package com.kbsearch.api.controller;

import com.kbsearch.api.dto.response.DocumentStatusResponse;
import com.kbsearch.common.exception.DocumentNotFoundException;
import com.kbsearch.core.store.DocumentStatusStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/knowledge/documents")
@RequiredArgsConstructor
public class DocumentStatusController {
    
    private final DocumentStatusStore statusStore;
    
    @GetMapping("/{documentId}/status")
    public ResponseEntity<DocumentStatusResponse> getStatus(@PathVariable UUID documentId) {
        return statusStore.findById(documentId)
            .map(DocumentStatusResponse::from)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }
}
