package com.kbsearch.common.exception;

import java.util.UUID;

public class DocumentNotFoundException extends KnowledgeBaseException {

    private final UUID documentId;

    public DocumentNotFoundException(UUID documentId) {
        super("Document not found: " + documentId, "Document not found");
        this.documentId = documentId;
    }

    public UUID getDocumentId() {
        return documentId;
    }
}
