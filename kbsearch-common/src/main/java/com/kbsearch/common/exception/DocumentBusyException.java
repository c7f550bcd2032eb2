package com.kbsearch.common.exception;

import java.util.UUID;

/** Another processing run currently holds the document. */
public class DocumentBusyException extends KnowledgeBaseException {

    private final UUID documentId;

    public DocumentBusyException(UUID documentId) {
        super("Document is already being processed: " + documentId, "Document is already being processed");
        this.documentId = documentId;
    }

    public UUID getDocumentId() {
        return documentId;
    }
}
