package com.kbsearch.common.exception;

/** Embedding provider call failed in transport or returned a malformed response. */
public class EmbeddingProviderException extends KnowledgeBaseException {

    public EmbeddingProviderException(String message) {
        super(message, "Embedding provider error");
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, "Embedding provider error", cause);
    }
}
