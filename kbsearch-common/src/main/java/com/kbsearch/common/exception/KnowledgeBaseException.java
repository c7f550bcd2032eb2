package com.kbsearch.common.exception;

/**
 * Root of the knowledge base exception taxonomy. Carries a short user-facing message
 * alongside the detailed one.
 */
public class KnowledgeBaseException extends RuntimeException {

    private final String userMessage;

    public KnowledgeBaseException(String message, String userMessage) {
        super(message);
        this.userMessage = userMessage;
    }

    public KnowledgeBaseException(String message, String userMessage, Throwable cause) {
        super(message, cause);
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
