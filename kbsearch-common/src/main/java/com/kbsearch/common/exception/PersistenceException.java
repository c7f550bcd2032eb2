package com.kbsearch.common.exception;

public class PersistenceException extends KnowledgeBaseException {

    public PersistenceException(String message) {
        super(message, "Failed to store knowledge chunks");
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, "Failed to store knowledge chunks", cause);
    }
}
