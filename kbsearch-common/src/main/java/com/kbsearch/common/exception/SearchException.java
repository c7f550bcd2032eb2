package com.kbsearch.common.exception;

public class SearchException extends KnowledgeBaseException {

    public SearchException(String message, Throwable cause) {
        super(message, "Search failed", cause);
    }
}
