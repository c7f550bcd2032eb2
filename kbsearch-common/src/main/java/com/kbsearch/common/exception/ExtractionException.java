package com.kbsearch.common.exception;

/** Raw text could not be obtained: unsupported type, fetch failure, or too little text. */
public class ExtractionException extends KnowledgeBaseException {

    public ExtractionException(String message) {
        super(message, "Text extraction failed");
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, "Text extraction failed", cause);
    }
}
