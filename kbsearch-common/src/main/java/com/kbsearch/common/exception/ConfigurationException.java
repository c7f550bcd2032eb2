package com.kbsearch.common.exception;

/** A required provider credential or setting is missing. */
public class ConfigurationException extends KnowledgeBaseException {

    public ConfigurationException(String message) {
        super(message, "Service is not configured");
    }
}
