package com.kbsearch.core.query.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SearchMode {
    VECTOR("vector"),
    TEXT("text"),
    HYBRID("hybrid");
    
    private final String value;
    
    SearchMode(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Case-insensitive lookup; null or blank means {@link #VECTOR}.
     */
    @JsonCreator
    public static SearchMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return VECTOR;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SearchMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown search mode: " + value + " (expected vector, text or hybrid)");
    }
    
    public boolean needsEmbedding() {
        return this != TEXT;
    }
}
