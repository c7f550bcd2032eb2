package com.kbsearch.core.model;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class ProcessingResult {
    private UUID documentId;
    private int chunksCreated;
    private int totalCharacters;
    private long durationMs;
}
