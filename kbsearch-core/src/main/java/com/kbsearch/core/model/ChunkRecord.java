package com.kbsearch.core.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class ChunkRecord {
    private int chunkIndex;
    private String content;
    private int tokenCount;
    private float[] embedding;
    private Map<String, Object> metadata;
}
