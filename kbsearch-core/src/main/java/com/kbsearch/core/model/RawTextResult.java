package com.kbsearch.core.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/** Result of the diagnostic chunk-and-embed path; nothing is persisted. */
@Data
@Builder
public class RawTextResult {
    private int chunkCount;
    private List<RawTextChunk> chunks;
    
    @Data
    @Builder
    public static class RawTextChunk {
        private int index;
        private String content;
        private int tokenCount;
        private int embeddingDimensions;
    }
}
