package com.kbsearch.core.model;

import lombok.Builder;
import lombok.Data;

/**
 * A chunk that survived the token ceiling, paired with its vector (null when embedding was skipped).
 */
@Data
@Builder
public class EmbeddedChunk {
    private ChunkingResult chunk;
    private float[] embedding;
    
    public int getEmbeddingDimensions() {
        return embedding != null ? embedding.length : 0;
    }
}
