package com.kbsearch.core.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ChunkingResult {
    private String content;
    private Integer tokenCount;
    private Integer chunkIndex;
}
