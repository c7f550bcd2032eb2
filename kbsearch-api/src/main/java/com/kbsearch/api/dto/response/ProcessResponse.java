package com.kbsearch.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kbsearch.core.model.ProcessingResult;
import com.kbsearch.core.model.RawTextResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessResponse {
    private boolean success;
    
    // Document processing
    private UUID documentId;
    private Integer chunksCreated;
    private Integer totalCharacters;
    
    // Raw text processing
    private Integer chunkCount;
    private List<RawTextResult.RawTextChunk> chunks;
    
    public static ProcessResponse from(ProcessingResult result) {
        return ProcessResponse.builder()
            .success(true)
            .documentId(result.getDocumentId())
            .chunksCreated(result.getChunksCreated())
            .totalCharacters(result.getTotalCharacters())
            .build();
    }
    
    public static ProcessResponse from(RawTextResult result) {
        return ProcessResponse.builder()
            .success(true)
            .chunkCount(result.getChunkCount())
            .chunks(result.getChunks())
            .build();
    }
}
