package com.kbsearch.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kbsearch.common.constants.ProcessingStatus;
import com.kbsearch.data.entity.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentStatusResponse {
    private UUID documentId;
    private String title;
    private ProcessingStatus status;
    private Integer chunkCount;
    private String errorMessage;
    private Instant processingStartedAt;
    private Instant processingCompletedAt;
    
    public static DocumentStatusResponse from(Document document) {
        return DocumentStatusResponse.builder()
            .documentId(document.getId())
            .title(document.getTitle())
            .status(document.getStatus())
            .chunkCount(document.getChunkCount())
            .errorMessage(document.getErrorMessage())
            .processingStartedAt(document.getProcessingStartedAt())
            .processingCompletedAt(document.getProcessingCompletedAt())
            .build();
    }
}
