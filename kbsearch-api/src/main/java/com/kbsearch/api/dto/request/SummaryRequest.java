package com.kbsearch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SummaryRequest {
    
    @NotBlank(message = "Query is required")
    private String query;
    
    private String manufacturerSlug;
}
