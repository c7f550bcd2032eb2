package com.kbsearch.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.UUID;

@Data
public class SearchRequest {
    
    @NotBlank(message = "Query is required")
    private String query;
    
    /** vector (default), text or hybrid */
    private String mode;
    
    private UUID manufacturerId;
    
    private String manufacturerSlug;
    
    private String category;
    
    // Out-of-range values are clamped, not rejected
    private Integer limit;
    
    @DecimalMin(value = "0.0", message = "Threshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Threshold must be between 0 and 1")
    private Double threshold;
}
