package com.kbsearch.core.query.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Optional search filters. An explicit manufacturerId wins over manufacturerSlug.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchFilters {
    private UUID manufacturerId;
    private String manufacturerSlug;
    private String category;
    
    public static SearchFilters none() {
        return new SearchFilters();
    }
}
