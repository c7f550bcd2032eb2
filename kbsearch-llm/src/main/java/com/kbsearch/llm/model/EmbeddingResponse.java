package com.kbsearch.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingResponse {
    @JsonProperty("data")
    private List<EmbeddingData> data;
    
    @JsonProperty("model")
    private String model;
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingData {
        @JsonProperty("index")
        private int index;
        
        @JsonProperty("embedding")
        private float[] embedding;
    }
}
