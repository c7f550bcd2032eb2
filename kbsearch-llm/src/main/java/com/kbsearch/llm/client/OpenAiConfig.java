package com.kbsearch.llm.client;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "openai")
@Getter
@Setter
public class OpenAiConfig {
    private String apiKey;
    private String embeddingModel = "text-embedding-ada-002";
    private int embeddingDimensions = 1536; // must match knowledge_chunks.embedding
    private String baseUrl = "https://api.openai.com/v1";
    
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
