package com.kbsearch.llm.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Outbound HTTP settings shared by every WebClient built from the common builder. */
@Configuration
@ConfigurationProperties(prefix = "kbsearch.http")
@Getter
@Setter
public class HttpClientProperties {
    private int connectTimeoutMs = 10_000;
    private int responseTimeoutSeconds = 60;
    
    /** Embedding batches and downloaded manuals both exceed the 256KB codec default. */
    private int maxInMemorySizeMb = 16;
    
    private String userAgent = "kbsearch/1.0";
}
