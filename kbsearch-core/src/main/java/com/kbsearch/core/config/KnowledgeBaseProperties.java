package com.kbsearch.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for ingestion, extraction and retrieval. */
@Configuration
@ConfigurationProperties(prefix = "kbsearch")
@Getter
@Setter
public class KnowledgeBaseProperties {
    
    private Ingestion ingestion = new Ingestion();
    private Extraction extraction = new Extraction();
    private Search search = new Search();
    
    @Getter
    @Setter
    public static class Ingestion {
        private int chunkSizeTokens = 800;
        private int overlapTokens = 100;
        
        /** Chunks estimated above this are dropped before embedding. */
        private int maxChunkTokens = 1000;
        
        /** Token budget for a single embedding request. */
        private int maxRequestTokens = 7500;
        
        private int maxBatchSize = 5;
        
        /** Normalized text shorter than this fails extraction. */
        private int minTextLength = 50;
        
        /** A PROCESSING claim older than this may be taken over by a new run. */
        private int staleProcessingMinutes = 15;
        
        /** When false and no provider is configured, chunks are stored without embeddings. */
        private boolean requireEmbeddings = true;
    }
    
    @Getter
    @Setter
    public static class Extraction {
        /** "pdfbox" or "regex". */
        private String pdfParser = "pdfbox";
        private int minPdfFallbackLength = 100;
        private String storageDirectory = "./uploads";
    }
    
    @Getter
    @Setter
    public static class Search {
        private int defaultLimit = 5;
        private double defaultThreshold = 0.7;
        private int maxLimit = 50;
        private int executorThreads = 4;
    }
}
