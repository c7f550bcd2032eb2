package com.kbsearch.llm.provider;

import java.util.List;

/**
 * Turns texts into fixed-dimension vectors. One call per batch, synchronous.
 */
public interface EmbeddingProvider {
    
    /**
     * @return one vector per input text, in input order
     * @throws com.kbsearch.common.exception.ConfigurationException if credentials are missing
     * @throws com.kbsearch.common.exception.EmbeddingProviderException on transport failure or malformed response
     */
    List<float[]> embed(List<String> texts);
    
    boolean isConfigured();
    
    int getDimensions();
}
