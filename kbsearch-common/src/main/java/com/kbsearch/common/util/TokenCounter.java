package com.kbsearch.common.util;

/**
 * Token estimator shared by chunking and embedding batching.
 * Approximation: 1 token ≈ 4 characters. Not a real tokenizer.
 */
public final class TokenCounter {
    private static final int CHARS_PER_TOKEN = 4;
    
    private TokenCounter() {}
    
    public static int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
    
    public static int maxCharsForTokens(int tokenLimit) {
        return tokenLimit * CHARS_PER_TOKEN;
    }
}
