package com.kbsearch.llm.client;

import com.kbsearch.common.exception.ConfigurationException;
import com.kbsearch.common.exception.EmbeddingProviderException;
import com.kbsearch.llm.model.EmbeddingResponse;
import com.kbsearch.llm.provider.EmbeddingProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * OpenAI embeddings endpoint client. No retries: a failed call fails the caller's whole operation.
 */
@Component
@Slf4j
public class OpenAiEmbeddingClient implements EmbeddingProvider {
    
    private final OpenAiConfig config;
    private final WebClient webClient;
    
    public OpenAiEmbeddingClient(OpenAiConfig config, WebClient.Builder webClientBuilder) {
        this.config = config;
        this.webClient = webClientBuilder.build();
        log.info("OpenAI embedding client initialized | model={} | configured={}",
            config.getEmbeddingModel(), config.isConfigured());
    }
    
    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }
    
    @Override
    public int getDimensions() {
        return config.getEmbeddingDimensions();
    }
    
    @Override
    public List<float[]> embed(List<String> texts) {
        if (!config.isConfigured()) {
            throw new ConfigurationException("OpenAI API key not configured. Set OPENAI_API_KEY or openai.api-key");
        }
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        
        log.debug("Requesting {} embeddings from model {}", texts.size(), config.getEmbeddingModel());
        
        Map<String, Object> request = Map.of(
            "model", config.getEmbeddingModel(),
            "input", texts
        );
        
        EmbeddingResponse response;
        try {
            response = webClient
                .post()
                .uri(config.getBaseUrl() + "/embeddings")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .bodyValue(request)
                .retrieve()
                .bodyToMono(EmbeddingResponse.class)
                .block();
        } catch (WebClientResponseException e) {
            log.error("OpenAI API error: Status={}, Response={}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new EmbeddingProviderException(
                "OpenAI API error: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException e) {
            log.error("Connection error calling OpenAI embeddings: {}", e.getMessage());
            throw new EmbeddingProviderException("OpenAI API connection failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new EmbeddingProviderException("Failed to generate embeddings: " + e.getMessage(), e);
        }
        
        return toVectors(response, texts.size());
    }
    
    private List<float[]> toVectors(EmbeddingResponse response, int expected) {
        if (response == null || response.getData() == null) {
            throw new EmbeddingProviderException("Failed to generate embeddings: response was null or empty");
        }
        if (response.getData().size() != expected) {
            throw new EmbeddingProviderException(String.format(
                "Embedding count mismatch: expected %d, got %d", expected, response.getData().size()));
        }
        
        List<float[]> vectors = response.getData().stream()
            .sorted(Comparator.comparingInt(EmbeddingResponse.EmbeddingData::getIndex))
            .map(EmbeddingResponse.EmbeddingData::getEmbedding)
            .toList();
        
        for (float[] vector : vectors) {
            if (vector == null || vector.length == 0) {
                throw new EmbeddingProviderException("Failed to generate embeddings: empty vector in response");
            }
        }
        return vectors;
    }
}
