package com.kbsearch.core.processor;

import com.kbsearch.common.exception.ExtractionException;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Loads document bytes from a file_url: http(s) through WebClient, {@code file:} URIs and
 * plain paths from disk (relative paths against the storage directory, which they may not leave).
 */
@Component
@Slf4j
public class DocumentSourceFetcher {
    
    private final WebClient webClient;
    private final KnowledgeBaseProperties properties;
    
    public DocumentSourceFetcher(WebClient.Builder webClientBuilder, KnowledgeBaseProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }
    
    public byte[] fetch(String locator) {
        if (locator == null || locator.isBlank()) {
            throw new ExtractionException("No file URL or text provided");
        }
        
        String lower = locator.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return fetchRemote(locator);
        }
        return readLocal(resolvePath(locator));
    }
    
    private byte[] fetchRemote(String url) {
        log.debug("Fetching document source over HTTP: {}", url);
        try {
            byte[] body = webClient.get()
                .uri(URI.create(url))
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody()
                            .then(Mono.<byte[]>error(new ExtractionException(
                                "Failed to fetch file: " + response.statusCode().value())));
                    }
                    return response.bodyToMono(byte[].class);
                })
                .block();
            return body != null ? body : new byte[0];
        } catch (WebClientRequestException e) {
            throw new ExtractionException("Failed to fetch file: " + e.getMessage(), e);
        }
    }
    
    Path resolvePath(String locator) {
        if (locator.regionMatches(true, 0, "file:", 0, 5)) {
            return Paths.get(URI.create(locator));
        }
        Path path = Paths.get(locator);
        if (path.isAbsolute()) {
            return path;
        }
        Path root = Paths.get(properties.getExtraction().getStorageDirectory()).toAbsolutePath().normalize();
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            log.warn("[FETCH] Relative path leaves the storage directory | locator={} | storageDirectory={}", locator, root);
            throw new ExtractionException("Failed to fetch file: path outside storage directory " + locator);
        }
        return resolved;
    }
    
    private byte[] readLocal(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ExtractionException("Failed to fetch file: not found " + path);
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ExtractionException("Failed to fetch file: " + e.getMessage(), e);
        }
    }
}
