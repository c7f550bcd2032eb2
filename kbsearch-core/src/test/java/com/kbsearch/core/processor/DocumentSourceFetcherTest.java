package com.kbsearch.core.processor;

import com.kbsearch.common.exception.ExtractionException;
import com.kbsearch.core.config.KnowledgeBaseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DocumentSourceFetcher Tests")
class DocumentSourceFetcherTest {
    
    @TempDir
    Path storage;
    
    private KnowledgeBaseProperties properties;
    
    @BeforeEach
    void setUp() {
        properties = new KnowledgeBaseProperties();
        properties.getExtraction().setStorageDirectory(storage.toString());
    }
    
    private DocumentSourceFetcher fetcherReturning(ClientResponse response, AtomicReference<ClientRequest> seen) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            seen.set(request);
            return Mono.just(response);
        });
        return new DocumentSourceFetcher(builder, properties);
    }
    
    @Test
    @DisplayName("Should reject a blank locator")
    void shouldRejectBlank() {
        DocumentSourceFetcher fetcher = new DocumentSourceFetcher(WebClient.builder(), properties);
        
        assertThatThrownBy(() -> fetcher.fetch(" "))
            .isInstanceOf(ExtractionException.class)
            .hasMessage("No file URL or text provided");
    }
    
    @Nested
    @DisplayName("Local files")
    class LocalFiles {
        
        private DocumentSourceFetcher fetcher;
        
        @BeforeEach
        void setUp() {
            fetcher = new DocumentSourceFetcher(WebClient.builder(), properties);
        }
        
        @Test
        @DisplayName("Should resolve relative paths against the storage directory")
        void shouldReadRelativePath() throws IOException {
            Files.createDirectories(storage.resolve("lutron"));
            Files.writeString(storage.resolve("lutron/caseta.md"), "# Caseta", StandardCharsets.UTF_8);
            
            byte[] bytes = fetcher.fetch("lutron/caseta.md");
            
            assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("# Caseta");
        }
        
        @Test
        @DisplayName("Should read file URIs and absolute paths")
        void shouldReadFileUriAndAbsolutePath() throws IOException {
            Path file = Files.writeString(storage.resolve("notes.txt"), "hello", StandardCharsets.UTF_8);
            
            assertThat(fetcher.fetch(file.toUri().toString())).isEqualTo("hello".getBytes(StandardCharsets.UTF_8));
            assertThat(fetcher.fetch(file.toAbsolutePath().toString()))
                .isEqualTo("hello".getBytes(StandardCharsets.UTF_8));
        }
        
        @Test
        @DisplayName("Should fail for a missing file")
        void shouldFailForMissingFile() {
            assertThatThrownBy(() -> fetcher.fetch("missing.pdf"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageStartingWith("Failed to fetch file: not found");
        }
        
        @Test
        @DisplayName("Should resolve relative paths under the storage directory")
        void shouldResolvePath() {
            assertThat(fetcher.resolvePath("a/../b.txt")).isEqualTo(storage.toAbsolutePath().resolve("b.txt"));
        }
        
        @Test
        @DisplayName("Should refuse relative paths that climb out of the storage directory")
        void shouldRefusePathsOutsideStorage() throws IOException {
            Path uploads = Files.createDirectories(storage.resolve("uploads"));
            Files.writeString(storage.resolve("credentials.txt"), "secret", StandardCharsets.UTF_8);
            properties.getExtraction().setStorageDirectory(uploads.toString());
            
            assertThatThrownBy(() -> fetcher.fetch("../credentials.txt"))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("Failed to fetch file: path outside storage directory ../credentials.txt");
            assertThatThrownBy(() -> fetcher.fetch("manuals/../../credentials.txt"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("path outside storage directory");
        }
    }
    
    @Nested
    @DisplayName("Remote files")
    class RemoteFiles {
        
        @Test
        @DisplayName("Should fetch over HTTP when the scheme is upper case")
        void shouldMatchSchemeIgnoringCase() {
            AtomicReference<ClientRequest> seen = new AtomicReference<>();
            DocumentSourceFetcher fetcher = fetcherReturning(
                ClientResponse.create(HttpStatus.OK)
                    .header("Content-Type", "text/plain")
                    .body("Remote manual text")
                    .build(),
                seen);
            
            byte[] bytes = fetcher.fetch("HTTPS://files.example.com/docs/manual.txt");
            
            assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("Remote manual text");
            assertThat(seen.get().url().getHost()).isEqualTo("files.example.com");
        }
        
        @Test
        @DisplayName("Should return the body of a successful response")
        void shouldFetchBody() {
            AtomicReference<ClientRequest> seen = new AtomicReference<>();
            DocumentSourceFetcher fetcher = fetcherReturning(
                ClientResponse.create(HttpStatus.OK)
                    .header("Content-Type", "text/plain")
                    .body("Remote manual text")
                    .build(),
                seen);
            
            byte[] bytes = fetcher.fetch("https://files.example.com/docs/manual.txt");
            
            assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("Remote manual text");
            assertThat(seen.get().url().toString()).isEqualTo("https://files.example.com/docs/manual.txt");
        }
        
        @Test
        @DisplayName("Should fail with the status code for a non-2xx response")
        void shouldFailOnErrorStatus() {
            DocumentSourceFetcher fetcher = fetcherReturning(
                ClientResponse.create(HttpStatus.NOT_FOUND).build(), new AtomicReference<>());
            
            assertThatThrownBy(() -> fetcher.fetch("https://files.example.com/docs/missing.pdf"))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("Failed to fetch file: 404");
        }
    }
}
