package com.kbsearch.api.controller;

import com.kbsearch.core.store.DocumentStatusStore;
import com.kbsearch.llm.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Liveness and dependency health for load balancers and monitoring.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {
    
    private static final String SERVICE_NAME = "kbsearch";
    private static final Instant START_TIME = Instant.now();
    
    private final DataSource dataSource;
    private final EmbeddingService embeddingService;
    private final DocumentStatusStore statusStore;
    
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(baseStatus());
    }
    
    /**
     * Database connectivity, embedding provider configuration and document counts per status.
     * Without a provider, vector and hybrid search run as text search, so the service reports DEGRADED.
     */
    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        Map<String, Object> response = baseStatus();
        response.put("uptime", formatUptime(Duration.between(START_TIME, Instant.now())));
        
        Map<String, Object> database = checkDatabase();
        response.put("database", database);
        boolean databaseUp = "UP".equals(database.get("status"));
        
        boolean embeddingConfigured = embeddingService.isAvailable();
        response.put("embeddingProvider", Map.of(
            "configured", embeddingConfigured,
            "dimensions", embeddingService.getDimensions()));
        
        if (databaseUp) {
            response.put("documents", documentCounts());
        }
        
        if (!databaseUp || !embeddingConfigured) {
            response.put("status", "DEGRADED");
        }
        return ResponseEntity.ok(response);
    }
    
    private Map<String, Object> baseStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("timestamp", Instant.now().toString());
        status.put("service", SERVICE_NAME);
        return status;
    }
    
    private Map<String, Object> checkDatabase() {
        Map<String, Object> database = new LinkedHashMap<>();
        long startTime = System.currentTimeMillis();
        
        try (Connection connection = dataSource.getConnection()) {
            database.put("status", connection.isValid(5) ? "UP" : "DOWN");
            database.put("database", connection.getMetaData().getDatabaseProductName());
        } catch (SQLException e) {
            log.warn("[HEALTH] Database check failed | error={}", e.getMessage());
            database.put("status", "DOWN");
            database.put("error", e.getMessage());
        }
        database.put("responseTimeMs", System.currentTimeMillis() - startTime);
        return database;
    }
    
    private Map<String, Object> documentCounts() {
        Map<String, Object> counts = new LinkedHashMap<>();
        try {
            statusStore.countByStatus().forEach((status, count) ->
                counts.put(status.name().toLowerCase(Locale.ROOT), count));
        } catch (DataAccessException e) {
            log.warn("[HEALTH] Document count failed | error={}", e.getMessage());
            counts.put("error", e.getMessage());
        }
        return counts;
    }
    
    static String formatUptime(Duration uptime) {
        long hours = uptime.toHours();
        int minutes = uptime.toMinutesPart();
        int seconds = uptime.toSecondsPart();
        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, seconds);
        }
        if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        }
        return seconds + "s";
    }
}
