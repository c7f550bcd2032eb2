package com.kbsearch.api.controller;

import com.kbsearch.common.constants.ProcessingStatus;
import com.kbsearch.core.store.DocumentStatusStore;
import com.kbsearch.llm.service.EmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController Tests")
class HealthControllerTest {
    
    @Mock private DataSource dataSource;
    @Mock private Connection connection;
    @Mock private DatabaseMetaData metaData;
    @Mock private EmbeddingService embeddingService;
    @Mock private DocumentStatusStore statusStore;
    
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(dataSource, embeddingService, statusStore)).build();
    }
    
    @Test
    @DisplayName("Should report liveness without touching dependencies")
    void shouldReportUp() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.service").value("kbsearch"));
    }
    
    @Test
    @DisplayName("Should report UP when database and provider are available")
    void shouldReportHealthy() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(5)).thenReturn(true);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getDatabaseProductName()).thenReturn("PostgreSQL");
        when(embeddingService.isAvailable()).thenReturn(true);
        when(embeddingService.getDimensions()).thenReturn(1536);
        Map<ProcessingStatus, Long> counts = new EnumMap<>(ProcessingStatus.class);
        counts.put(ProcessingStatus.READY, 40L);
        counts.put(ProcessingStatus.ERROR, 2L);
        when(statusStore.countByStatus()).thenReturn(counts);
        
        mockMvc.perform(get("/api/v1/health/detailed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.documents.ready").value(40))
            .andExpect(jsonPath("$.documents.error").value(2))
            .andExpect(jsonPath("$.database.status").value("UP"))
            .andExpect(jsonPath("$.database.database").value("PostgreSQL"))
            .andExpect(jsonPath("$.embeddingProvider.configured").value(true))
            .andExpect(jsonPath("$.embeddingProvider.dimensions").value(1536));
    }
    
    @Test
    @DisplayName("Should report DEGRADED when the database is unreachable")
    void shouldReportDegradedDatabase() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));
        when(embeddingService.isAvailable()).thenReturn(true);
        when(embeddingService.getDimensions()).thenReturn(1536);
        
        mockMvc.perform(get("/api/v1/health/detailed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DEGRADED"))
            .andExpect(jsonPath("$.database.status").value("DOWN"))
            .andExpect(jsonPath("$.database.error").value("Connection refused"))
            .andExpect(jsonPath("$.documents").doesNotExist());
        
        verifyNoInteractions(statusStore);
    }
    
    @Test
    @DisplayName("Should report DEGRADED without an embedding provider")
    void shouldReportDegradedProvider() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(5)).thenReturn(true);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getDatabaseProductName()).thenReturn("PostgreSQL");
        when(embeddingService.isAvailable()).thenReturn(false);
        when(embeddingService.getDimensions()).thenReturn(1536);
        when(statusStore.countByStatus()).thenReturn(Map.of());
        
        mockMvc.perform(get("/api/v1/health/detailed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DEGRADED"))
            .andExpect(jsonPath("$.embeddingProvider.configured").value(false));
    }
    
    @Test
    @DisplayName("Should format uptime compactly")
    void shouldFormatUptime() {
        assertThat(HealthController.formatUptime(Duration.ofSeconds(42))).isEqualTo("42s");
        assertThat(HealthController.formatUptime(Duration.ofSeconds(125))).isEqualTo("2m 5s");
        assertThat(HealthController.formatUptime(Duration.ofSeconds(3725))).isEqualTo("1h 2m 5s");
    }
}
