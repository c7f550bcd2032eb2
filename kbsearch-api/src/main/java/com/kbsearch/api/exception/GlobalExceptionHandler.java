package com.kbsearch.api.exception;

import com.kbsearch.api.dto.response.ErrorResponse;
import com.kbsearch.common.exception.ConfigurationException;
import com.kbsearch.common.exception.DocumentBusyException;
import com.kbsearch.common.exception.DocumentNotFoundException;
import com.kbsearch.common.exception.EmbeddingProviderException;
import com.kbsearch.common.exception.ExtractionException;
import com.kbsearch.common.exception.KnowledgeBaseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.append(fieldName).append(": ").append(error.getDefaultMessage()).append("; ");
        });
        
        return build(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString(), request);
    }
    
    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, WebRequest request) {
        log.debug("Rejected request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage(), request);
    }
    
    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(DocumentNotFoundException ex, WebRequest request) {
        return build(HttpStatus.NOT_FOUND, ex.getUserMessage(), ex.getMessage(), request);
    }
    
    @ExceptionHandler(DocumentBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(DocumentBusyException ex, WebRequest request) {
        return build(HttpStatus.CONFLICT, ex.getUserMessage(), ex.getMessage(), request);
    }
    
    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<ErrorResponse> handleExtraction(ExtractionException ex, WebRequest request) {
        log.warn("Extraction failed: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getUserMessage(), ex.getMessage(), request);
    }
    
    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex, WebRequest request) {
        log.error("Configuration error: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getUserMessage(), ex.getMessage(), request);
    }
    
    @ExceptionHandler(EmbeddingProviderException.class)
    public ResponseEntity<ErrorResponse> handleEmbeddingProvider(EmbeddingProviderException ex, WebRequest request) {
        log.error("Embedding provider error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, ex.getUserMessage(), ex.getMessage(), request);
    }
    
    // Persistence and search failures
    @ExceptionHandler(KnowledgeBaseException.class)
    public ResponseEntity<ErrorResponse> handleKnowledgeBase(KnowledgeBaseException ex, WebRequest request) {
        log.error("Knowledge base error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getUserMessage(), ex.getMessage(), request);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request);
    }
    
    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String error, WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .message(message)
            .error(error)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
        
        return ResponseEntity.status(status).body(errorResponse);
    }
}
