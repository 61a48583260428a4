package com.brandinsight.research.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 리서치 API 전역 예외 핸들러
 */
@RestControllerAdvice(basePackages = "com.brandinsight.research.controller")
@Slf4j
public class ResearchExceptionHandler {

    @ExceptionHandler(ResearchJobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleJobNotFound(ResearchJobNotFoundException ex) {
        log.warn("Research job not found: {}", ex.getJobId());

        Map<String, Object> response = createErrorResponse(
                ex.getErrorCode(),
                ex.getMessage(),
                ex.getJobId(),
                HttpStatus.NOT_FOUND.value()
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, Object>> handleProviderException(ProviderException ex) {
        log.error("Provider error from {}: {}", ex.getConnector(), ex.getMessage(), ex);

        Map<String, Object> response = createErrorResponse(
                ex.getErrorCode(),
                ex.getMessage(),
                null,
                HttpStatus.BAD_GATEWAY.value()
        );
        response.put("connector", ex.getConnector());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());

        Map<String, Object> response = createErrorResponse(
                "INVALID_REQUEST",
                ex.getMessage(),
                null,
                HttpStatus.BAD_REQUEST.value()
        );

        return ResponseEntity.badRequest().body(response);
    }

    private Map<String, Object> createErrorResponse(String errorCode, String message, String jobId, int status) {
        Map<String, Object> response = new HashMap<>();
        response.put("errorCode", errorCode);
        response.put("message", message);
        response.put("status", status);
        response.put("timestamp", LocalDateTime.now().toString());
        if (jobId != null) {
            response.put("jobId", jobId);
        }
        return response;
    }
}
