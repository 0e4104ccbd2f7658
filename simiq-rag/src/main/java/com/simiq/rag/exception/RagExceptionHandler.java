package com.simiq.rag.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice(basePackages = "com.simiq")
public class RagExceptionHandler {

    @ExceptionHandler(VectorIndexException.class)
    public ResponseEntity<Map<String, Object>> handleVectorIndexException(VectorIndexException ex) {
        log.error("Vector index exception: {}", ex.getMessage());

        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("error", ex.getMessage());
        body.put("errorCode", ex.getErrorCode());

        return ResponseEntity.status(ex.getStatus())
                .header(HttpHeaders.RETRY_AFTER, "5")
                .body(body);
    }
}
