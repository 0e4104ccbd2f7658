package com.simiq.rag.exception;

import org.springframework.http.HttpStatus;

/**
 * The vector index backing store is unreachable or misbehaving.
 * Retryable by the caller; never used for bad input or for an absent product.
 */
public class VectorIndexException extends RuntimeException {

    public static final String INDEX_UNAVAILABLE = "INDEX_UNAVAILABLE";

    private final HttpStatus status;
    private final String errorCode;

    public VectorIndexException(String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.SERVICE_UNAVAILABLE;
        this.errorCode = INDEX_UNAVAILABLE;
    }

    public VectorIndexException(String message) {
        this(message, null);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static VectorIndexException indexUnavailable(String operation, Throwable cause) {
        return new VectorIndexException(
                String.format("Vector index unavailable during %s: %s", operation, cause.getMessage()), cause);
    }

    public static VectorIndexException malformedResponse(String operation) {
        return new VectorIndexException(
                String.format("Vector index returned an unexpected response during %s", operation));
    }

    public static VectorIndexException missingVector(String productId) {
        return new VectorIndexException(
                String.format("Stored point for product %s has no vector", productId));
    }
}
