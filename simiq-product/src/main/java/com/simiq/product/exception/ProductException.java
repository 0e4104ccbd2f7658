package com.simiq.product.exception;

import org.springframework.http.HttpStatus;

public class ProductException extends RuntimeException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String PRODUCT_NOT_FOUND = "PRODUCT_NOT_FOUND";

    private final HttpStatus status;
    private final String errorCode;

    public ProductException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static ProductException productNotFound(String productId) {
        return new ProductException(
                String.format("Product with ID %s not found", productId),
                HttpStatus.NOT_FOUND,
                PRODUCT_NOT_FOUND
        );
    }

    public static ProductException invalidLimit(int limit) {
        return new ProductException(
                String.format("Limit must be greater than 0, got %d", limit),
                HttpStatus.BAD_REQUEST,
                VALIDATION_ERROR
        );
    }

    public static ProductException missingEmbedding(String productId) {
        return new ProductException(
                String.format("Product %s must have an embedding", productId),
                HttpStatus.BAD_REQUEST,
                VALIDATION_ERROR
        );
    }

    public static ProductException dimensionMismatch(String productId, int expected, int actual) {
        return new ProductException(
                String.format("Product %s has a %d-dimensional embedding, expected %d", productId, actual, expected),
                HttpStatus.BAD_REQUEST,
                VALIDATION_ERROR
        );
    }

    public static ProductException missingProductId() {
        return new ProductException("Product ID is required", HttpStatus.BAD_REQUEST, VALIDATION_ERROR);
    }
}
