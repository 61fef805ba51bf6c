package com.mybasket.common.exception;

/**
 * Exception thrown when communication with another service fails
 * For example: product-service is unreachable or answers with a 5xx
 * HTTP Status: 500 Internal Server Error
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
