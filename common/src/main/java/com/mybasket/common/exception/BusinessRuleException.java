package com.mybasket.common.exception;

/**
 * Exception thrown when a well-formed request violates a business rule,
 * e.g. an illegal order status transition or cancelling a shipped order
 * HTTP Status: 400 Bad Request
 */
public class BusinessRuleException extends RuntimeException {

    private final String errorCode;

    public BusinessRuleException(String message) {
        this(message, "BUSINESS_RULE_VIOLATION");
    }

    public BusinessRuleException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
