package com.mybasket.orderservice.exception;

import com.mybasket.common.exception.BusinessRuleException;

/**
 * Thrown when an order request is structurally acceptable but cannot be placed,
 * e.g. it has no items.
 */
public class InvalidOrderException extends BusinessRuleException {

    public InvalidOrderException(String message) {
        super(message, "INVALID_ORDER");
    }
}
