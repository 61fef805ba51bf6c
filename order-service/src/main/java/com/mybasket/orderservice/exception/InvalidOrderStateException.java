package com.mybasket.orderservice.exception;

import com.mybasket.common.exception.BusinessRuleException;

/**
 * Thrown when a status change is not allowed from the order's current status.
 */
public class InvalidOrderStateException extends BusinessRuleException {

    public InvalidOrderStateException(String message) {
        super(message, "INVALID_ORDER_STATE");
    }
}
