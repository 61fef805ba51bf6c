package com.mybasket.common.exception;

/**
 * Exception thrown when an optimistic update keeps losing the race against
 * concurrent writers and gives up
 * HTTP Status: 409 Conflict
 */
public class ConcurrentUpdateException extends RuntimeException {

    public ConcurrentUpdateException(String message) {
        super(message);
    }
}
