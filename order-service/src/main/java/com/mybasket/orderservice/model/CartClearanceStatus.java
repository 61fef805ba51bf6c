package com.mybasket.orderservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CartClearanceStatus {
    PENDING,
    COMPLETED,
    // retries exhausted
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
