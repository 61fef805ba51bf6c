package com.mybasket.orderservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mybasket.orderservice.model.CartClearanceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CartClearanceResponse {
    private CartClearanceStatus status;
    private int attempts;
    private String lastError;
    private Instant nextAttemptAt;
}
