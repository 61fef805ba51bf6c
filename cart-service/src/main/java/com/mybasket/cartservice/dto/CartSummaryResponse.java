package com.mybasket.cartservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartSummaryResponse {
    private int totalItems;
    private BigDecimal totalAmount;

    // distinct lines, not units
    private int itemCount;
}
