package com.mybasket.cartservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {
    private String id;
    private String name;
    private BigDecimal price;
    private String description;
    private String image;
    private String dataAiHint;
    private int quantity;
    private Instant addedAt;
}
