package com.mybasket.orderservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemResponse {
    private String id;
    private String name;
    private BigDecimal price;
    private String description;
    private String image;
    private String dataAiHint;
    private Integer quantity;
}
