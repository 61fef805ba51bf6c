package com.mybasket.cartservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {

    @NotBlank(message = "Product ID is required")
    private String productId;

    // defaults to 1 when omitted
    @Positive(message = "Quantity must be positive")
    private Integer quantity;
}
