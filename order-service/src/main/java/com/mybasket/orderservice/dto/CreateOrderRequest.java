package com.mybasket.orderservice.dto;

import com.mybasket.orderservice.model.Address;
import com.mybasket.orderservice.model.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {

    // emptiness is a business rule, checked by the service
    @NotNull(message = "Items are required")
    private List<@Valid OrderItemRequest> items;

    @Valid
    @NotNull(message = "Shipping address is required")
    private Address shippingAddress;

    @Valid
    @NotNull(message = "Billing address is required")
    private Address billingAddress;

    @Valid
    @NotNull(message = "Payment method is required")
    private PaymentMethod paymentMethod;
}
