package com.mybasket.orderservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mybasket.orderservice.model.Address;
import com.mybasket.orderservice.model.OrderStatus;
import com.mybasket.orderservice.model.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponse {
    private String id;
    private String userId;
    private List<OrderItemResponse> items;
    private BigDecimal totalAmount;
    private OrderStatus status;
    private Address shippingAddress;
    private Address billingAddress;
    private PaymentMethod paymentMethod;
    private Instant orderDate;
    private Instant estimatedDelivery;
    private String trackingNumber;
    private Instant actualDelivery;
    private Instant createdAt;
    private Instant updatedAt;
    private CartClearanceResponse cartClearance;
}
