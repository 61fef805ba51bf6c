package com.mybasket.orderservice.controller;

import com.mybasket.common.exception.ResourceNotFoundException;
import com.mybasket.orderservice.dto.CreateOrderRequest;
import com.mybasket.orderservice.dto.OrderFilter;
import com.mybasket.orderservice.dto.OrderListResponse;
import com.mybasket.orderservice.dto.OrderResponse;
import com.mybasket.orderservice.dto.UpdateOrderStatusRequest;
import com.mybasket.orderservice.model.OrderStatus;
import com.mybasket.orderservice.service.OrderService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

@RestController
@RequestMapping("/api/orders/{userId}")
@RequiredArgsConstructor
@Validated
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @PathVariable String userId,
            @Valid @RequestBody CreateOrderRequest request) {
        OrderResponse response = orderService.createOrder(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<OrderListResponse> getUserOrders(
            @PathVariable String userId,
            @RequestParam(required = false) OrderStatus status,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(defaultValue = "1") @Min(value = 1, message = "Page must be at least 1") int page,
            @RequestParam(defaultValue = "10") @Min(value = 1, message = "Limit must be at least 1")
            @Max(value = 100, message = "Limit must be at most 100") int limit) {

        OrderFilter filter = OrderFilter.builder()
                .status(status)
                .startDate(parseDate(startDate, "startDate"))
                .endDate(parseDate(endDate, "endDate"))
                .build();

        return ResponseEntity.ok(orderService.getUserOrders(userId, filter, page, limit));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(
            @PathVariable String userId,
            @PathVariable String orderId) {
        return orderService.getOrderById(userId, orderId)
                .map(ResponseEntity::ok)
                .orElseThrow(OrderController::orderNotFound);
    }

    @PutMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateOrderStatus(
            @PathVariable String userId,
            @PathVariable String orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request) {
        return orderService.updateOrderStatus(userId, orderId, request)
                .map(ResponseEntity::ok)
                .orElseThrow(OrderController::orderNotFound);
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable String userId,
            @PathVariable String orderId) {
        return orderService.cancelOrder(userId, orderId)
                .map(ResponseEntity::ok)
                .orElseThrow(OrderController::orderNotFound);
    }

    private static ResourceNotFoundException orderNotFound() {
        return new ResourceNotFoundException("Order not found", "ORDER_NOT_FOUND");
    }

    // Accepts a full ISO instant or a bare date, which is taken as midnight UTC
    private static Instant parseDate(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }
}
