package com.mybasket.orderservice.service;

import com.mybasket.orderservice.dto.CreateOrderRequest;
import com.mybasket.orderservice.dto.OrderFilter;
import com.mybasket.orderservice.dto.OrderListResponse;
import com.mybasket.orderservice.dto.OrderResponse;
import com.mybasket.orderservice.dto.UpdateOrderStatusRequest;

import java.util.Optional;

public interface OrderService {

    OrderResponse createOrder(String userId, CreateOrderRequest request);

    Optional<OrderResponse> getOrderById(String userId, String orderId);

    OrderListResponse getUserOrders(String userId, OrderFilter filter, int page, int limit);

    Optional<OrderResponse> updateOrderStatus(String userId, String orderId, UpdateOrderStatusRequest request);

    Optional<OrderResponse> cancelOrder(String userId, String orderId);
}
