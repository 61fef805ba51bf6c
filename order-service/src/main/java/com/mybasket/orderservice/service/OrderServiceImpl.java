package com.mybasket.orderservice.service;

import com.mybasket.orderservice.config.OrderServiceProperties;
import com.mybasket.orderservice.dto.CreateOrderRequest;
import com.mybasket.orderservice.dto.OrderFilter;
import com.mybasket.orderservice.dto.OrderItemRequest;
import com.mybasket.orderservice.dto.OrderListResponse;
import com.mybasket.orderservice.dto.OrderResponse;
import com.mybasket.orderservice.dto.UpdateOrderStatusRequest;
import com.mybasket.orderservice.exception.InvalidOrderException;
import com.mybasket.orderservice.exception.InvalidOrderStateException;
import com.mybasket.orderservice.mapper.OrderMapper;
import com.mybasket.orderservice.model.CartClearanceStatus;
import com.mybasket.orderservice.model.Order;
import com.mybasket.orderservice.model.OrderItem;
import com.mybasket.orderservice.model.OrderStatus;
import com.mybasket.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    static final Duration DELIVERY_ESTIMATE = Duration.ofDays(5);

    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;
    private final CartClearanceService cartClearanceService;
    private final OrderServiceProperties properties;
    private final Clock clock;

    @Override
    public OrderResponse createOrder(String userId, CreateOrderRequest request) {
        if (request.getItems() == null || request.getItems().isEmpty()) {
            throw new InvalidOrderException("Order must contain at least one item");
        }
        log.info("Order creation started: userId={}, lines={}", userId, request.getItems().size());

        Instant now = clock.instant();

        Order order = new Order();
        order.setId(UUID.randomUUID().toString());
        order.setUserId(userId);
        order.setStatus(OrderStatus.PENDING);
        order.setShippingAddress(request.getShippingAddress());
        order.setBillingAddress(request.getBillingAddress());
        order.setPaymentMethod(request.getPaymentMethod());
        order.setOrderDate(now);
        order.setEstimatedDelivery(now.plus(DELIVERY_ESTIMATE));
        order.setCreatedAt(now);
        order.setUpdatedAt(now);

        order.setCartClearanceStatus(CartClearanceStatus.PENDING);
        order.setCartClearanceAttempts(0);
        // the inline attempt below is the first try, the retry job waits one backoff
        order.setNextCartClearanceAt(now.plus(properties.getCartClearance().getInitialBackoff()));

        BigDecimal total = BigDecimal.ZERO;
        for (OrderItemRequest line : request.getItems()) {
            OrderItem item = toOrderItem(line);
            order.addItem(item);
            total = total.add(item.lineTotal());
        }
        // single rounding pass over the exact sum
        order.setTotalAmount(total.setScale(2, RoundingMode.HALF_UP));

        Order savedOrder = orderRepository.save(order);
        log.info("Order saved: orderId={}, userId={}, totalAmount={}",
                savedOrder.getId(), userId, savedOrder.getTotalAmount());

        try {
            cartClearanceService.attemptClearance(savedOrder.getId());
        } catch (RuntimeException e) {
            // the retry job picks the order up from its pending clearance state
            log.warn("Cart clearance attempt could not be recorded: orderId={}", savedOrder.getId(), e);
        }

        return orderRepository.findByIdAndUserId(savedOrder.getId(), userId)
                .map(orderMapper::toOrderResponse)
                .orElseGet(() -> orderMapper.toOrderResponse(savedOrder));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderResponse> getOrderById(String userId, String orderId) {
        return orderRepository.findByIdAndUserId(orderId, userId)
                .map(orderMapper::toOrderResponse);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderListResponse getUserOrders(String userId, OrderFilter filter, int page, int limit) {
        List<Order> matching = orderRepository.findByUserIdOrderByOrderDateDesc(userId).stream()
                .filter(order -> matches(order, filter))
                .collect(Collectors.toList());

        int from = (int) Math.min((long) (page - 1) * limit, matching.size());
        int to = Math.min(from + limit, matching.size());

        List<OrderResponse> orders = matching.subList(from, to).stream()
                .map(orderMapper::toOrderResponse)
                .collect(Collectors.toList());

        return OrderListResponse.builder()
                .orders(orders)
                .total(matching.size())
                .page(page)
                .limit(limit)
                .totalPages((int) Math.ceil((double) matching.size() / limit))
                .build();
    }

    @Override
    @Transactional
    public Optional<OrderResponse> updateOrderStatus(String userId, String orderId, UpdateOrderStatusRequest request) {
        Optional<Order> found = orderRepository.findByIdAndUserId(orderId, userId);
        if (found.isEmpty()) {
            log.debug("Order not found for status update: orderId={}, userId={}", orderId, userId);
            return Optional.empty();
        }

        Order order = found.get();
        OrderStatus current = order.getStatus();
        OrderStatus target = request.getStatus();

        if (!current.canTransitionTo(target)) {
            log.warn("Rejected status transition: orderId={}, from={}, to={}", orderId, current, target);
            throw new InvalidOrderStateException(
                    "Invalid status transition from " + current.getValue() + " to " + target.getValue());
        }

        order.setStatus(target);
        order.setUpdatedAt(clock.instant());
        if (request.getTrackingNumber() != null) {
            order.setTrackingNumber(request.getTrackingNumber());
        }
        if (request.getEstimatedDelivery() != null) {
            order.setEstimatedDelivery(request.getEstimatedDelivery());
        }
        if (request.getActualDelivery() != null) {
            order.setActualDelivery(request.getActualDelivery());
        }

        Order savedOrder = orderRepository.save(order);
        log.info("Order status updated: orderId={}, from={}, to={}", orderId, current, target);
        return Optional.of(orderMapper.toOrderResponse(savedOrder));
    }

    @Override
    @Transactional
    public Optional<OrderResponse> cancelOrder(String userId, String orderId) {
        Optional<Order> found = orderRepository.findByIdAndUserId(orderId, userId);
        if (found.isEmpty()) {
            log.debug("Order not found for cancellation: orderId={}, userId={}", orderId, userId);
            return Optional.empty();
        }

        Order order = found.get();
        if (order.getStatus() == OrderStatus.SHIPPED || order.getStatus() == OrderStatus.DELIVERED) {
            throw new InvalidOrderStateException("Cannot cancel order that has already been shipped or delivered");
        }
        if (order.getStatus() == OrderStatus.CANCELLED) {
            throw new InvalidOrderStateException("Order is already cancelled");
        }

        OrderStatus previous = order.getStatus();
        order.setStatus(OrderStatus.CANCELLED);
        order.setUpdatedAt(clock.instant());

        Order savedOrder = orderRepository.save(order);
        log.info("Order cancelled: orderId={}, userId={}, previousStatus={}", orderId, userId, previous);
        return Optional.of(orderMapper.toOrderResponse(savedOrder));
    }

    private OrderItem toOrderItem(OrderItemRequest line) {
        OrderItem item = new OrderItem();
        item.setProductId(line.getId());
        item.setName(line.getName());
        item.setPrice(line.getPrice());
        item.setDescription(line.getDescription());
        item.setImage(line.getImage());
        item.setDataAiHint(line.getDataAiHint());
        item.setQuantity(line.getQuantity());
        return item;
    }

    private boolean matches(Order order, OrderFilter filter) {
        if (filter == null) {
            return true;
        }
        if (filter.getStatus() != null && order.getStatus() != filter.getStatus()) {
            return false;
        }
        if (filter.getStartDate() != null && order.getOrderDate().isBefore(filter.getStartDate())) {
            return false;
        }
        return filter.getEndDate() == null || !order.getOrderDate().isAfter(filter.getEndDate());
    }
}
