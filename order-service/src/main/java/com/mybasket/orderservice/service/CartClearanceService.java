package com.mybasket.orderservice.service;

import com.mybasket.orderservice.client.CartClearanceClient;
import com.mybasket.orderservice.config.OrderServiceProperties;
import com.mybasket.orderservice.model.CartClearanceStatus;
import com.mybasket.orderservice.model.Order;
import com.mybasket.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Best-effort compensation step of checkout: empties the buyer's cart.
 *
 * <p>Each attempt is recorded on the order. A failed attempt schedules the next
 * one with exponential backoff; once the attempt budget is spent the clearance
 * is marked FAILED. The order itself is never rolled back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CartClearanceService {

    private final OrderRepository orderRepository;
    private final CartClearanceClient cartClearanceClient;
    private final OrderServiceProperties properties;
    private final Clock clock;

    @Transactional
    public void attemptClearance(String orderId) {
        Order order = orderRepository.findById(orderId).orElse(null);
        if (order == null) {
            log.warn("Cart clearance skipped, order not found: orderId={}", orderId);
            return;
        }
        if (order.getCartClearanceStatus() != CartClearanceStatus.PENDING) {
            log.debug("Cart clearance already settled: orderId={}, status={}", orderId, order.getCartClearanceStatus());
            return;
        }

        int attempt = order.getCartClearanceAttempts() + 1;
        order.setCartClearanceAttempts(attempt);

        try {
            cartClearanceClient.clearCart(order.getUserId());

            order.setCartClearanceStatus(CartClearanceStatus.COMPLETED);
            order.setNextCartClearanceAt(null);
            order.setLastCartClearanceError(null);
            log.info("Cart cleared after order: orderId={}, userId={}, attempt={}", orderId, order.getUserId(), attempt);

        } catch (RuntimeException e) {
            order.setLastCartClearanceError(e.getMessage());
            int maxAttempts = properties.getCartClearance().getMaxAttempts();

            if (attempt >= maxAttempts) {
                order.setCartClearanceStatus(CartClearanceStatus.FAILED);
                order.setNextCartClearanceAt(null);
                log.error("Giving up cart clearance: orderId={}, userId={}, attempts={}",
                        orderId, order.getUserId(), attempt, e);
            } else {
                Instant nextAttemptAt = clock.instant().plus(backoffAfter(attempt));
                order.setNextCartClearanceAt(nextAttemptAt);
                log.warn("Failed to clear cart after order creation: orderId={}, userId={}, attempt={}, nextAttemptAt={}, reason={}",
                        orderId, order.getUserId(), attempt, nextAttemptAt, e.getMessage());
            }
        }

        orderRepository.save(order);
    }

    /**
     * Ids of orders whose pending clearance is due now, oldest due first.
     */
    @Transactional(readOnly = true)
    public List<String> findDueOrderIds() {
        return orderRepository
                .findTop50ByCartClearanceStatusAndNextCartClearanceAtLessThanEqualOrderByNextCartClearanceAtAsc(
                        CartClearanceStatus.PENDING, clock.instant())
                .stream()
                .map(Order::getId)
                .collect(Collectors.toList());
    }

    /**
     * Delay before the attempt following {@code attempt}: initial, 2x, 4x, ... capped.
     */
    Duration backoffAfter(int attempt) {
        Duration initial = properties.getCartClearance().getInitialBackoff();
        Duration max = properties.getCartClearance().getMaxBackoff();

        // shift is bounded so the multiplication cannot overflow before the cap applies
        int shift = Math.min(attempt - 1, 30);
        Duration delay = initial.multipliedBy(1L << shift);
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
