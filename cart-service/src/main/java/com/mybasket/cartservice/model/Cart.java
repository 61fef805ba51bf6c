package com.mybasket.cartservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-user cart aggregate.
 *
 * <p>Invariant after every mutation: {@code totalItems} is the sum of line
 * quantities and {@code totalAmount} is the exact sum of {@code price * quantity}
 * rounded once to cents (HALF_UP). {@link #recalculateTotals()} throws
 * {@link ArithmeticException} rather than let {@code totalItems} wrap.
 *
 * <p>{@code version} is bumped by the store on every successful compare-and-swap.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cart {

    private String id;
    private String userId;

    @Builder.Default
    private List<CartItem> items = new ArrayList<>();

    @Builder.Default
    private BigDecimal totalAmount = BigDecimal.ZERO.setScale(2);

    private int totalItems;
    private Instant createdAt;
    private Instant updatedAt;
    private long version;

    public static Cart empty(String userId, Instant now) {
        return Cart.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Optional<CartItem> findItem(String productId) {
        return items.stream()
                .filter(item -> item.getId().equals(productId))
                .findFirst();
    }

    public void recalculateTotals() {
        totalItems = items.stream().mapToInt(CartItem::getQuantity).reduce(0, Math::addExact);
        totalAmount = items.stream()
                .map(CartItem::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    public Cart copy() {
        List<CartItem> copiedItems = new ArrayList<>(items.size());
        items.forEach(item -> copiedItems.add(item.toBuilder().build()));
        return new Cart(id, userId, copiedItems, totalAmount, totalItems, createdAt, updatedAt, version);
    }
}
