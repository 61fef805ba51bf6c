package com.mybasket.cartservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One cart line: a snapshot of the product taken when it was first added,
 * plus the quantity. The id is the product id and is unique within a cart.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {
    private String id;
    private String name;
    private BigDecimal price;
    private String description;
    private String image;
    private String dataAiHint;
    private int quantity;
    private Instant addedAt;

    public static CartItem snapshotOf(Product product, int quantity, Instant addedAt) {
        return CartItem.builder()
                .id(product.getId())
                .name(product.getName())
                .price(product.getPrice())
                .description(product.getDescription())
                .image(product.getImage())
                .dataAiHint(product.getDataAiHint())
                .quantity(quantity)
                .addedAt(addedAt)
                .build();
    }

    public BigDecimal lineTotal() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
