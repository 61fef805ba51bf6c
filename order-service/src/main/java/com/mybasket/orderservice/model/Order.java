package com.mybasket.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "orders")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    // UUID string assigned at creation; path lookups with any other string simply miss
    @Id
    @ToString.Include
    private String id;

    @ToString.Include
    @Column(nullable = false)
    private String userId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<OrderItem> items = new ArrayList<>();

    // computed once at creation, never recomputed
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @ToString.Include
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "street", column = @Column(name = "shipping_street")),
            @AttributeOverride(name = "city", column = @Column(name = "shipping_city")),
            @AttributeOverride(name = "state", column = @Column(name = "shipping_state")),
            @AttributeOverride(name = "zipCode", column = @Column(name = "shipping_zip_code")),
            @AttributeOverride(name = "country", column = @Column(name = "shipping_country"))
    })
    private Address shippingAddress;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "street", column = @Column(name = "billing_street")),
            @AttributeOverride(name = "city", column = @Column(name = "billing_city")),
            @AttributeOverride(name = "state", column = @Column(name = "billing_state")),
            @AttributeOverride(name = "zipCode", column = @Column(name = "billing_zip_code")),
            @AttributeOverride(name = "country", column = @Column(name = "billing_country"))
    })
    private Address billingAddress;

    @Embedded
    private PaymentMethod paymentMethod;

    @Column(nullable = false)
    private Instant orderDate;

    private Instant estimatedDelivery;

    private String trackingNumber;

    private Instant actualDelivery;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    // Best-effort cart clearance after checkout, retried by CartClearanceRetryJob
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CartClearanceStatus cartClearanceStatus;

    @Column(nullable = false)
    private int cartClearanceAttempts;

    private Instant nextCartClearanceAt;

    @Column(length = 1000)
    private String lastCartClearanceError;

    // Optimistic locking: a stale concurrent update fails with OptimisticLockingFailureException
    @Version
    private Long version;

    public void addItem(OrderItem item) {
        item.setOrder(this);
        item.setLineNumber(items.size());
        items.add(item);
    }
}
