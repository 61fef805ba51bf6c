package com.mybasket.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class PaymentMethod {

    @NotNull(message = "Payment method type is required")
    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type")
    private PaymentMethodType type;

    @Column(name = "payment_last4")
    private String last4;

    @Column(name = "payment_brand")
    private String brand;
}
