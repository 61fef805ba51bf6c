package com.mybasket.orderservice.dto;

import com.mybasket.orderservice.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Optional filters for listing a user's orders. Date bounds are inclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderFilter {
    private OrderStatus status;
    private Instant startDate;
    private Instant endDate;
}
