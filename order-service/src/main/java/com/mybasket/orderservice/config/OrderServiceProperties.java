package com.mybasket.orderservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "mybasket")
public class OrderServiceProperties {

    private String version = "1.0.0";

    private final Cart cart = new Cart();
    private final CartClearance cartClearance = new CartClearance();

    @Data
    public static class Cart {
        private String baseUrl = "http://localhost:3002";
        private Duration timeout = Duration.ofSeconds(5);
    }

    /**
     * Retry policy for clearing a user's cart after an order is placed.
     * The delay before attempt n+1 is {@code initialBackoff * 2^(n-1)}, capped at {@code maxBackoff}.
     */
    @Data
    public static class CartClearance {
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private int maxAttempts = 8;

        // read by the @Scheduled retry job through its placeholder
        private long pollIntervalMs = 5000;
    }
}
