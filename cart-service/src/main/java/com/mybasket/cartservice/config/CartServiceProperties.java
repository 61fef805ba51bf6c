package com.mybasket.cartservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "mybasket")
public class CartServiceProperties {

    private String version = "1.0.0";

    private final Catalog catalog = new Catalog();
    private final Health health = new Health();
    private final Cart cart = new Cart();

    @Data
    public static class Catalog {
        private String baseUrl = "http://localhost:3001";
        private Duration healthTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Health {
        private Duration livenessTtl = Duration.ofSeconds(60);
        private Duration readinessTtl = Duration.ofSeconds(30);

        // live carts above this count report the carts resource as degraded
        private long cartCapacity = 10_000;
    }

    @Data
    public static class Cart {
        // compare-and-swap attempts before a mutation gives up with 409
        private int maxUpdateAttempts = 16;
    }
}
