package com.mybasket.orderservice.client;

import com.mybasket.common.exception.ExternalServiceException;
import com.mybasket.orderservice.config.OrderServiceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Empties a user's cart on the cart service.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CartClearanceClient {

    private final WebClient cartWebClient;
    private final OrderServiceProperties properties;

    /**
     * @throws ExternalServiceException if the cart service is unreachable, slow or answers with an error
     */
    public void clearCart(String userId) {
        log.debug("Clearing cart: userId={}", userId);
        try {
            cartWebClient.delete()
                    .uri("/api/cart/{userId}", userId)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(properties.getCart().getTimeout())
                    .block();
        } catch (RuntimeException e) {
            log.debug("Cart clearance call failed: userId={}, reason={}", userId, e.getMessage());
            throw new ExternalServiceException("Failed to clear cart", e);
        }
    }
}
