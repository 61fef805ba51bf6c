package com.mybasket.cartservice.service;

import com.mybasket.cartservice.client.CatalogClient;
import com.mybasket.cartservice.config.CartServiceProperties;
import com.mybasket.cartservice.dto.CartResponse;
import com.mybasket.cartservice.dto.CartSummaryResponse;
import com.mybasket.cartservice.exception.CartItemNotFoundException;
import com.mybasket.cartservice.exception.CartQuantityLimitException;
import com.mybasket.cartservice.exception.ProductNotFoundException;
import com.mybasket.cartservice.mapper.CartMapper;
import com.mybasket.cartservice.model.Cart;
import com.mybasket.cartservice.model.CartItem;
import com.mybasket.cartservice.model.Product;
import com.mybasket.cartservice.repository.CartStore;
import com.mybasket.common.exception.ConcurrentUpdateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Consumer;

@Service
@RequiredArgsConstructor
@Slf4j
public class CartServiceImpl implements CartService {

    private final CartStore cartStore;
    private final CatalogClient catalogClient;
    private final CartMapper cartMapper;
    private final CartServiceProperties properties;
    private final Clock clock;

    @Override
    public CartResponse getCart(String userId) {
        return cartMapper.toCartResponse(getOrCreateCart(userId));
    }

    @Override
    public CartResponse addItem(String userId, String productId, Integer quantity) {
        int amount = quantity != null ? quantity : 1;
        if (amount <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }

        // Catalog lookup happens once, outside the retry loop
        Product product = catalogClient.getProduct(productId)
                .orElseThrow(() -> {
                    log.debug("Product not found in catalog: productId={}", productId);
                    return new ProductNotFoundException();
                });

        Cart cart = mutate(userId, current -> {
            Optional<CartItem> existing = current.findItem(productId);
            if (existing.isPresent()) {
                existing.get().setQuantity(Math.addExact(existing.get().getQuantity(), amount));
            } else {
                current.getItems().add(CartItem.snapshotOf(product, amount, clock.instant()));
            }
        });

        log.info("Item added to cart: userId={}, productId={}, quantity={}", userId, productId, amount);
        return cartMapper.toCartResponse(cart);
    }

    @Override
    public CartResponse updateItem(String userId, String productId, int quantity) {
        if (quantity <= 0) {
            return removeItem(userId, productId);
        }

        Cart cart = mutate(userId, current -> current.findItem(productId)
                .orElseThrow(CartItemNotFoundException::new)
                .setQuantity(quantity));

        log.info("Cart item updated: userId={}, productId={}, quantity={}", userId, productId, quantity);
        return cartMapper.toCartResponse(cart);
    }

    @Override
    public CartResponse removeItem(String userId, String productId) {
        Cart cart = mutate(userId, current -> current.getItems().removeIf(item -> item.getId().equals(productId)));

        log.info("Item removed from cart: userId={}, productId={}", userId, productId);
        return cartMapper.toCartResponse(cart);
    }

    @Override
    public CartResponse clearCart(String userId) {
        Cart cart = mutate(userId, current -> current.getItems().clear());

        log.info("Cart cleared: userId={}", userId);
        return cartMapper.toCartResponse(cart);
    }

    @Override
    public CartSummaryResponse getSummary(String userId) {
        return cartMapper.toCartSummaryResponse(getOrCreateCart(userId));
    }

    private Cart getOrCreateCart(String userId) {
        return cartStore.get(userId)
                .orElseGet(() -> cartStore.putIfAbsent(Cart.empty(userId, clock.instant())));
    }

    /**
     * Applies {@code mutation} to a private copy of the user's cart and publishes
     * it with compare-and-swap, re-reading and re-applying on conflict.
     * Quantities that no longer fit in an {@code int} reject the whole mutation.
     */
    private Cart mutate(String userId, Consumer<Cart> mutation) {
        int maxAttempts = properties.getCart().getMaxUpdateAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Cart cart = getOrCreateCart(userId);
            long expectedVersion = cart.getVersion();

            try {
                mutation.accept(cart);
                cart.recalculateTotals();
            } catch (ArithmeticException e) {
                log.debug("Cart quantity overflow rejected: userId={}", userId);
                throw new CartQuantityLimitException();
            }
            cart.setUpdatedAt(clock.instant());

            if (cartStore.compareAndSwap(userId, expectedVersion, cart)) {
                cart.setVersion(expectedVersion + 1);
                return cart;
            }
            log.debug("Cart version conflict, retrying: userId={}, attempt={}", userId, attempt);
        }

        log.warn("Giving up cart update after {} attempts: userId={}", maxAttempts, userId);
        throw new ConcurrentUpdateException("Cart was modified concurrently, please retry");
    }
}
