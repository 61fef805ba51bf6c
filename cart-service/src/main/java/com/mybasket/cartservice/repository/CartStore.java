package com.mybasket.cartservice.repository;

import com.mybasket.cartservice.model.Cart;

import java.util.Optional;

/**
 * Versioned storage for carts, keyed by user id. Implementations hand out
 * copies, so callers mutate freely and publish with {@link #compareAndSwap}.
 */
public interface CartStore {

    Optional<Cart> get(String userId);

    /**
     * Stores {@code cart} unless the user already has one.
     *
     * @return a copy of whichever cart is stored afterwards
     */
    Cart putIfAbsent(Cart cart);

    /**
     * Replaces the user's cart with {@code updated} only if the stored version
     * still equals {@code expectedVersion}. On success the stored version is
     * incremented.
     *
     * @return {@code true} if the swap happened
     */
    boolean compareAndSwap(String userId, long expectedVersion, Cart updated);

    int size();
}
