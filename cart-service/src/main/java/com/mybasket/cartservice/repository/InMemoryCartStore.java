package com.mybasket.cartservice.repository;

import com.mybasket.cartservice.model.Cart;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Repository
public class InMemoryCartStore implements CartStore {

    private final ConcurrentMap<String, Cart> carts = new ConcurrentHashMap<>();

    @Override
    public Optional<Cart> get(String userId) {
        return Optional.ofNullable(carts.get(userId)).map(Cart::copy);
    }

    @Override
    public Cart putIfAbsent(Cart cart) {
        Cart stored = carts.computeIfAbsent(cart.getUserId(), userId -> cart.copy());
        return stored.copy();
    }

    @Override
    public boolean compareAndSwap(String userId, long expectedVersion, Cart updated) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        carts.computeIfPresent(userId, (key, current) -> {
            if (current.getVersion() != expectedVersion) {
                return current;
            }
            Cart next = updated.copy();
            next.setVersion(expectedVersion + 1);
            swapped.set(true);
            return next;
        });
        return swapped.get();
    }

    @Override
    public int size() {
        return carts.size();
    }
}
