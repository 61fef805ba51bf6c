package com.mybasket.cartservice.service;

import com.mybasket.cartservice.dto.CartResponse;
import com.mybasket.cartservice.dto.CartSummaryResponse;

public interface CartService {

    CartResponse getCart(String userId);

    CartResponse addItem(String userId, String productId, Integer quantity);

    CartResponse updateItem(String userId, String productId, int quantity);

    CartResponse removeItem(String userId, String productId);

    CartResponse clearCart(String userId);

    CartSummaryResponse getSummary(String userId);
}
