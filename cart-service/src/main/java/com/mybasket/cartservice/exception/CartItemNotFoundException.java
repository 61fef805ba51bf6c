package com.mybasket.cartservice.exception;

import com.mybasket.common.exception.ResourceNotFoundException;

public class CartItemNotFoundException extends ResourceNotFoundException {

    public CartItemNotFoundException() {
        super("Item not found in cart", "ITEM_NOT_FOUND");
    }
}
