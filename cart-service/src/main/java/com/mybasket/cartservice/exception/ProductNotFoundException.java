package com.mybasket.cartservice.exception;

import com.mybasket.common.exception.ResourceNotFoundException;

public class ProductNotFoundException extends ResourceNotFoundException {

    public ProductNotFoundException() {
        super("Product not found", "PRODUCT_NOT_FOUND");
    }
}
