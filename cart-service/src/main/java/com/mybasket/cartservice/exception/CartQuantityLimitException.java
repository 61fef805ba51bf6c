package com.mybasket.cartservice.exception;

import com.mybasket.common.exception.BusinessRuleException;

public class CartQuantityLimitException extends BusinessRuleException {

    public CartQuantityLimitException() {
        super("Cart quantity limit exceeded", "QUANTITY_LIMIT_EXCEEDED");
    }
}
