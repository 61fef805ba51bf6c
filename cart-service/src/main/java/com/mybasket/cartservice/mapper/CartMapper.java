package com.mybasket.cartservice.mapper;

import com.mybasket.cartservice.dto.CartItemResponse;
import com.mybasket.cartservice.dto.CartResponse;
import com.mybasket.cartservice.dto.CartSummaryResponse;
import com.mybasket.cartservice.model.Cart;
import com.mybasket.cartservice.model.CartItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface CartMapper {

    CartResponse toCartResponse(Cart cart);

    CartItemResponse toCartItemResponse(CartItem cartItem);

    @Mapping(target = "itemCount", expression = "java(cart.getItems().size())")
    CartSummaryResponse toCartSummaryResponse(Cart cart);
}
