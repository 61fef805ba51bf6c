package com.mybasket.orderservice.mapper;

import com.mybasket.orderservice.dto.CartClearanceResponse;
import com.mybasket.orderservice.dto.OrderItemResponse;
import com.mybasket.orderservice.dto.OrderResponse;
import com.mybasket.orderservice.model.Order;
import com.mybasket.orderservice.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    @Mapping(target = "cartClearance", source = "order")
    OrderResponse toOrderResponse(Order order);

    // the line is exposed under the product id, as the client submitted it
    @Mapping(source = "productId", target = "id")
    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    @Mapping(source = "cartClearanceStatus", target = "status")
    @Mapping(source = "cartClearanceAttempts", target = "attempts")
    @Mapping(source = "lastCartClearanceError", target = "lastError")
    @Mapping(source = "nextCartClearanceAt", target = "nextAttemptAt")
    CartClearanceResponse toCartClearanceResponse(Order order);
}
