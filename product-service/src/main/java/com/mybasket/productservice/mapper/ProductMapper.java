package com.mybasket.productservice.mapper;

import com.mybasket.productservice.dto.ProductResponse;
import com.mybasket.productservice.model.Product;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ProductMapper {

    ProductResponse toProductResponse(Product product);
}
