package com.mybasket.productservice.service;

import com.mybasket.productservice.dto.ProductFilter;
import com.mybasket.productservice.dto.ProductListResponse;
import com.mybasket.productservice.dto.ProductResponse;

public interface ProductService {

    ProductResponse getProductById(String productId);

    ProductListResponse getProducts(ProductFilter filter, int page, int limit);
}
