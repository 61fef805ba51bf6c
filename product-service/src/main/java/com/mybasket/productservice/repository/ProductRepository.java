package com.mybasket.productservice.repository;

import com.mybasket.productservice.model.Product;

import java.util.List;
import java.util.Optional;

public interface ProductRepository {

    Optional<Product> findById(String id);

    List<Product> findAll();
}
