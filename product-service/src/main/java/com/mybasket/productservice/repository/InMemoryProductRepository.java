package com.mybasket.productservice.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mybasket.productservice.model.Product;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog held in memory, seeded once from a JSON resource at startup.
 */
@Repository
@Slf4j
public class InMemoryProductRepository implements ProductRepository {

    private final Map<String, Product> products = new LinkedHashMap<>();

    public InMemoryProductRepository(
            ObjectMapper objectMapper,
            @Value("${mybasket.catalog.seed:classpath:catalog/products.json}") Resource seed) {
        try (InputStream in = seed.getInputStream()) {
            List<Product> loaded = objectMapper.readValue(in, new TypeReference<List<Product>>() {
            });
            loaded.forEach(product -> products.put(product.getId(), product));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load product catalog from " + seed, e);
        }
        log.info("Product catalog loaded: {} products from {}", products.size(), seed);
    }

    @Override
    public Optional<Product> findById(String id) {
        return Optional.ofNullable(products.get(id));
    }

    @Override
    public List<Product> findAll() {
        return new ArrayList<>(products.values());
    }
}
