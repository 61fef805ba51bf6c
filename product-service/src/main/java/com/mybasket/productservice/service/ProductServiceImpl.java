package com.mybasket.productservice.service;

import com.mybasket.common.exception.ResourceNotFoundException;
import com.mybasket.productservice.dto.ProductFilter;
import com.mybasket.productservice.dto.ProductListResponse;
import com.mybasket.productservice.dto.ProductResponse;
import com.mybasket.productservice.mapper.ProductMapper;
import com.mybasket.productservice.model.Product;
import com.mybasket.productservice.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductServiceImpl implements ProductService {

    private final ProductRepository productRepository;
    private final ProductMapper productMapper;

    @Override
    public ProductResponse getProductById(String productId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> {
                    log.debug("Product not found: productId={}", productId);
                    return new ResourceNotFoundException("Product not found", "PRODUCT_NOT_FOUND");
                });

        return productMapper.toProductResponse(product);
    }

    @Override
    public ProductListResponse getProducts(ProductFilter filter, int page, int limit) {
        List<Product> matching = productRepository.findAll().stream()
                .filter(product -> matches(product, filter))
                .collect(Collectors.toList());

        int from = (int) Math.min((long) (page - 1) * limit, matching.size());
        int to = Math.min(from + limit, matching.size());

        List<ProductResponse> products = matching.subList(from, to).stream()
                .map(productMapper::toProductResponse)
                .collect(Collectors.toList());

        return ProductListResponse.builder()
                .products(products)
                .total(matching.size())
                .page(page)
                .limit(limit)
                .totalPages((int) Math.ceil((double) matching.size() / limit))
                .build();
    }

    private boolean matches(Product product, ProductFilter filter) {
        if (filter == null) {
            return true;
        }
        if (filter.getCategory() != null && !filter.getCategory().equalsIgnoreCase(product.getCategory())) {
            return false;
        }
        if (filter.getMinPrice() != null && product.getPrice().compareTo(filter.getMinPrice()) < 0) {
            return false;
        }
        if (filter.getMaxPrice() != null && product.getPrice().compareTo(filter.getMaxPrice()) > 0) {
            return false;
        }
        if (filter.getInStock() != null && !filter.getInStock().equals(Boolean.TRUE.equals(product.getInStock()))) {
            return false;
        }
        if (filter.getSearch() != null && !filter.getSearch().isBlank()) {
            String term = filter.getSearch().toLowerCase(Locale.ROOT);
            return contains(product.getName(), term) || contains(product.getDescription(), term);
        }
        return true;
    }

    private boolean contains(String text, String term) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(term);
    }
}
