package com.mybasket.productservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Optional catalog filters; a null field does not filter.
 */
@Data
@Builder
public class ProductFilter {
    private String category;
    private BigDecimal minPrice;
    private BigDecimal maxPrice;
    private Boolean inStock;
    private String search;
}
