package com.mybasket.productservice.controller;

import com.mybasket.common.exception.ResourceNotFoundException;
import com.mybasket.productservice.dto.ProductResponse;
import com.mybasket.productservice.service.ProductService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProductController.class)
class ProductControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProductService productService;

    @Test
    void should_return_product_by_id() throws Exception {
        when(productService.getProductById("1")).thenReturn(ProductResponse.builder()
                .id("1")
                .name("Organic Bananas")
                .price(new BigDecimal("10.99"))
                .build());

        mockMvc.perform(get("/api/products/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("1"))
                .andExpect(jsonPath("$.price").value(10.99));
    }

    @Test
    void should_return_404_for_unknown_product() throws Exception {
        when(productService.getProductById("nope"))
                .thenThrow(new ResourceNotFoundException("Product not found", "PRODUCT_NOT_FOUND"));

        mockMvc.perform(get("/api/products/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("PRODUCT_NOT_FOUND"));
    }

    @Test
    void should_reject_limit_above_100() throws Exception {
        mockMvc.perform(get("/api/products").param("limit", "101"))
                .andExpect(status().isBadRequest());

        verify(productService, never()).getProducts(any(), anyInt(), anyInt());
    }
}
