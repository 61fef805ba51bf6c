package com.mybasket.orderservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mybasket.common.exception.ExternalServiceException;
import com.mybasket.orderservice.dto.CreateOrderRequest;
import com.mybasket.orderservice.job.CartClearanceRetryJob;
import com.mybasket.orderservice.model.CartClearanceStatus;
import com.mybasket.orderservice.model.Order;
import com.mybasket.orderservice.repository.OrderRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CreateOrderIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private CartClearanceRetryJob retryJob;

    @AfterEach
    void tearDown() {
        orderRepository.deleteAll();
    }

    private JsonNode createOrder(String userId, CreateOrderRequest request) throws Exception {
        String body = mockMvc.perform(post("/api/orders/" + userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    @Test
    void should_create_order_and_clear_cart() throws Exception {
        CreateOrderRequest request = OrderFixtures.request(
                OrderFixtures.line("p1", "100.00", 2),
                OrderFixtures.line("p2", "50.00", 3));

        JsonNode created = createOrder("user-1", request);

        assertThat(created.get("status").asText()).isEqualTo("pending");
        assertThat(created.get("totalAmount").decimalValue()).isEqualByComparingTo("350.00");
        assertThat(created.get("items")).hasSize(2);
        assertThat(created.get("items").get(0).get("id").asText()).isEqualTo("p1");
        assertThat(created.get("cartClearance").get("status").asText()).isEqualTo("completed");

        Instant orderDate = Instant.parse(created.get("orderDate").asText());
        Instant estimatedDelivery = Instant.parse(created.get("estimatedDelivery").asText());
        assertThat(Duration.between(orderDate, estimatedDelivery)).isEqualTo(Duration.ofDays(5));

        verify(cartClearanceClient).clearCart("user-1");

        String orderId = created.get("id").asText();
        mockMvc.perform(get("/api/orders/user-1/" + orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(orderId))
                .andExpect(jsonPath("$.items.length()").value(2));

        // another user cannot see it
        mockMvc.perform(get("/api/orders/user-2/" + orderId))
                .andExpect(status().isNotFound());
    }

    @Test
    void should_answer_404_for_malformed_order_id() throws Exception {
        mockMvc.perform(get("/api/orders/user-1/not-a-uuid"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("ORDER_NOT_FOUND"));
    }

    @Test
    void should_keep_order_and_retry_clearance_when_cart_service_is_down() throws Exception {
        doThrow(new ExternalServiceException("Failed to clear cart"))
                .doNothing()
                .when(cartClearanceClient).clearCart(anyString());

        JsonNode created = createOrder("user-1", OrderFixtures.request(OrderFixtures.line("p1", "10.00", 1)));
        String orderId = created.get("id").asText();

        assertThat(created.get("status").asText()).isEqualTo("pending");
        assertThat(created.get("cartClearance").get("status").asText()).isEqualTo("pending");
        assertThat(created.get("cartClearance").get("attempts").asInt()).isEqualTo(1);
        assertThat(created.get("cartClearance").get("lastError").asText()).isEqualTo("Failed to clear cart");

        // backoff is 100ms under the test profile
        await().atMost(Duration.ofSeconds(5))
                .pollInterval(Duration.ofMillis(50))
                .untilAsserted(() -> {
                    retryJob.retryPendingClearances();
                    Order order = orderRepository.findById(orderId).orElseThrow();
                    assertThat(order.getCartClearanceStatus()).isEqualTo(CartClearanceStatus.COMPLETED);
                });

        Order order = orderRepository.findById(orderId).orElseThrow();
        assertThat(order.getCartClearanceAttempts()).isEqualTo(2);
        assertThat(order.getLastCartClearanceError()).isNull();
        verify(cartClearanceClient, times(2)).clearCart("user-1");
    }

    @Test
    void should_mark_clearance_failed_after_max_attempts() throws Exception {
        doThrow(new ExternalServiceException("Failed to clear cart"))
                .when(cartClearanceClient).clearCart(anyString());

        JsonNode created = createOrder("user-1", OrderFixtures.request(OrderFixtures.line("p1", "10.00", 1)));
        String orderId = created.get("id").asText();

        await().atMost(Duration.ofSeconds(5))
                .pollInterval(Duration.ofMillis(50))
                .untilAsserted(() -> {
                    retryJob.retryPendingClearances();
                    Order order = orderRepository.findById(orderId).orElseThrow();
                    assertThat(order.getCartClearanceStatus()).isEqualTo(CartClearanceStatus.FAILED);
                });

        assertThat(orderRepository.findById(orderId).orElseThrow().getCartClearanceAttempts()).isEqualTo(3);
        verify(cartClearanceClient, times(3)).clearCart("user-1");
    }

    @Test
    void should_walk_the_status_lifecycle() throws Exception {
        doNothing().when(cartClearanceClient).clearCart(anyString());
        JsonNode created = createOrder("user-1", OrderFixtures.request(OrderFixtures.line("p1", "10.00", 1)));
        String base = "/api/orders/user-1/" + created.get("id").asText();

        mockMvc.perform(put(base + "/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"shipped\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid status transition from pending to shipped"));

        mockMvc.perform(put(base + "/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"confirmed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("confirmed"));

        mockMvc.perform(put(base + "/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"shipped\",\"trackingNumber\":\"TRK-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trackingNumber").value("TRK-1"));

        mockMvc.perform(post(base + "/cancel"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_ORDER_STATE"));

        mockMvc.perform(get("/api/orders/user-1").param("status", "shipped"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.orders[0].status").value("shipped"));
    }
}
