package com.mybasket.orderservice.repository;

import com.mybasket.orderservice.model.CartClearanceStatus;
import com.mybasket.orderservice.model.Order;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    // newest first
    @EntityGraph(attributePaths = "items")
    List<Order> findByUserIdOrderByOrderDateDesc(String userId);

    @EntityGraph(attributePaths = "items")
    Optional<Order> findByIdAndUserId(String id, String userId);

    // orders whose cart clearance is due for another attempt
    List<Order> findTop50ByCartClearanceStatusAndNextCartClearanceAtLessThanEqualOrderByNextCartClearanceAtAsc(
            CartClearanceStatus status, Instant now);
}
