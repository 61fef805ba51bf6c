package com.mybasket.orderservice.job;

import com.mybasket.orderservice.service.CartClearanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class CartClearanceRetryJob {

    private final CartClearanceService cartClearanceService;

    @Scheduled(fixedDelayString = "${mybasket.cart-clearance.poll-interval-ms:5000}")
    public void retryPendingClearances() {
        List<String> dueOrderIds = cartClearanceService.findDueOrderIds();

        if (dueOrderIds.isEmpty()) {
            return;
        }

        log.debug("Found {} orders with a cart clearance due", dueOrderIds.size());

        for (String orderId : dueOrderIds) {
            try {
                cartClearanceService.attemptClearance(orderId);
            } catch (Exception e) {
                log.error("Cart clearance retry could not be recorded: orderId={}", orderId, e);
            }
        }
    }
}
