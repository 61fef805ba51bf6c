package com.mybasket.cartservice.controller;

import com.mybasket.cartservice.health.HealthAggregator;
import com.mybasket.common.health.HealthCheckResponse;
import com.mybasket.common.health.HealthStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Health endpoints: 200 when healthy, 503 otherwise (degraded included).
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final HealthAggregator healthAggregator;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<HealthCheckResponse> health() {
        return respond(healthAggregator::checkHealth, "Health check failed");
    }

    @GetMapping("/live")
    public ResponseEntity<HealthCheckResponse> liveness() {
        return respond(healthAggregator::checkLiveness, "Liveness check failed");
    }

    @GetMapping("/ready")
    public ResponseEntity<HealthCheckResponse> readiness() {
        return respond(healthAggregator::checkReadiness, "Readiness check failed");
    }

    private ResponseEntity<HealthCheckResponse> respond(Supplier<HealthCheckResponse> check, String failureMessage) {
        HealthCheckResponse response;
        try {
            response = check.get();
        } catch (RuntimeException e) {
            log.error("{}", failureMessage, e);
            response = HealthCheckResponse.builder()
                    .status(HealthStatus.UNHEALTHY)
                    .service("cart-service")
                    .timestamp(clock.instant())
                    .error(failureMessage)
                    .build();
        }
        HttpStatus status = response.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }
}
