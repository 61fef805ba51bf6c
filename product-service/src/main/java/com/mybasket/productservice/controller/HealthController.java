package com.mybasket.productservice.controller;

import com.mybasket.common.health.HealthCheckResponse;
import com.mybasket.common.health.HealthStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Liveness endpoint pinged by the cart service readiness probe.
 */
@RestController
public class HealthController {

    private final Clock clock;
    private final Instant startedAt;
    private final String serviceName;
    private final String version;

    public HealthController(
            Clock clock,
            @Value("${spring.application.name}") String serviceName,
            @Value("${mybasket.version:1.0.0}") String version) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping("/api/health")
    public ResponseEntity<HealthCheckResponse> health() {
        Instant now = clock.instant();
        return ResponseEntity.ok(HealthCheckResponse.builder()
                .status(HealthStatus.HEALTHY)
                .service(serviceName)
                .version(version)
                .timestamp(now)
                .uptime(Duration.between(startedAt, now).getSeconds())
                .build());
    }
}
