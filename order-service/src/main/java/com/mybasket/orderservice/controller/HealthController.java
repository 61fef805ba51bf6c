package com.mybasket.orderservice.controller;

import com.mybasket.common.health.HealthCheckResponse;
import com.mybasket.common.health.HealthStatus;
import com.mybasket.orderservice.config.OrderServiceProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@RestController
public class HealthController {

    private final Clock clock;
    private final Instant startedAt;
    private final String serviceName;
    private final String version;

    public HealthController(
            Clock clock,
            OrderServiceProperties properties,
            @Value("${spring.application.name}") String serviceName) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.serviceName = serviceName;
        this.version = properties.getVersion();
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
