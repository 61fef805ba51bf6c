package com.mybasket.common.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Body of the /health, /health/live and /health/ready endpoints.
 * Liveness responses carry no {@code checks} and no {@code responseTime}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthCheckResponse {

    private HealthStatus status;
    private String service;
    private String version;
    private Instant timestamp;

    // seconds since the service started
    private long uptime;

    private HealthChecks checks;

    // milliseconds spent computing this response
    private Long responseTime;

    private String error;

    @JsonIgnore
    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
