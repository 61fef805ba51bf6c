package com.mybasket.common.health;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health states ordered by severity; {@link #worst(HealthStatus)} reduces
 * several probe results to the overall status.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public HealthStatus worst(HealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
