package com.mybasket.common.health;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceHealth {
    private String name;
    private HealthStatus status;
    private long value;
    private long limit;
    private long percentage;
    private String unit;
}
