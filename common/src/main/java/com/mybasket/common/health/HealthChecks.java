package com.mybasket.common.health;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthChecks {
    private List<DependencyHealth> dependencies;
    private List<ResourceHealth> resources;
}
