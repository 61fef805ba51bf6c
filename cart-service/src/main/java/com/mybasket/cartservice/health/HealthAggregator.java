package com.mybasket.cartservice.health;

import com.mybasket.cartservice.client.CatalogClient;
import com.mybasket.cartservice.config.CartServiceProperties;
import com.mybasket.cartservice.repository.CartStore;
import com.mybasket.common.health.CachedCheck;
import com.mybasket.common.health.DependencyHealth;
import com.mybasket.common.health.HealthCheckResponse;
import com.mybasket.common.health.HealthChecks;
import com.mybasket.common.health.HealthStatus;
import com.mybasket.common.health.ResourceHealth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Builds liveness and readiness reports for the cart service.
 *
 * <p>Readiness is the worst of three probes: the catalog dependency ping,
 * heap usage and the number of live carts. Each report kind is memoized in its
 * own {@link CachedCheck}, so probes run at most once per TTL window.
 */
@Component
@Slf4j
public class HealthAggregator {

    static final String SERVICE_NAME = "cart-service";
    static final String CATALOG_DEPENDENCY = "product-service";
    static final String CATALOG_UNREACHABLE = "Product service unreachable or unhealthy";

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final CatalogClient catalogClient;
    private final CartStore cartStore;
    private final MemoryMXBean memoryMXBean;
    private final CartServiceProperties properties;
    private final Clock clock;
    private final Instant startedAt;

    private final CachedCheck<HealthCheckResponse> livenessCache;
    private final CachedCheck<HealthCheckResponse> readinessCache;

    public HealthAggregator(
            CatalogClient catalogClient,
            CartStore cartStore,
            MemoryMXBean memoryMXBean,
            CartServiceProperties properties,
            Clock clock) {
        this.catalogClient = catalogClient;
        this.cartStore = cartStore;
        this.memoryMXBean = memoryMXBean;
        this.properties = properties;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.livenessCache = new CachedCheck<>(properties.getHealth().getLivenessTtl(), clock);
        this.readinessCache = new CachedCheck<>(properties.getHealth().getReadinessTtl(), clock);
    }

    public HealthCheckResponse checkLiveness() {
        return livenessCache.get(this::computeLiveness);
    }

    public HealthCheckResponse checkReadiness() {
        return readinessCache.get(this::computeReadiness);
    }

    public HealthCheckResponse checkHealth() {
        return checkReadiness();
    }

    private HealthCheckResponse computeLiveness() {
        Instant now = clock.instant();
        return HealthCheckResponse.builder()
                .status(HealthStatus.HEALTHY)
                .service(SERVICE_NAME)
                .version(properties.getVersion())
                .timestamp(now)
                .uptime(uptimeSeconds(now))
                .build();
    }

    private HealthCheckResponse computeReadiness() {
        long started = System.nanoTime();

        DependencyHealth catalog = checkCatalog();
        ResourceHealth memory = checkMemory();
        ResourceHealth carts = checkCarts();

        HealthStatus overall = catalog.getStatus()
                .worst(memory.getStatus())
                .worst(carts.getStatus());

        if (overall != HealthStatus.HEALTHY) {
            log.warn("Readiness is {}: catalog={}, memory={}%, carts={}",
                    overall.getValue(), catalog.getStatus().getValue(), memory.getPercentage(), carts.getValue());
        }

        Instant now = clock.instant();
        return HealthCheckResponse.builder()
                .status(overall)
                .service(SERVICE_NAME)
                .version(properties.getVersion())
                .timestamp(now)
                .uptime(uptimeSeconds(now))
                .checks(HealthChecks.builder()
                        .dependencies(List.of(catalog))
                        .resources(List.of(memory, carts))
                        .build())
                .responseTime(elapsedMillis(started))
                .build();
    }

    private DependencyHealth checkCatalog() {
        long started = System.nanoTime();
        boolean healthy = catalogClient.isHealthy();

        return DependencyHealth.builder()
                .name(CATALOG_DEPENDENCY)
                .status(healthy ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY)
                .responseTime(elapsedMillis(started))
                .error(healthy ? null : CATALOG_UNREACHABLE)
                .build();
    }

    private ResourceHealth checkMemory() {
        MemoryUsage heap = memoryMXBean.getHeapMemoryUsage();
        // Measured against max heap, not committed heap: the JVM grows committed heap on demand,
        // so used/committed stays near 100% and would report degraded almost permanently.
        // Committed is only the fallback when max is -1 (no heap limit defined).
        long limit = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        long percentage = limit > 0 ? Math.round(heap.getUsed() * 100.0 / limit) : 0;

        HealthStatus status;
        if (percentage > 90) {
            status = HealthStatus.UNHEALTHY;
        } else if (percentage > 80) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.HEALTHY;
        }

        return ResourceHealth.builder()
                .name("memory")
                .status(status)
                .value(Math.round((double) heap.getUsed() / BYTES_PER_MB))
                .limit(Math.round((double) limit / BYTES_PER_MB))
                .percentage(percentage)
                .unit("MB")
                .build();
    }

    private ResourceHealth checkCarts() {
        long count = cartStore.size();
        long capacity = properties.getHealth().getCartCapacity();

        return ResourceHealth.builder()
                .name("carts")
                .status(count > capacity ? HealthStatus.DEGRADED : HealthStatus.HEALTHY)
                .value(count)
                .limit(capacity)
                .percentage(capacity > 0 ? Math.round(count * 100.0 / capacity) : 0)
                .unit("count")
                .build();
    }

    private long uptimeSeconds(Instant now) {
        return Duration.between(startedAt, now).getSeconds();
    }

    private static long elapsedMillis(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
