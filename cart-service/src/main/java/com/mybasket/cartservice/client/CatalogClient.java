package com.mybasket.cartservice.client;

import com.mybasket.cartservice.config.CartServiceProperties;
import com.mybasket.cartservice.model.Product;
import com.mybasket.common.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * HTTP client for the product catalog.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogClient {

    private final WebClient catalogWebClient;
    private final CartServiceProperties properties;

    /**
     * @return the product, or empty when the catalog answers 404
     * @throws ExternalServiceException on transport failures and any other error status
     */
    public Optional<Product> getProduct(String productId) {
        try {
            return fetchProduct(productId).blockOptional();
        } catch (WebClientException e) {
            log.error("Error fetching product: productId={}", productId, e);
            throw new ExternalServiceException("Failed to fetch product: " + e.getMessage(), e);
        }
    }

    /**
     * Fetches all ids concurrently. Ids that are missing or fail are left out,
     * and the result order is not tied to the input order.
     */
    public List<Product> getProducts(Collection<String> productIds) {
        List<Product> products = Flux.fromIterable(productIds)
                .flatMap(productId -> fetchProduct(productId)
                        .onErrorResume(e -> {
                            log.warn("Skipping product that could not be fetched: productId={}, reason={}",
                                    productId, e.getMessage());
                            return Mono.empty();
                        }))
                .collectList()
                .block();
        return products != null ? products : List.of();
    }

    public boolean isHealthy() {
        Boolean healthy = catalogWebClient.get()
                .uri("/api/health")
                .retrieve()
                .toBodilessEntity()
                .map(response -> response.getStatusCode().is2xxSuccessful())
                .timeout(properties.getCatalog().getHealthTimeout())
                .onErrorResume(e -> {
                    log.debug("Catalog health ping failed: {}", e.toString());
                    return Mono.just(false);
                })
                .block();
        return Boolean.TRUE.equals(healthy);
    }

    private Mono<Product> fetchProduct(String productId) {
        return catalogWebClient.get()
                .uri("/api/products/{productId}", productId)
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return response.releaseBody().then(Mono.<Product>empty());
                    }
                    if (response.statusCode().isError()) {
                        return response.createError();
                    }
                    return response.bodyToMono(Product.class);
                });
    }
}
