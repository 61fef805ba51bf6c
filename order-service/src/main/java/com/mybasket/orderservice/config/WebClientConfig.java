package com.mybasket.orderservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient cartWebClient(WebClient.Builder builder, OrderServiceProperties properties) {
        return builder.baseUrl(properties.getCart().getBaseUrl()).build();
    }
}
