package com.mybasket.cartservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient catalogWebClient(WebClient.Builder builder, CartServiceProperties properties) {
        return builder.baseUrl(properties.getCatalog().getBaseUrl()).build();
    }
}
