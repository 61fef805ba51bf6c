package com.mybasket.cartservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

@Configuration
public class HealthConfig {

    @Bean
    public MemoryMXBean memoryMXBean() {
        return ManagementFactory.getMemoryMXBean();
    }
}
