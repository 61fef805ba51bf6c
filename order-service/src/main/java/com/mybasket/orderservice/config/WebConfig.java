package com.mybasket.orderservice.config;

import com.mybasket.orderservice.model.OrderStatus;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        // ?status=pending as well as ?status=PENDING
        registry.addConverter(new StringToOrderStatusConverter());
    }

    static class StringToOrderStatusConverter implements Converter<String, OrderStatus> {

        @Override
        public OrderStatus convert(String source) {
            return OrderStatus.fromValue(source.trim());
        }
    }
}
