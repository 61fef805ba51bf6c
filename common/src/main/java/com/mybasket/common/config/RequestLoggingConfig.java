package com.mybasket.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.CommonsRequestLoggingFilter;

/**
 * Logs every inbound request at DEBUG.
 * Enable with logging.level.org.springframework.web.filter.CommonsRequestLoggingFilter=DEBUG
 */
@Configuration
public class RequestLoggingConfig {

    @Bean
    public CommonsRequestLoggingFilter requestLoggingFilter() {
        CommonsRequestLoggingFilter filter = new CommonsRequestLoggingFilter();
        filter.setIncludeQueryString(true);
        filter.setIncludePayload(true);
        filter.setMaxPayloadLength(2000);
        filter.setIncludeHeaders(false);
        filter.setBeforeMessagePrefix("Request started: ");
        filter.setAfterMessagePrefix("Request completed: ");
        return filter;
    }
}
