package com.example.pawpal.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WebConfig {

    @Bean
    @ConditionalOnProperty(prefix = "pawpal.correlation-filter", name = "enabled", matchIfMissing = true)
    public FilterRegistrationBean<CorrelationIdFilter> correlationIdFilter(PawPalProperties properties) {
        FilterRegistrationBean<CorrelationIdFilter> reg = new FilterRegistrationBean<>();
        reg.setFilter(new CorrelationIdFilter(properties.getCorrelationFilter().getHeaderName()));
        reg.addUrlPatterns("/api/*");
        reg.setOrder(1);
        return reg;
    }
}
