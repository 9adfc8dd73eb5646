package com.guno.drawimport.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client wiring - one RestTemplate with bounded timeouts for every upstream call
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final DrawSourceProperties properties;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getHttp().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getHttp().getReadTimeoutMs()))
                .build();
    }
}
