package com.callplatform.guardsvc.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Outbound HTTP client shared by the geo reputation provider and the CAPTCHA vendor.
 * Both are on the request path, so timeouts stay at a few seconds.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate guardRestTemplate(
            RestTemplateBuilder builder,
            @Value("${app.platform.http.connect-timeout-ms:2000}") long connectTimeoutMs,
            @Value("${app.platform.http.read-timeout-ms:3000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
