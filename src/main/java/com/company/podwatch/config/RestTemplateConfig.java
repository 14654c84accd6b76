package com.company.podwatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the notification gateways
 */
@Configuration
public class RestTemplateConfig {

    @Value("${podwatch.channels.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${podwatch.channels.read-timeout:10s}")
    private Duration readTimeout;

    @Bean("channelRestTemplate")
    public RestTemplate channelRestTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(connectTimeout)
            .setReadTimeout(readTimeout)
            .build();
    }
}
