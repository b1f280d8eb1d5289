package com.psl.search.provider;

import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ProviderConfig {

    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, ProviderProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .build();
    }
}
