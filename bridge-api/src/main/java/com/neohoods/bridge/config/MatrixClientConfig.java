package com.neohoods.bridge.config;

import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP clients used by the bridge. Each outbound dependency gets its own RestTemplate so its deadline can be tuned.
 */
@Configuration
public class MatrixClientConfig {

    @Value("${neohoods.bridge.matrix.timeout-ms:30000}")
    private long matrixTimeoutMs;

    @Value("${neohoods.bridge.matrix.sync-timeout-ms:30000}")
    private long syncTimeoutMs;

    @Value("${neohoods.bridge.media.download-timeout-ms:60000}")
    private long mediaDownloadTimeoutMs;

    @Value("${neohoods.bridge.auth.timeout-ms:5000}")
    private long authTimeoutMs;

    @Value("${neohoods.bridge.push.timeout-ms:10000}")
    private long pushTimeoutMs;

    @Bean
    public RestTemplate matrixRestTemplate(RestTemplateBuilder builder) {
        // long-polling sync holds the connection for up to sync-timeout-ms
        return builder
                .setConnectTimeout(Duration.ofMillis(matrixTimeoutMs))
                .setReadTimeout(Duration.ofMillis(matrixTimeoutMs + syncTimeoutMs))
                .build();
    }

    @Bean
    public RestTemplate mediaRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(matrixTimeoutMs))
                .setReadTimeout(Duration.ofMillis(mediaDownloadTimeoutMs))
                .build();
    }

    @Bean
    public RestTemplate authRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(authTimeoutMs))
                .setReadTimeout(Duration.ofMillis(authTimeoutMs))
                .build();
    }

    @Bean
    public RestTemplate pushRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(pushTimeoutMs))
                .setReadTimeout(Duration.ofMillis(pushTimeoutMs))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
