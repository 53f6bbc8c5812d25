package com.platform.accessplane.config;

import com.platform.accessplane.error.ProviderException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Configuration for the HTTP client and retry policy used against Confluent Cloud.
 */
@Configuration
public class HttpClientConfig {
    
    @Bean
    public HttpClient ccloudHttpClient(AccessPlaneProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getCcloud().getConnectionTimeoutMs()))
            .build();
    }
    
    @Bean
    public RetryRegistry ccloudRetryRegistry() {
        return RetryRegistry.of(defaultRetryConfig());
    }
    
    /**
     * Retries throttled and server-side failures with exponential backoff.
     */
    public static RetryConfig defaultRetryConfig() {
        return RetryConfig.custom()
            .maxAttempts(5)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(1000, 2.0))
            .retryOnException(e -> e instanceof ProviderException pe && pe.isRetryable())
            .build();
    }
}
