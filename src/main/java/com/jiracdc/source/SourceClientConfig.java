package com.jiracdc.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jiracdc.core.metrics.SyncMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SourceClientConfig {

    @Bean
    public CredentialsProvider jiraCredentialsProvider(JiraProperties properties) {
        return new SecretDirectoryCredentialsProvider(properties);
    }

    /**
     * One limiter per process: every operation shares the outbound request rate.
     */
    @Bean
    public TokenBucketRateLimiter jiraRateLimiter(JiraProperties properties) {
        return new TokenBucketRateLimiter(properties.getRateLimit(), properties.getBurst());
    }

    @Bean
    public SourceClient jiraClient(JiraProperties properties,
                                   CredentialsProvider credentialsProvider,
                                   TokenBucketRateLimiter rateLimiter,
                                   ObjectMapper objectMapper,
                                   SyncMetrics metrics) {
        return new JiraClient(properties, credentialsProvider, rateLimiter,
                RetryPolicy.from(properties.getRetry()), objectMapper, metrics);
    }
}
