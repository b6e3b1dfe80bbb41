package com.debtchecker.config;

import com.debtchecker.output.CheckpointStore;
import com.debtchecker.output.FileCheckpointStore;
import com.debtchecker.service.DebtApi;
import com.debtchecker.service.DebtLookupClient;
import com.debtchecker.service.RequestThrottle;
import com.debtchecker.service.RetryPolicy;
import com.debtchecker.service.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class DebtCheckerConfig {

    static final String RATE_LIMITER_NAME = "fsspApi";

    // Rate limiter waits park the thread; the semaphore in front bounds how many wait.
    private static final Duration RATE_LIMIT_WAIT = Duration.ofMinutes(10);

    @Bean
    public RestTemplate debtApiRestTemplate(RestTemplateBuilder builder, DebtCheckerProperties properties) {
        return builder
                .setConnectTimeout(properties.getApi().getConnectTimeout())
                .setReadTimeout(properties.getApi().getTimeout())
                .build();
    }

    @Bean
    public RateLimiter fsspRateLimiter(ObjectProvider<RateLimiterRegistry> registry, DebtCheckerProperties properties) {
        DebtCheckerProperties.Throttle throttle = properties.getThrottle();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(throttle.getRequestsPerPeriod())
                .limitRefreshPeriod(throttle.getRefreshPeriod())
                .timeoutDuration(RATE_LIMIT_WAIT)
                .build();
        return registry.getIfAvailable(RateLimiterRegistry::ofDefaults).rateLimiter(RATE_LIMITER_NAME, config);
    }

    @Bean
    public RequestThrottle requestThrottle(RateLimiter fsspRateLimiter, DebtCheckerProperties properties) {
        return new RequestThrottle(properties.getThrottle().getMaxConcurrent(), fsspRateLimiter);
    }

    @Bean
    public DebtLookupClient debtLookupClient(DebtApi debtApi, RequestThrottle throttle, DebtCheckerProperties properties) {
        return new DebtLookupClient(debtApi, throttle, RetryPolicy.from(properties.getRetry()), Sleeper.THREAD);
    }

    @Bean
    public CheckpointStore checkpointStore(ObjectMapper objectMapper, DebtCheckerProperties properties) {
        Path file = Path.of(properties.getCheckpoint().getDir()).resolve(FileCheckpointStore.FILE_NAME);
        return new FileCheckpointStore(file, objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
