package com.wpanther.fpolifecycle.config;

import com.wpanther.fpolifecycle.exception.TransientExternalException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j configuration for calls to the access-control service.
 *
 * Retry: only transient failures (timeouts, unavailability), fixed wait between attempts.
 * Time limiter: bounds every single attempt.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String ACCESS_CONTROL = "accessControl";

    @Value("${app.aaa.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${app.aaa.retry.wait:500ms}")
    private Duration waitDuration;

    @Value("${app.aaa.request-timeout:10s}")
    private Duration requestTimeout;

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(waitDuration)
                .retryExceptions(TransientExternalException.class)
                .build();
        return RetryRegistry.of(config);
    }

    @Bean
    public Retry accessControlRetry(RetryRegistry retryRegistry) {
        Retry retry = retryRegistry.retry(ACCESS_CONTROL);

        retry.getEventPublisher()
                .onRetry(event ->
                        log.warn("Access-control call retry attempt #{}: {}",
                                event.getNumberOfRetryAttempts(),
                                event.getLastThrowable().getMessage()))
                .onError(event ->
                        log.error("Access-control call failed after {} attempts: {}",
                                event.getNumberOfRetryAttempts(),
                                event.getLastThrowable().getMessage()));

        return retry;
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(requestTimeout)
                .cancelRunningFuture(true)
                .build();
        return TimeLimiterRegistry.of(config);
    }

    @Bean
    public TimeLimiter accessControlTimeLimiter(TimeLimiterRegistry timeLimiterRegistry) {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(ACCESS_CONTROL);

        timeLimiter.getEventPublisher()
                .onTimeout(event -> log.warn("Access-control call timed out after {}", requestTimeout));

        return timeLimiter;
    }
}
