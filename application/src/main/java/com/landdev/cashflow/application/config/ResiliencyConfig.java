package com.landdev.cashflow.application.config;

import com.landdev.cashflow.domain.exception.ProjectionException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resiliency configuration
 * Circuit breaker around the input providers and the caller-level projection timeout.
 * The projection itself is pure, so nothing is retried.
 */
@Configuration
public class ResiliencyConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }

    /**
     * Circuit breaker for loading project inputs from the data providers
     */
    @Bean("projectDataCircuitBreaker")
    public CircuitBreaker projectDataCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f) // Open after 50% failures
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10) // Last 10 calls
                .minimumNumberOfCalls(5)
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordExceptions(Exception.class)
                // Missing projects and bad records are caller errors, not provider failures
                .ignoreExceptions(ProjectionException.class)
                .build();

        return registry.circuitBreaker("projectData", config);
    }

    /**
     * Time limiter for a projection run; a timed-out run is simply discarded
     */
    @Bean("projectionTimeLimiter")
    public TimeLimiter projectionTimeLimiter(TimeLimiterRegistry registry,
                                             @Value("${app.projection.timeout:PT30S}") Duration timeout) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build();

        return registry.timeLimiter("projection", config);
    }
}
