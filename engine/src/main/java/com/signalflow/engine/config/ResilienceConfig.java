package com.signalflow.engine.config;

import com.signalflow.engine.exception.BrokerUnavailableException;
import com.signalflow.engine.exception.PriceUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public Retry priceOracleRetry(
            @Value("${engine.resilience.oracle.max-attempts:3}") int maxAttempts,
            @Value("${engine.resilience.oracle.base-delay-ms:250}") long baseDelayMs,
            @Value("${engine.resilience.oracle.jitter-factor:0.2}") double jitterFactor
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(Duration.ofMillis(baseDelayMs), 2.0, jitterFactor))
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("price-oracle", config);
    }

    @Bean
    public CircuitBreaker priceOracleCircuitBreaker(
            @Value("${engine.resilience.oracle.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${engine.resilience.oracle.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${engine.resilience.oracle.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .ignoreExceptions(PriceUnavailableException.class)
                .build();
        return CircuitBreaker.of("price-oracle", config);
    }

    @Bean
    public Retry brokerRetry(
            @Value("${engine.resilience.broker.max-attempts:2}") int maxAttempts,
            @Value("${engine.resilience.broker.base-delay-ms:500}") long baseDelayMs
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(baseDelayMs), 2.0))
                .retryExceptions(BrokerUnavailableException.class)
                .build();
        return Retry.of("broker", config);
    }
}
