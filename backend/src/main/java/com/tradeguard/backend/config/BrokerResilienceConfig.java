package com.tradeguard.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class BrokerResilienceConfig {

    @Bean
    public CircuitBreaker brokerCircuitBreaker(
            @Value("${broker.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${broker.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${broker.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreaker.of("broker", config);
    }
}
