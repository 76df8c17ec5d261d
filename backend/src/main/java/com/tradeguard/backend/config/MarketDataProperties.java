package com.tradeguard.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "market-data")
@Data
@Validated
public class MarketDataProperties {

    @Positive
    private long healthCheckIntervalMs = 5000;

    /** Consecutive failed health probes tolerated before the feed is marked stale. */
    @Min(0)
    private int errorBudget = 5;
}
