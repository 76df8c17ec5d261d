package com.tradeguard.backend.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "audit")
@Data
@Validated
public class AuditProperties {

    @NotBlank
    private String environment = "development";

    @NotBlank
    private String commitHash = "unknown";

    private boolean wormMode = true;

    /** Upper bound for a single best-effort audit write. */
    @NotNull
    private Duration writeTimeout = Duration.ofSeconds(2);

    @NotNull
    private Duration quoteMaxAge = Duration.ofSeconds(5);
}
