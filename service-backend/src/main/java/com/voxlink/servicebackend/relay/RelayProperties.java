package com.voxlink.servicebackend.relay;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "voxlink.relay")
public record RelayProperties(
        @NotBlank String host,
        @PositiveOrZero @Max(65535) int port,
        @Positive int maxDatagramBytes,
        @NotNull Duration endpointTtl,
        @NotNull Duration sweepInterval,
        @Positive int controlRateLimit,
        @NotNull Duration rateWindow,
        boolean legacyTokenlessJoin,
        boolean legacyPairing
) {
}
