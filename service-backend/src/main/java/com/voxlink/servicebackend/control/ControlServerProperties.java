package com.voxlink.servicebackend.control;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "voxlink.control")
public record ControlServerProperties(
        @NotBlank String host,
        @PositiveOrZero @Max(65535) int port,   // 0 binds an ephemeral port
        @Positive int workerThreads,
        @Positive int backlog,
        @NotNull Duration readTimeout,
        @NotNull Duration legacyIdleTimeout,
        @Positive int maxFrameBytes,
        boolean legacyRawJson
) {
}
