package com.voxlink.servicebackend.call;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "voxlink.call")
public record CallProperties(
        Duration staleAfter,
        Duration pruneInterval,
        int eventQueueLimit,
        Duration eventTtl
) {
}
