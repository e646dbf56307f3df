package com.voxlink.servicebackend.session;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "voxlink.session")
public record SessionProperties(
        Duration ttl,
        Duration onlineWindow,
        Duration touchMinInterval,
        Duration purgeInterval
) {
}
