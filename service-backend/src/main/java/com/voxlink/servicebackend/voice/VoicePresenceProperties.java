package com.voxlink.servicebackend.voice;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "voxlink.voice-presence")
public record VoicePresenceProperties(
        Duration ttl,
        Duration sweepInterval
) {
}
