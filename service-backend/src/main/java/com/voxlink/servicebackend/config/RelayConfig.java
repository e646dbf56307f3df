package com.voxlink.servicebackend.config;

import com.voxlink.servicebackend.relay.ControlRateLimiter;
import com.voxlink.servicebackend.relay.RelayAccessPolicy;
import com.voxlink.servicebackend.relay.RelayProperties;
import com.voxlink.servicebackend.relay.RelayState;
import com.voxlink.servicebackend.relay.VoiceRelayHandler;
import com.voxlink.servicebackend.relay.VoiceRelayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class RelayConfig {
    private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);

    @Bean
    public VoiceRelayHandler voiceRelayHandler(RelayProperties properties,
                                               RelayAccessPolicy accessPolicy,
                                               Clock clock) {
        if (properties.legacyTokenlessJoin() || properties.legacyPairing()) {
            log.warn("Voice relay legacy modes enabled (token-less join: {}, legacy pairing: {})",
                    properties.legacyTokenlessJoin(), properties.legacyPairing());
        }
        return new VoiceRelayHandler(
                new RelayState(),
                new ControlRateLimiter(properties.controlRateLimit(), properties.rateWindow()),
                accessPolicy,
                properties,
                clock);
    }

    @Bean(destroyMethod = "stop")
    public VoiceRelayServer voiceRelayServer(RelayProperties properties, VoiceRelayHandler handler) {
        VoiceRelayServer server = new VoiceRelayServer(properties, handler);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Failed to start voice relay on port {}", properties.port(), e);
            throw new UncheckedIOException("Voice relay initialization failed", e);
        }
        return server;
    }
}
