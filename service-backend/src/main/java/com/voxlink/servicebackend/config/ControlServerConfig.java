package com.voxlink.servicebackend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voxlink.servicebackend.control.ControlRequestDispatcher;
import com.voxlink.servicebackend.control.ControlServer;
import com.voxlink.servicebackend.control.ControlServerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;

@Configuration
@EnableConfigurationProperties(ControlServerProperties.class)
public class ControlServerConfig {
    private static final Logger log = LoggerFactory.getLogger(ControlServerConfig.class);

    @Bean(destroyMethod = "stop")
    public ControlServer controlServer(ControlServerProperties properties,
                                       ControlRequestDispatcher dispatcher,
                                       ObjectMapper objectMapper) {
        if (properties.legacyRawJson()) {
            log.warn("Control server accepts unframed legacy JSON requests");
        }
        ControlServer server = new ControlServer(properties, dispatcher, objectMapper);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Failed to start control server on port {}", properties.port(), e);
            throw new UncheckedIOException("Control server initialization failed", e);
        }
        return server;
    }
}
