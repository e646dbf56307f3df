package com.voxlink.servicebackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voxlink.servicebackend.control.ControlAction;
import com.voxlink.servicebackend.control.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sends one control request per TCP connection. Transport failures are retried with
 * exponential backoff plus jitter, but only for actions marked idempotent; everything
 * else is attempted exactly once.
 */
public class ControlClient {
    private static final Logger log = LoggerFactory.getLogger(ControlClient.class);

    static final int MAX_RESPONSE_BYTES = 10_000_000;

    private final InetSocketAddress server;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final int maxAttempts;
    private final long baseBackoffMillis;

    public ControlClient(InetSocketAddress server, ObjectMapper objectMapper) {
        this(server, objectMapper, Duration.ofSeconds(3), Duration.ofSeconds(5), 3, 150);
    }

    public ControlClient(InetSocketAddress server,
                         ObjectMapper objectMapper,
                         Duration connectTimeout,
                         Duration readTimeout,
                         int maxAttempts,
                         long baseBackoffMillis) {
        this.server = server;
        this.objectMapper = objectMapper;
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMillis = baseBackoffMillis;
    }

    /**
     * @param token  session token, or null for unauthenticated actions
     * @param fields extra request fields, serialized with the client's ObjectMapper
     * @return the parsed response, which may carry {@code "status":"error"}
     * @throws IOException when every permitted attempt failed at the transport level
     */
    public JsonNode send(ControlAction action, String token, Map<String, ?> fields) throws IOException {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("action", action.wireName());
        if (token != null) {
            request.put("token", token);
        }
        fields.forEach((name, value) -> request.set(name, objectMapper.valueToTree(value)));
        byte[] body = objectMapper.writeValueAsBytes(request);

        int attempts = action.idempotent() ? maxAttempts : 1;
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1) {
                backoff(attempt);
            }
            try {
                return exchange(body);
            } catch (InterruptedIOException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                lastFailure = e;
            } catch (IOException e) {
                lastFailure = e;
            }
            log.debug("{} attempt {}/{} failed: {}", action.wireName(), attempt, attempts, lastFailure.getMessage());
        }
        throw lastFailure;
    }

    public JsonNode send(ControlAction action, String token) throws IOException {
        return send(action, token, Map.of());
    }

    private JsonNode exchange(byte[] body) throws IOException {
        try (Socket socket = new Socket()) {
            socket.connect(server, (int) connectTimeout.toMillis());
            socket.setSoTimeout((int) readTimeout.toMillis());
            FrameCodec.writeFrame(socket.getOutputStream(), body);
            byte[] response = FrameCodec.readFrame(socket.getInputStream(), MAX_RESPONSE_BYTES);
            return objectMapper.readTree(response);
        }
    }

    private void backoff(int attempt) throws InterruptedIOException {
        long delay = baseBackoffMillis << (attempt - 2);
        delay += ThreadLocalRandom.current().nextLong(delay / 2 + 1);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while backing off");
        }
    }
}
