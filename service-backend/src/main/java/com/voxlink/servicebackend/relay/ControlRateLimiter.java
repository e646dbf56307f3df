package com.voxlink.servicebackend.relay;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Sliding-window limit per (sender address, packet type).
 */
public class ControlRateLimiter {
    private final int limit;
    private final Duration window;

    private final Map<Key, Deque<Instant>> hits = new HashMap<>();

    public ControlRateLimiter(int limit, Duration window) {
        this.limit = limit;
        this.window = window;
    }

    public synchronized boolean tryAcquire(InetSocketAddress sender, RelayPacketType type, Instant now) {
        Instant cutoff = now.minus(window);
        Deque<Instant> recent = hits.computeIfAbsent(new Key(sender, type), k -> new ArrayDeque<>());
        while (!recent.isEmpty() && !recent.peekFirst().isAfter(cutoff)) {
            recent.pollFirst();
        }
        if (recent.size() >= limit) {
            return false;
        }
        recent.addLast(now);
        return true;
    }

    /**
     * Forgets senders with no hit inside the window.
     */
    public synchronized void prune(Instant now) {
        Instant cutoff = now.minus(window);
        hits.values().removeIf(recent -> recent.isEmpty() || !recent.peekLast().isAfter(cutoff));
    }

    public synchronized int trackedKeys() {
        return hits.size();
    }

    private record Key(InetSocketAddress sender, RelayPacketType type) {
    }
}
