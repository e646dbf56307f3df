package com.voxlink.servicebackend.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-login event queues delivered by drain-on-read polling.
 *
 * <p>Each queue holds at most {@code limit} events; pushing onto a full queue drops the
 * oldest one. Events older than {@code ttl} are discarded at drain time and by
 * {@link #pruneExpired()}. There is no replay and no acknowledgement.
 */
public class EventOutbox {
    private static final Logger log = LoggerFactory.getLogger(EventOutbox.class);

    private final int limit;
    private final Duration ttl;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, Deque<PendingEvent>> queues = new HashMap<>();

    public EventOutbox(int limit, Duration ttl, Clock clock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Event queue limit must be positive");
        }
        this.limit = limit;
        this.ttl = ttl;
        this.clock = clock;
    }

    public void push(String login, EventType type, Map<String, String> payload) {
        if (login == null || login.isBlank()) {
            return;
        }
        PendingEvent event = new PendingEvent(type, payload, clock.instant());
        synchronized (lock) {
            Deque<PendingEvent> queue = queues.computeIfAbsent(login, k -> new ArrayDeque<>());
            if (queue.size() >= limit) {
                queue.pollFirst();
                log.debug("Event queue of '{}' is full, dropped oldest event", login);
            }
            queue.addLast(event);
        }
        log.debug("Queued {} for '{}'", type.wireName(), login);
    }

    /**
     * Returns and removes every live event of {@code login}, oldest first.
     */
    public List<PendingEvent> drain(String login) {
        Instant cutoff = clock.instant().minus(ttl);
        Deque<PendingEvent> queue;
        synchronized (lock) {
            queue = queues.remove(login);
        }
        if (queue == null) {
            return List.of();
        }
        List<PendingEvent> live = new ArrayList<>(queue.size());
        for (PendingEvent event : queue) {
            if (!event.ts().isBefore(cutoff)) {
                live.add(event);
            }
        }
        return live;
    }

    public int pruneExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        int removed = 0;
        synchronized (lock) {
            var it = queues.values().iterator();
            while (it.hasNext()) {
                Deque<PendingEvent> queue = it.next();
                int before = queue.size();
                queue.removeIf(event -> event.ts().isBefore(cutoff));
                removed += before - queue.size();
                if (queue.isEmpty()) {
                    it.remove();
                }
            }
        }
        return removed;
    }

    public int pendingCount(String login) {
        synchronized (lock) {
            Deque<PendingEvent> queue = queues.get(login);
            return queue == null ? 0 : queue.size();
        }
    }
}
