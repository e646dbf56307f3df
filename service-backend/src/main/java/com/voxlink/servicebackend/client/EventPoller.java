package com.voxlink.servicebackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.voxlink.servicebackend.common.ErrorKind;
import com.voxlink.servicebackend.common.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the event queue once per second and hands each event to a listener. An
 * authentication failure stops polling for good.
 */
public class EventPoller {
    private static final Logger log = LoggerFactory.getLogger(EventPoller.class);

    static final long POLL_INTERVAL_MS = 1000;

    public interface Listener {
        void onEvent(JsonNode event);

        void onSessionLost(ErrorKind reason);
    }

    private final ClientSession session;
    private final Listener listener;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public EventPoller(ClientSession session, Listener listener) {
        this.session = session;
        this.listener = listener;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "event-poller");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::pollOnce, 0, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    void pollOnce() {
        if (!running) {
            return;
        }
        List<JsonNode> events;
        try {
            events = session.pollEvents();
        } catch (ServiceException e) {
            if (e.kind().isAuthFailure()) {
                log.info("Session lost ({}), event polling stopped", e.kind().code());
                running = false;
                if (scheduler != null) {
                    scheduler.shutdown();
                }
                listener.onSessionLost(e.kind());
            } else {
                log.debug("poll_events failed: {}", e.getMessage());
            }
            return;
        } catch (IOException e) {
            log.debug("poll_events transport failure: {}", e.getMessage());
            return;
        }
        for (JsonNode event : events) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed on {}: {}", event.path("type").asText(), e.getMessage(), e);
            }
        }
    }
}
