package com.voxlink.servicebackend.client;

import com.voxlink.servicebackend.common.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Keeps a channel voice lease alive: refreshes presence with the current speaking flag
 * every {@link #REFRESH_INTERVAL_MS} and leaves the channel on stop.
 */
public class ChannelVoiceLease {
    private static final Logger log = LoggerFactory.getLogger(ChannelVoiceLease.class);

    static final long REFRESH_INTERVAL_MS = 1200;
    static final long STOP_TIMEOUT_MS = 5000;

    private final ClientSession session;
    private final long channelId;
    private final BooleanSupplier speaking;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public ChannelVoiceLease(ClientSession session, long channelId, BooleanSupplier speaking) {
        this.session = session;
        this.channelId = channelId;
        this.speaking = speaking;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "voice-lease-" + channelId);
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refresh, 0, REFRESH_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        // a refresh already on the wire must land before the leave
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Voice presence refresh for channel {} still running at stop", channelId);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            session.leaveChannelVoice(channelId);
        } catch (IOException | ServiceException e) {
            log.warn("Failed to leave voice in channel {}: {}", channelId, e.getMessage());
        }
    }

    public boolean isRunning() {
        return running;
    }

    void refresh() {
        if (!running) {
            return;
        }
        try {
            session.setChannelVoicePresence(channelId, speaking.getAsBoolean());
        } catch (IOException | ServiceException e) {
            // the server lease outlives a few missed refreshes
            log.debug("Voice presence refresh for channel {} failed: {}", channelId, e.getMessage());
        }
    }
}
