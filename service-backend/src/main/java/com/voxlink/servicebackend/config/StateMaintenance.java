package com.voxlink.servicebackend.config;

import com.voxlink.servicebackend.call.CallProperties;
import com.voxlink.servicebackend.call.CallSignalingEngine;
import com.voxlink.servicebackend.event.EventOutbox;
import com.voxlink.servicebackend.session.SessionManager;
import com.voxlink.servicebackend.session.SessionProperties;
import com.voxlink.servicebackend.voice.VoicePresenceProperties;
import com.voxlink.servicebackend.voice.VoicePresenceService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic cleanup that does not wait for traffic: stale calls, expired voice leases,
 * expired events and expired sessions.
 */
@Component
public class StateMaintenance {
    private static final Logger log = LoggerFactory.getLogger(StateMaintenance.class);

    private final SessionManager sessions;
    private final CallSignalingEngine calls;
    private final EventOutbox outbox;
    private final VoicePresenceService voicePresence;
    private final SessionProperties sessionProperties;
    private final CallProperties callProperties;
    private final VoicePresenceProperties voicePresenceProperties;

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1, r -> {
        Thread t = new Thread(r, "state-maintenance");
        t.setDaemon(true);
        return t;
    });

    public StateMaintenance(SessionManager sessions,
                            CallSignalingEngine calls,
                            EventOutbox outbox,
                            VoicePresenceService voicePresence,
                            SessionProperties sessionProperties,
                            CallProperties callProperties,
                            VoicePresenceProperties voicePresenceProperties) {
        this.sessions = sessions;
        this.calls = calls;
        this.outbox = outbox;
        this.voicePresence = voicePresence;
        this.sessionProperties = sessionProperties;
        this.callProperties = callProperties;
        this.voicePresenceProperties = voicePresenceProperties;
    }

    @PostConstruct
    public void start() {
        schedule("call prune", callProperties.pruneInterval(), () -> {
            calls.pruneStale();
            outbox.pruneExpired();
        });
        schedule("voice presence sweep", voicePresenceProperties.sweepInterval(), voicePresence::sweep);
        schedule("session purge", sessionProperties.purgeInterval(), sessions::purgeExpired);
        log.info("State maintenance scheduled");
    }

    @PreDestroy
    public void stop() {
        scheduler.shutdownNow();
    }

    private void schedule(String name, Duration interval, Runnable task) {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Maintenance task '{}' failed", name, e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }
}
