package com.voxlink.servicebackend.web;

import com.voxlink.servicebackend.call.CallSignalingEngine;
import com.voxlink.servicebackend.control.ControlServer;
import com.voxlink.servicebackend.relay.VoiceRelayHandler;
import com.voxlink.servicebackend.relay.VoiceRelayServer;
import com.voxlink.servicebackend.voice.VoicePresenceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness of the control server and the voice relay, with their counters.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {
    private final ControlServer controlServer;
    private final VoiceRelayServer relayServer;
    private final CallSignalingEngine calls;
    private final VoicePresenceService voicePresence;

    public HealthController(ControlServer controlServer,
                            VoiceRelayServer relayServer,
                            CallSignalingEngine calls,
                            VoicePresenceService voicePresence) {
        this.controlServer = controlServer;
        this.relayServer = relayServer;
        this.calls = calls;
        this.voicePresence = voicePresence;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        boolean up = controlServer.isRunning() && relayServer.isRunning();
        VoiceRelayHandler relay = relayServer.handler();

        Map<String, Object> control = new LinkedHashMap<>();
        control.put("port", controlServer.getLocalPort());
        control.put("requests", controlServer.getRequestsHandled());
        control.put("callPairs", calls.pairCount());
        control.put("voiceLeases", voicePresence.activeLeaseCount());

        Map<String, Object> relayStats = new LinkedHashMap<>();
        relayStats.put("port", relayServer.getLocalPort());
        relayStats.put("endpoints", relay.state().endpointCount());
        relayStats.put("rooms", relay.state().roomCount());
        relayStats.put("received", relay.getReceived());
        relayStats.put("forwarded", relay.getForwarded());
        relayStats.put("dropped", relay.getDropped());
        relayStats.put("rateLimited", relay.getRateLimited());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", up ? "UP" : "DOWN");
        body.put("control", control);
        body.put("relay", relayStats);
        return ResponseEntity.ok(body);
    }
}
