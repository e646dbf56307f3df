package com.voxlink.servicebackend.client;

import com.voxlink.servicebackend.relay.RelayFrames;
import com.voxlink.servicebackend.relay.RelayPacketType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One voice stream through the relay, either with a single peer or in a channel room.
 *
 * <p>Threads: the device capture and playback threads, a receive thread and a keep-alive
 * scheduler. The audio threads only touch atomics, the detectors and the jitter buffer.
 * The engine is reusable: {@link #stop()} returns it to its initial state.
 */
public class VoiceEngine {
    private static final Logger log = LoggerFactory.getLogger(VoiceEngine.class);

    static final long KEEPALIVE_INTERVAL_MS = 2000;
    static final long PING_INTERVAL_MS = 2000;
    static final long PING_EXPIRY_MS = 5000;

    private final String login;
    private final String token;
    private final InetSocketAddress relay;
    private final AudioIo audioIo;
    private final AudioStreamConfig config;
    private final Clock clock;

    private final JitterBuffer jitterBuffer = new JitterBuffer();
    private final PlaybackController playback;
    private final VoiceActivityDetector micActivity = new VoiceActivityDetector();
    private final VoiceActivityDetector peerActivity = new VoiceActivityDetector();
    private final LinkQualityEstimator quality = new LinkQualityEstimator();

    // ping seq -> send time
    private final ConcurrentHashMap<Long, Long> pendingPings = new ConcurrentHashMap<>();
    private final AtomicLong pingSeq = new AtomicLong();

    private volatile boolean running = false;
    private volatile boolean micEnabled = true;
    private volatile RelayClient relayClient;
    private volatile Target target;

    private Thread receiveThread;
    private ScheduledExecutorService scheduler;
    private AudioIo.Stream captureStream;
    private AudioIo.Stream playbackStream;
    private PlaybackGate playbackGate;
    // bumped on every start so a late capture callback from an older stream is ignored
    private volatile long generation;

    public VoiceEngine(String login, String token, InetSocketAddress relay, AudioIo audioIo, Clock clock) {
        this(login, token, relay, audioIo, AudioStreamConfig.createDefault(), clock);
    }

    public VoiceEngine(String login,
                       String token,
                       InetSocketAddress relay,
                       AudioIo audioIo,
                       AudioStreamConfig config,
                       Clock clock) {
        this.login = login;
        this.token = token;
        this.relay = relay;
        this.audioIo = audioIo;
        this.config = config;
        this.clock = clock;
        this.playback = new PlaybackController(jitterBuffer, clock);
    }

    /**
     * Starts a one-to-one stream. The relay only forwards once both sides have an active
     * call and have announced the pair.
     */
    public synchronized void startPeer(String peer) throws IOException {
        start(new Target(peer, 0L));
    }

    public synchronized void startRoom(long roomId) throws IOException {
        start(new Target(null, roomId));
    }

    private void start(Target next) throws IOException {
        if (running) {
            log.warn("Voice stream already running for {}", target);
            return;
        }
        RelayClient client = new RelayClient(relay);
        relayClient = client;
        target = next;
        running = true;

        announce(client, next);

        receiveThread = new Thread(this::receiveLoop, "voice-receive");
        receiveThread.setDaemon(true);
        receiveThread.start();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "voice-keepalive");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::keepAlive, KEEPALIVE_INTERVAL_MS, KEEPALIVE_INTERVAL_MS, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::sendPing, 0, PING_INTERVAL_MS, TimeUnit.MILLISECONDS);

        long current = ++generation;
        playbackGate = new PlaybackGate(playback);
        try {
            captureStream = audioIo.startCapture(config, (pcm, length) -> {
                if (generation == current) {
                    onCapturedFrame(pcm, length);
                }
            });
            playbackStream = audioIo.startPlayback(config, playbackGate);
        } catch (IOException e) {
            stop();
            throw e;
        }
        log.info("Voice stream started for '{}' ({}) via {}", login, next, relay);
    }

    /**
     * Clears the pairing or leaves the room, then releases every resource. Safe to call
     * repeatedly and from any thread.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        RelayClient client = relayClient;
        Target current = target;
        if (client != null && current != null) {
            if (current.isRoom()) {
                client.leaveRoom(login, current.roomId());
            } else {
                client.setPair(login, token, current.peer(), false);
            }
        }

        if (captureStream != null) {
            captureStream.stop();
        }
        if (playbackStream != null) {
            playbackStream.stop();
        }
        if (playbackGate != null) {
            playbackGate.close();
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (client != null) {
            client.close();
        }
        if (receiveThread != null) {
            try {
                receiveThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        captureStream = null;
        playbackStream = null;
        playbackGate = null;
        scheduler = null;
        receiveThread = null;
        relayClient = null;
        target = null;

        playback.reset();
        micEnabled = true;
        micActivity.reset();
        peerActivity.reset();
        quality.reset();
        pendingPings.clear();
        log.info("Voice stream stopped for '{}'", login);
    }

    /**
     * Capture callback: meters the block and, with the mic on, sends it as one datagram.
     */
    public void onCapturedFrame(byte[] pcm, int length) {
        if (!running) {
            return;
        }
        micActivity.onBlock(pcm, 0, length, clock.millis());
        if (!micEnabled) {
            return;
        }
        RelayClient client = relayClient;
        if (client != null) {
            client.sendAudio(login, pcm, length);
        }
    }

    public ActivitySnapshot getActivity() {
        long now = clock.millis();
        double score = quality.score();
        return new ActivitySnapshot(
                micActivity.level(),
                peerActivity.level(),
                micEnabled && micActivity.isSpeaking(now),
                playback.isSoundEnabled() && peerActivity.isSpeaking(now),
                quality.latencyMs(),
                quality.jitterMs(),
                quality.lossScore(),
                score,
                QualityLevel.of(score));
    }

    public boolean isSpeaking() {
        return micEnabled && micActivity.isSpeaking(clock.millis());
    }

    public void setMicEnabled(boolean enabled) {
        this.micEnabled = enabled;
    }

    public boolean isMicEnabled() {
        return micEnabled;
    }

    public void setSoundEnabled(boolean enabled) {
        playback.setSoundEnabled(enabled);
    }

    public boolean isSoundEnabled() {
        return playback.isSoundEnabled();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return the local UDP port, or -1 when stopped
     */
    public int getLocalPort() {
        RelayClient client = relayClient;
        return client == null ? -1 : client.getLocalPort();
    }

    int bufferedFrames() {
        return jitterBuffer.size();
    }

    int pendingPingCount() {
        return pendingPings.size();
    }

    void handleDatagram(byte[] data, int length) {
        RelayPacketType type = RelayPacketType.of(data, length);
        if (type == null) {
            return;
        }
        switch (type) {
            case PONG -> onPong(data, length);
            case RELAYED_AUDIO -> onRelayedAudio(data, length);
            default -> log.debug("Ignoring {} datagram from relay", type);
        }
    }

    void keepAlive() {
        RelayClient client = relayClient;
        Target current = target;
        if (running && client != null && current != null) {
            announce(client, current);
        }
    }

    void sendPing() {
        RelayClient client = relayClient;
        if (!running || client == null) {
            return;
        }
        long now = clock.millis();
        long seq = pingSeq.getAndIncrement();
        pendingPings.put(seq, now);
        client.ping(seq, now);
        pendingPings.values().removeIf(sentAt -> now - sentAt > PING_EXPIRY_MS);
    }

    private void announce(RelayClient client, Target current) {
        client.join(login, token);
        if (current.isRoom()) {
            client.joinRoom(login, token, current.roomId());
        } else {
            client.setPair(login, token, current.peer(), true);
        }
    }

    private void receiveLoop() {
        byte[] buffer = new byte[RelayClient.MAX_DATAGRAM_BYTES];
        while (running) {
            RelayClient client = relayClient;
            if (client == null) {
                break;
            }
            int length = client.receive(buffer);
            if (length < 0) {
                break;
            }
            if (length == 0) {
                continue;
            }
            try {
                handleDatagram(buffer, length);
            } catch (RuntimeException e) {
                log.debug("Bad datagram from relay: {}", e.getMessage());
            }
        }
    }

    private void onPong(byte[] data, int length) {
        List<String> fields = RelayFrames.textFields(data, length);
        long seq;
        try {
            seq = Long.parseLong(fields.get(0));
        } catch (NumberFormatException e) {
            return;
        }
        Long sentAt = pendingPings.remove(seq);
        if (sentAt != null) {
            quality.onRoundTrip(clock.millis() - sentAt);
        }
    }

    private void onRelayedAudio(byte[] data, int length) {
        int sep = RelayFrames.indexOf(data, length, RelayPacketType.SEPARATOR, 2);
        if (sep < 0) {
            return;
        }
        byte[] pcm = Arrays.copyOfRange(data, sep + 1, length);
        long now = clock.millis();
        quality.onArrival(now, playback.underflows(), jitterBuffer.overflows());
        peerActivity.onBlock(pcm, 0, pcm.length, now);
        playback.onFrameArrived(pcm);
    }

    /**
     * The playback source of one stream. Once closed it yields silence, so a device thread
     * that outlives {@link #stop()} cannot touch the controller again.
     */
    private static final class PlaybackGate implements AudioIo.FrameSource {
        private final PlaybackController controller;
        // guarded by controller
        private boolean open = true;

        PlaybackGate(PlaybackController controller) {
            this.controller = controller;
        }

        @Override
        public void fill(byte[] out) {
            synchronized (controller) {
                if (open) {
                    controller.fill(out);
                } else {
                    Arrays.fill(out, (byte) 0);
                }
            }
        }

        void close() {
            synchronized (controller) {
                open = false;
            }
        }
    }

    private record Target(String peer, long roomId) {
        boolean isRoom() {
            return peer == null;
        }

        @Override
        public String toString() {
            return isRoom() ? "room " + roomId : "peer '" + peer + "'";
        }
    }
}
