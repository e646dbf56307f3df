package com.voxlink.servicebackend.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class VoiceEngineTest {
    private DatagramSocket relay;
    private VoiceEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        relay = new DatagramSocket(0, InetAddress.getLoopbackAddress());
        relay.setSoTimeout(3000);
        engine = new VoiceEngine("alice", "tok-alice",
                new InetSocketAddress(InetAddress.getLoopbackAddress(), relay.getLocalPort()),
                new SilentAudioIo(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        engine.stop();
        relay.close();
    }

    @Test
    void peerStreamAnnouncesJoinAndPairThenClearsPairOnStop() throws IOException {
        engine.startPeer("bob");

        assertEquals("J|alice|tok-alice", receiveText("J|"));
        assertEquals("S|alice|tok-alice|alice|bob|1", receiveText("S|"));

        engine.stop();

        assertEquals("S|alice|tok-alice|alice|bob|0", receiveText("S|"));
        assertFalse(engine.isRunning());
        assertEquals(-1, engine.getLocalPort());
    }

    @Test
    void roomStreamJoinsAndLeavesTheRoom() throws IOException {
        engine.startRoom(42);

        assertEquals("C|alice|tok-alice|42", receiveText("C|"));
        engine.stop();
        assertEquals("L|alice|42", receiveText("L|"));
    }

    @Test
    void capturedBlocksAreSentAsAudioDatagrams() throws IOException {
        engine.startPeer("bob");
        byte[] pcm = {1, 2, 3, 4, 5, 6};

        engine.onCapturedFrame(pcm, pcm.length);

        byte[] datagram = receive("A|");
        byte[] head = "A|alice|".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(head, Arrays.copyOf(datagram, head.length));
        assertArrayEquals(pcm, Arrays.copyOfRange(datagram, head.length, datagram.length));
    }

    @Test
    void relayedAudioLandsInTheJitterBuffer() throws IOException {
        engine.startPeer("bob");
        receive("J|");
        byte[] relayed = withTail("R|bob|", new byte[640]);

        relay.send(new DatagramPacket(relayed, relayed.length,
                new InetSocketAddress(InetAddress.getLoopbackAddress(), engine.getLocalPort())));

        awaitTrue(() -> engine.bufferedFrames() == 1);
    }

    @Test
    void echoedPingResolvesPendingPing() throws IOException {
        engine.startPeer("bob");
        byte[] ping = receive("P|");
        assertEquals(1, engine.pendingPingCount());

        byte[] pong = ping.clone();
        pong[0] = 'Q';
        relay.send(new DatagramPacket(pong, pong.length,
                new InetSocketAddress(InetAddress.getLoopbackAddress(), engine.getLocalPort())));

        awaitTrue(() -> engine.pendingPingCount() == 0);
    }

    @Test
    void malformedDatagramsAreIgnored() throws IOException {
        engine.startPeer("bob");
        String[] junk = {"Q|notanumber|1", "R|nosep", "R|", "X|1", "A|bob|123"};
        for (String datagram : junk) {
            byte[] data = datagram.getBytes(StandardCharsets.UTF_8);
            assertDoesNotThrow(() -> engine.handleDatagram(data, data.length));
        }
        assertEquals(0, engine.bufferedFrames());
    }

    @Test
    void stopIsIdempotentAndResetsToggles() throws IOException {
        engine.startPeer("bob");
        engine.setMicEnabled(false);
        engine.setSoundEnabled(false);

        engine.stop();
        engine.stop();
        engine.onCapturedFrame(new byte[640], 640);

        assertTrue(engine.isMicEnabled());
        assertTrue(engine.isSoundEnabled());
        assertEquals(0, engine.pendingPingCount());
        assertEquals(0.0, engine.getActivity().latencyMs(), 1e-9);
    }

    @Test
    void mutedMicReportsNotSpeaking() throws IOException {
        engine.startPeer("bob");
        byte[] loud = new byte[640];
        for (int i = 1; i < loud.length; i += 2) {
            loud[i] = 0x20;
        }
        engine.onCapturedFrame(loud, loud.length);
        assertTrue(engine.getActivity().meSpeaking());

        engine.setMicEnabled(false);
        assertFalse(engine.getActivity().meSpeaking());
        assertFalse(engine.isSpeaking());
    }

    @Test
    void stopWaitsForAPlaybackCallbackStillInProgress() throws Exception {
        BlockingClock clock = new BlockingClock("test-playback");
        RecordingAudioIo audio = new RecordingAudioIo();
        VoiceEngine gated = newEngine(audio, clock);
        try {
            gated.startPeer("bob");
            AudioIo.FrameSource source = audio.sources.get(0);
            deliver(gated, 2);
            byte[] out = new byte[640];
            source.fill(out);
            source.fill(out);
            assertEquals(0, gated.bufferedFrames());

            // the next pull underflows and reads the clock while inside fill
            clock.arm();
            AtomicReference<Throwable> playbackError = new AtomicReference<>();
            Thread playbackThread = new Thread(() -> {
                try {
                    source.fill(new byte[640]);
                } catch (Throwable t) {
                    playbackError.set(t);
                }
            }, "test-playback");
            playbackThread.start();
            assertTrue(clock.awaitBlocked());

            Thread stopper = new Thread(gated::stop, "test-stopper");
            stopper.start();
            stopper.join(300);
            assertTrue(stopper.isAlive());

            clock.release();
            playbackThread.join(3000);
            stopper.join(3000);
            assertFalse(stopper.isAlive());
            assertFalse(gated.isRunning());
            assertEquals(null, playbackError.get());

            byte[] after = new byte[640];
            Arrays.fill(after, (byte) 1);
            source.fill(after);
            assertArrayEquals(new byte[640], after);
        } finally {
            clock.release();
            gated.stop();
        }
    }

    @Test
    void staleDeviceThreadCannotDrainTheNextStream() throws IOException {
        RecordingAudioIo audio = new RecordingAudioIo();
        VoiceEngine restarted = newEngine(audio, Clock.systemUTC());
        try {
            restarted.startPeer("bob");
            AudioIo.FrameSource oldSource = audio.sources.get(0);
            AudioIo.FrameSink oldSink = audio.sinks.get(0);
            restarted.stop();
            restarted.startPeer("bob");
            AudioIo.FrameSource newSource = audio.sources.get(1);

            deliver(restarted, 3);
            byte[] stale = new byte[640];
            oldSource.fill(stale);
            assertArrayEquals(new byte[640], stale);
            assertEquals(3, restarted.bufferedFrames());

            byte[] loud = new byte[640];
            Arrays.fill(loud, (byte) 0x40);
            oldSink.onFrame(loud, loud.length);
            assertFalse(restarted.isSpeaking());

            byte[] fresh = new byte[640];
            newSource.fill(fresh);
            assertEquals(5, fresh[0]);
            assertEquals(2, restarted.bufferedFrames());
        } finally {
            restarted.stop();
        }
    }

    private VoiceEngine newEngine(AudioIo audio, Clock clock) {
        return new VoiceEngine("alice", "tok-alice",
                new InetSocketAddress(InetAddress.getLoopbackAddress(), relay.getLocalPort()), audio, clock);
    }

    private static void deliver(VoiceEngine target, int frames) {
        byte[] pcm = new byte[640];
        Arrays.fill(pcm, (byte) 5);
        byte[] relayed = withTail("R|bob|", pcm);
        for (int i = 0; i < frames; i++) {
            target.handleDatagram(relayed, relayed.length);
        }
    }

    private String receiveText(String prefix) throws IOException {
        return new String(receive(prefix), StandardCharsets.UTF_8);
    }

    // skips pings and keep-alives that do not match
    private byte[] receive(String prefix) throws IOException {
        byte[] buffer = new byte[8192];
        long deadline = System.currentTimeMillis() + 3000;
        while (System.currentTimeMillis() < deadline) {
            DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
            try {
                relay.receive(packet);
            } catch (SocketTimeoutException e) {
                break;
            }
            byte[] data = Arrays.copyOf(packet.getData(), packet.getLength());
            if (new String(data, StandardCharsets.UTF_8).startsWith(prefix)) {
                return data;
            }
        }
        return fail("No " + prefix + " datagram received");
    }

    private static byte[] withTail(String head, byte[] tail) {
        byte[] headBytes = head.getBytes(StandardCharsets.UTF_8);
        byte[] out = Arrays.copyOf(headBytes, headBytes.length + tail.length);
        System.arraycopy(tail, 0, out, headBytes.length, tail.length);
        return out;
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 3000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        fail("Condition not met in time");
    }

    // streams whose stop() returns without waiting, like a wedged device thread
    private static class RecordingAudioIo implements AudioIo {
        final List<FrameSource> sources = new ArrayList<>();
        final List<FrameSink> sinks = new ArrayList<>();

        @Override
        public Stream startCapture(AudioStreamConfig config, FrameSink sink) {
            sinks.add(sink);
            return () -> {
            };
        }

        @Override
        public Stream startPlayback(AudioStreamConfig config, FrameSource source) {
            sources.add(source);
            return () -> {
            };
        }
    }

    // blocks millis() on one named thread once armed
    private static class BlockingClock extends Clock {
        private final String blockedThread;
        private final CountDownLatch blocked = new CountDownLatch(1);
        private final CountDownLatch released = new CountDownLatch(1);
        private volatile boolean armed = false;

        BlockingClock(String blockedThread) {
            this.blockedThread = blockedThread;
        }

        void arm() {
            armed = true;
        }

        void release() {
            released.countDown();
        }

        boolean awaitBlocked() throws InterruptedException {
            return blocked.await(3, TimeUnit.SECONDS);
        }

        @Override
        public long millis() {
            if (armed && Thread.currentThread().getName().equals(blockedThread)) {
                blocked.countDown();
                try {
                    released.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return System.currentTimeMillis();
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis());
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }

    private static class SilentAudioIo implements AudioIo {
        @Override
        public Stream startCapture(AudioStreamConfig config, FrameSink sink) {
            return () -> {
            };
        }

        @Override
        public Stream startPlayback(AudioStreamConfig config, FrameSource source) {
            return () -> {
            };
        }
    }
}
