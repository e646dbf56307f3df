package com.voxlink.servicebackend.client;

import java.time.Clock;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces exactly one output block per call from the jitter buffer.
 *
 * <p>Silence while sound is disabled or while the buffer has not reached its pre-fill
 * depth. On an empty buffer the last block is repeated if audio arrived within the
 * concealment window; past that, silence and the pre-fill requirement is re-armed.
 */
public class PlaybackController {
    static final long CONCEALMENT_WINDOW_MS = 120;

    private final JitterBuffer buffer;
    private final Clock clock;

    private final AtomicLong underflows = new AtomicLong();
    private final AtomicLong lastArrivalMillis = new AtomicLong();
    private volatile boolean soundEnabled = true;

    // guarded by this
    private boolean primed = false;
    private byte[] lastBlock;

    public PlaybackController(JitterBuffer buffer, Clock clock) {
        this.buffer = buffer;
        this.clock = clock;
    }

    /**
     * Receive-side hook: queues a frame and records its arrival time.
     */
    public void onFrameArrived(byte[] frame) {
        lastArrivalMillis.set(clock.millis());
        buffer.offer(frame);
    }

    /**
     * Fills {@code out} with the next block. Short frames are padded with silence, long
     * ones truncated.
     */
    public synchronized void fill(byte[] out) {
        if (!soundEnabled) {
            Arrays.fill(out, (byte) 0);
            return;
        }
        if (!primed) {
            if (lastArrivalMillis.get() == 0 || !buffer.isPrefilled()) {
                Arrays.fill(out, (byte) 0);
                return;
            }
            primed = true;
        }

        byte[] frame = buffer.poll();
        if (frame != null) {
            int n = Math.min(frame.length, out.length);
            System.arraycopy(frame, 0, out, 0, n);
            Arrays.fill(out, n, out.length, (byte) 0);
            if (lastBlock == null || lastBlock.length != out.length) {
                lastBlock = new byte[out.length];
            }
            System.arraycopy(out, 0, lastBlock, 0, out.length);
            return;
        }

        underflows.incrementAndGet();
        if (lastBlock != null && lastBlock.length == out.length
                && clock.millis() - lastArrivalMillis.get() < CONCEALMENT_WINDOW_MS) {
            System.arraycopy(lastBlock, 0, out, 0, out.length);
            return;
        }
        Arrays.fill(out, (byte) 0);
        primed = false;
    }

    public void setSoundEnabled(boolean enabled) {
        this.soundEnabled = enabled;
    }

    public boolean isSoundEnabled() {
        return soundEnabled;
    }

    public long underflows() {
        return underflows.get();
    }

    public long lastArrivalMillis() {
        return lastArrivalMillis.get();
    }

    /**
     * Forgets all playback history. Waits for an in-progress {@link #fill(byte[])}.
     */
    public synchronized void reset() {
        buffer.clear();
        underflows.set(0);
        lastArrivalMillis.set(0);
        primed = false;
        lastBlock = null;
        soundEnabled = true;
    }
}
