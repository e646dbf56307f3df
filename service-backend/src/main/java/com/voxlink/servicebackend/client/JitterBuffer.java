package com.voxlink.servicebackend.client;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO between the network receive loop and the playback thread. A full buffer
 * drops its oldest frame to make room, so latency stays bounded under bursts.
 * Neither side ever blocks.
 */
public class JitterBuffer {
    public static final int DEFAULT_CAPACITY = 50;
    public static final int DEFAULT_PREFILL = 2;

    private final ArrayBlockingQueue<byte[]> frames;
    private final int capacity;
    private final int prefillTarget;
    private final AtomicLong overflows = new AtomicLong();

    public JitterBuffer() {
        this(DEFAULT_CAPACITY, DEFAULT_PREFILL);
    }

    public JitterBuffer(int capacity, int prefillTarget) {
        if (capacity <= 0 || prefillTarget < 0 || prefillTarget > capacity) {
            throw new IllegalArgumentException("Invalid jitter buffer sizing: capacity " + capacity
                    + ", prefill " + prefillTarget);
        }
        this.frames = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
        this.prefillTarget = prefillTarget;
    }

    public void offer(byte[] frame) {
        while (!frames.offer(frame)) {
            if (frames.poll() != null) {
                overflows.incrementAndGet();
            }
        }
    }

    /**
     * @return the oldest frame, or null when empty
     */
    public byte[] poll() {
        return frames.poll();
    }

    public boolean isPrefilled() {
        return frames.size() >= prefillTarget;
    }

    public int size() {
        return frames.size();
    }

    public int capacity() {
        return capacity;
    }

    public long overflows() {
        return overflows.get();
    }

    public void clear() {
        frames.clear();
        overflows.set(0);
    }
}
