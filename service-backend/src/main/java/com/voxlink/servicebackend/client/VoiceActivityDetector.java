package com.voxlink.servicebackend.client;

/**
 * Level meter with a hold time: speaking stays true for {@link #HOLD_MS} after the last
 * block at or above the threshold.
 */
public class VoiceActivityDetector {
    public static final double DEFAULT_THRESHOLD = 0.015;
    public static final long HOLD_MS = 350;

    private final double threshold;

    private volatile double level;
    private volatile long lastVoiceMillis;

    public VoiceActivityDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public VoiceActivityDetector(double threshold) {
        this.threshold = threshold;
    }

    /**
     * RMS of 16-bit little-endian samples, normalized to [0, 1].
     */
    public static double rms(byte[] pcm, int offset, int length) {
        int samples = length / 2;
        if (samples == 0) {
            return 0.0;
        }
        double sum = 0;
        for (int i = 0; i < samples; i++) {
            int idx = offset + i * 2;
            short sample = (short) ((pcm[idx] & 0xff) | (pcm[idx + 1] << 8));
            double normalized = sample / 32768.0;
            sum += normalized * normalized;
        }
        return Math.sqrt(sum / samples);
    }

    public void onBlock(byte[] pcm, int offset, int length, long nowMillis) {
        double value = rms(pcm, offset, length);
        level = value;
        if (value >= threshold) {
            lastVoiceMillis = nowMillis;
        }
    }

    public boolean isSpeaking(long nowMillis) {
        long last = lastVoiceMillis;
        return last > 0 && nowMillis - last < HOLD_MS;
    }

    public double level() {
        return level;
    }

    public void reset() {
        level = 0.0;
        lastVoiceMillis = 0;
    }
}
