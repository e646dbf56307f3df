package com.voxlink.servicebackend.client;

/**
 * Rolling link estimates from packet inter-arrival gaps, ping round trips and
 * jitter-buffer trouble. Used for display only.
 *
 * <p>Score: {@code 100 - (1.5*jitter + 0.6*max(0, latency - 60) + 0.8*loss +
 * underflowScore + overflowScore)}, clamped to [0, 100]. The underflow and overflow
 * scores decay by 5% per arrival and grow by 2 per new event, capped at 25.
 */
public class LinkQualityEstimator {
    static final double NOMINAL_GAP_MS = 20.0;
    static final double BUFFER_SCORE_CAP = 25.0;

    private double jitterMs = 0.0;
    private double avgGapMs = NOMINAL_GAP_MS;
    private double lossScore = 0.0;
    private double latencyMs = 0.0;
    private long lastArrivalMillis = 0;

    private double underflowScore = 0.0;
    private double overflowScore = 0.0;
    private long seenUnderflows = 0;
    private long seenOverflows = 0;

    /**
     * @param underflows cumulative playback underflow count
     * @param overflows  cumulative jitter buffer overflow count
     */
    public synchronized void onArrival(long nowMillis, long underflows, long overflows) {
        if (lastArrivalMillis > 0) {
            double gap = nowMillis - lastArrivalMillis;
            avgGapMs = 0.95 * avgGapMs + 0.05 * gap;
            jitterMs = 0.9 * jitterMs + 0.1 * Math.abs(gap - NOMINAL_GAP_MS);
            double miss = Math.max(0.0, (gap - 35.0) / 20.0);
            lossScore = Math.min(100.0, 0.9 * lossScore + 10.0 * miss);
        }
        lastArrivalMillis = nowMillis;

        underflowScore = Math.min(BUFFER_SCORE_CAP,
                0.95 * underflowScore + 2.0 * Math.max(0, underflows - seenUnderflows));
        overflowScore = Math.min(BUFFER_SCORE_CAP,
                0.95 * overflowScore + 2.0 * Math.max(0, overflows - seenOverflows));
        seenUnderflows = underflows;
        seenOverflows = overflows;
    }

    public synchronized void onRoundTrip(double rttMs) {
        latencyMs = Math.max(0.0, rttMs);
    }

    public synchronized double score() {
        double penalty = jitterMs * 1.5
                + Math.max(0.0, latencyMs - 60.0) * 0.6
                + lossScore * 0.8
                + underflowScore
                + overflowScore;
        return Math.max(0.0, Math.min(100.0, 100.0 - penalty));
    }

    public synchronized double jitterMs() {
        return jitterMs;
    }

    public synchronized double avgGapMs() {
        return avgGapMs;
    }

    public synchronized double lossScore() {
        return lossScore;
    }

    public synchronized double latencyMs() {
        return latencyMs;
    }

    public synchronized void reset() {
        jitterMs = 0.0;
        avgGapMs = NOMINAL_GAP_MS;
        lossScore = 0.0;
        latencyMs = 0.0;
        lastArrivalMillis = 0;
        underflowScore = 0.0;
        overflowScore = 0.0;
        seenUnderflows = 0;
        seenOverflows = 0;
    }
}
