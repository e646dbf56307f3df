package com.voxlink.servicebackend.client;

/**
 * Display-only view of a running voice stream.
 */
public record ActivitySnapshot(
        double micLevel,
        double peerLevel,
        boolean meSpeaking,
        boolean peerSpeaking,
        double latencyMs,
        double jitterMs,
        double lossScore,
        double qualityScore,
        QualityLevel quality
) {
}
