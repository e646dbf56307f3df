package com.voxlink.servicebackend.client;

import javax.sound.sampled.AudioFormat;

/**
 * Audio parameters shared by both ends of a voice stream: signed 16-bit little-endian PCM.
 */
public record AudioStreamConfig(
        int sampleRate,       // Hz
        int channels,
        int bitsPerSample,
        int packetDurationMs  // audio carried by one datagram
) {
    public static AudioStreamConfig createDefault() {
        return new AudioStreamConfig(16000, 1, 16, 20);
    }

    public int getFrameSamples() {
        return sampleRate * packetDurationMs / 1000;
    }

    public int getBytesPerPacket() {
        return getFrameSamples() * (bitsPerSample / 8) * channels;
    }

    public AudioFormat toAudioFormat() {
        return new AudioFormat(sampleRate, bitsPerSample, channels, true, false);
    }
}
