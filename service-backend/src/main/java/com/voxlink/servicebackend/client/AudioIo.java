package com.voxlink.servicebackend.client;

import java.io.IOException;

/**
 * Opens the capture and playback devices for {@link VoiceEngine}.
 */
public interface AudioIo {

    @FunctionalInterface
    interface FrameSink {
        void onFrame(byte[] pcm, int length);
    }

    @FunctionalInterface
    interface FrameSource {
        void fill(byte[] out);
    }

    /**
     * A running device stream. {@link #stop()} returns once the device thread has made its
     * last callback, or after a bounded wait, and must be safe to call more than once.
     */
    interface Stream {
        void stop();
    }

    Stream startCapture(AudioStreamConfig config, FrameSink sink) throws IOException;

    Stream startPlayback(AudioStreamConfig config, FrameSource source) throws IOException;
}
