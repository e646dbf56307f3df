package com.voxlink.servicebackend.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;
import javax.sound.sampled.TargetDataLine;
import java.io.IOException;

/**
 * {@link AudioIo} backed by javax.sound.sampled lines.
 */
public class JavaSoundAudioIo implements AudioIo {
    private static final Logger log = LoggerFactory.getLogger(JavaSoundAudioIo.class);

    static final long STOP_TIMEOUT_MS = 1000;

    @Override
    public Stream startCapture(AudioStreamConfig config, FrameSink sink) throws IOException {
        DataLine.Info info = new DataLine.Info(TargetDataLine.class, config.toAudioFormat());
        if (!AudioSystem.isLineSupported(info)) {
            throw new IOException("Capture format not supported: " + config.toAudioFormat());
        }
        try {
            TargetDataLine line = (TargetDataLine) AudioSystem.getLine(info);
            line.open(config.toAudioFormat(), config.getBytesPerPacket() * 2);
            AudioCaptureThread thread = new AudioCaptureThread(line, config.getBytesPerPacket(), sink);
            thread.start();
            return () -> stopAndJoin(thread, thread::stopCapture);
        } catch (LineUnavailableException e) {
            throw new IOException("Microphone unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public Stream startPlayback(AudioStreamConfig config, FrameSource source) throws IOException {
        DataLine.Info info = new DataLine.Info(SourceDataLine.class, config.toAudioFormat());
        if (!AudioSystem.isLineSupported(info)) {
            throw new IOException("Playback format not supported: " + config.toAudioFormat());
        }
        try {
            SourceDataLine line = (SourceDataLine) AudioSystem.getLine(info);
            line.open(config.toAudioFormat(), config.getBytesPerPacket() * 4);
            AudioPlaybackThread thread = new AudioPlaybackThread(line, config.getBytesPerPacket(), source);
            thread.start();
            return () -> stopAndJoin(thread, thread::stopPlayback);
        } catch (LineUnavailableException e) {
            throw new IOException("Speaker unavailable: " + e.getMessage(), e);
        }
    }

    private static void stopAndJoin(Thread thread, Runnable stop) {
        stop.run();
        if (thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(STOP_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("{} did not stop within {} ms", thread.getName(), STOP_TIMEOUT_MS);
        }
    }
}
