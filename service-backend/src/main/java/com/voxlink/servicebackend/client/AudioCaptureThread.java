package com.voxlink.servicebackend.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.sampled.TargetDataLine;

/**
 * Reads fixed-size blocks from the microphone and hands each one to a sink. The sink
 * runs on this thread and must not block.
 */
public class AudioCaptureThread extends Thread {
    private static final Logger log = LoggerFactory.getLogger(AudioCaptureThread.class);

    private final TargetDataLine line;
    private final int blockBytes;
    private final AudioIo.FrameSink sink;
    private volatile boolean running = false;

    public AudioCaptureThread(TargetDataLine line, int blockBytes, AudioIo.FrameSink sink) {
        super("voice-capture");
        this.line = line;
        this.blockBytes = blockBytes;
        this.sink = sink;
        setDaemon(true);
    }

    @Override
    public void run() {
        running = true;
        byte[] block = new byte[blockBytes];
        try {
            line.start();
            log.info("Microphone opened, format: {} Hz, {} bits, {} channels",
                    line.getFormat().getSampleRate(),
                    line.getFormat().getSampleSizeInBits(),
                    line.getFormat().getChannels());

            while (running) {
                int read = line.read(block, 0, blockBytes);
                if (read > 0 && running) {
                    sink.onFrame(block, read);
                }
            }
        } catch (RuntimeException e) {
            log.error("Error in audio capture thread: {}", e.getMessage(), e);
        } finally {
            running = false;
            line.stop();
            line.close();
            log.info("Audio capture stopped");
        }
    }

    public void stopCapture() {
        running = false;
        // unblocks a pending read
        line.stop();
    }

    public boolean isCapturing() {
        return running;
    }
}
