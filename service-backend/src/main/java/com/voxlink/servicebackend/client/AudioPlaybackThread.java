package com.voxlink.servicebackend.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.sampled.SourceDataLine;

/**
 * Pulls one block per period from a source and writes it to the speaker. The blocking
 * line write paces the loop at the device rate.
 */
public class AudioPlaybackThread extends Thread {
    private static final Logger log = LoggerFactory.getLogger(AudioPlaybackThread.class);

    private final SourceDataLine line;
    private final int blockBytes;
    private final AudioIo.FrameSource source;
    private volatile boolean running = false;

    public AudioPlaybackThread(SourceDataLine line, int blockBytes, AudioIo.FrameSource source) {
        super("voice-playback");
        this.line = line;
        this.blockBytes = blockBytes;
        this.source = source;
        setDaemon(true);
    }

    @Override
    public void run() {
        running = true;
        byte[] block = new byte[blockBytes];
        try {
            line.start();
            log.info("Speaker opened, format: {} Hz, {} bits, {} channels",
                    line.getFormat().getSampleRate(),
                    line.getFormat().getSampleSizeInBits(),
                    line.getFormat().getChannels());

            while (running) {
                source.fill(block);
                line.write(block, 0, blockBytes);
            }
        } catch (RuntimeException e) {
            log.error("Error in audio playback thread: {}", e.getMessage(), e);
        } finally {
            running = false;
            line.stop();
            line.flush();
            line.close();
            log.info("Audio playback stopped");
        }
    }

    public void stopPlayback() {
        running = false;
        // unblocks a pending write
        line.stop();
    }

    public boolean isPlaying() {
        return running;
    }
}
