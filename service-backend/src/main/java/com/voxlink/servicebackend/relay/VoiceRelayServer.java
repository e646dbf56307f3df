package com.voxlink.servicebackend.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * UDP front of the relay: one receive thread feeding {@link VoiceRelayHandler} and a
 * scheduled sweep. Replies are sent from the receive thread after the handler returns,
 * so no relay lock is held during I/O.
 */
public class VoiceRelayServer {
    private static final Logger log = LoggerFactory.getLogger(VoiceRelayServer.class);

    private final RelayProperties properties;
    private final VoiceRelayHandler handler;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "voice-relay-sweep");
        t.setDaemon(true);
        return t;
    });
    private volatile DatagramSocket socket;
    private volatile boolean running = false;
    private Thread listenerThread;

    public VoiceRelayServer(RelayProperties properties, VoiceRelayHandler handler) {
        this.properties = properties;
        this.handler = handler;
    }

    public synchronized void start() throws IOException {
        if (running) {
            log.warn("Voice relay already running");
            return;
        }

        socket = new DatagramSocket(new InetSocketAddress(properties.host(), properties.port()));
        socket.setSoTimeout(500);
        running = true;

        listenerThread = new Thread(this::receiveLoop, "voice-relay-listener");
        listenerThread.setDaemon(true);
        listenerThread.start();

        long sweepMillis = properties.sweepInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::sweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);

        log.info("Voice relay started on {}:{}", properties.host(), getLocalPort());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdownNow();

        if (socket != null && !socket.isClosed()) {
            socket.close();
        }

        if (listenerThread != null) {
            try {
                listenerThread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Voice relay stopped (received {}, forwarded {}, dropped {}, rate limited {})",
                handler.getReceived(), handler.getForwarded(), handler.getDropped(), handler.getRateLimited());
    }

    public int getLocalPort() {
        DatagramSocket current = socket;
        return current == null ? -1 : current.getLocalPort();
    }

    public boolean isRunning() {
        return running;
    }

    public VoiceRelayHandler handler() {
        return handler;
    }

    private void receiveLoop() {
        byte[] buffer = new byte[properties.maxDatagramBytes()];

        while (running) {
            try {
                DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
                socket.receive(packet);
                InetSocketAddress sender = new InetSocketAddress(packet.getAddress(), packet.getPort());

                List<OutboundDatagram> replies = handler.handle(packet.getData(), packet.getLength(), sender);
                for (OutboundDatagram reply : replies) {
                    send(reply);
                }
            } catch (SocketTimeoutException e) {
                // idle, re-check running
            } catch (IOException e) {
                if (running) {
                    log.error("Error receiving relay datagram", e);
                }
            } catch (RuntimeException e) {
                log.error("Unexpected error handling relay datagram", e);
            }
        }
    }

    private void send(OutboundDatagram datagram) {
        try {
            socket.send(new DatagramPacket(datagram.payload(), datagram.payload().length, datagram.target()));
        } catch (IOException e) {
            if (running) {
                log.debug("Failed to send to {}: {}", datagram.target(), e.getMessage());
            }
        }
    }

    private void sweep() {
        try {
            handler.sweep();
        } catch (RuntimeException e) {
            log.error("Relay sweep failed", e);
        }
    }
}
