package com.voxlink.servicebackend.client;

import com.voxlink.servicebackend.relay.RelayFrames;
import com.voxlink.servicebackend.relay.RelayPacketType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.SocketTimeoutException;

/**
 * Client side of the relay datagram protocol. Sends on a closed client are dropped
 * quietly, and a receive on a closed client reports end of stream.
 */
public class RelayClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayClient.class);

    public static final int RECEIVE_TIMEOUT_MS = 200;
    public static final int MAX_DATAGRAM_BYTES = 8192;

    private final InetSocketAddress relay;
    private final DatagramSocket socket;
    private volatile boolean closed = false;

    public RelayClient(InetSocketAddress relay) throws SocketException {
        this.relay = relay;
        this.socket = new DatagramSocket();
        this.socket.setSoTimeout(RECEIVE_TIMEOUT_MS);
    }

    public void join(String login, String token) {
        send(RelayFrames.text(RelayPacketType.JOIN, login, token));
    }

    public void joinRoom(String login, String token, long roomId) {
        send(RelayFrames.text(RelayPacketType.ROOM_JOIN, login, token, Long.toString(roomId)));
    }

    public void leaveRoom(String login, long roomId) {
        send(RelayFrames.text(RelayPacketType.ROOM_LEAVE, login, Long.toString(roomId)));
    }

    public void setPair(String login, String token, String peer, boolean active) {
        send(RelayFrames.text(RelayPacketType.SET_PAIR, login, token, login, peer, active ? "1" : "0"));
    }

    public void ping(long seq, long sentAtMillis) {
        send(RelayFrames.text(RelayPacketType.PING, Long.toString(seq), Long.toString(sentAtMillis)));
    }

    public void sendAudio(String login, byte[] pcm, int length) {
        send(RelayFrames.withTail(RelayPacketType.AUDIO, login, pcm, 0, length));
    }

    /**
     * Waits up to {@link #RECEIVE_TIMEOUT_MS} for one datagram.
     *
     * @return the datagram length, 0 on timeout, or -1 once the client is closed
     */
    public int receive(byte[] buffer) {
        if (closed) {
            return -1;
        }
        DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
        try {
            socket.receive(packet);
            return packet.getLength();
        } catch (SocketTimeoutException timeout) {
            return 0;
        } catch (IOException e) {
            if (!closed) {
                log.warn("Relay receive failed: {}", e.getMessage());
            }
            return -1;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int getLocalPort() {
        return socket.getLocalPort();
    }

    @Override
    public void close() {
        closed = true;
        socket.close();
    }

    private void send(byte[] payload) {
        if (closed) {
            return;
        }
        try {
            socket.send(new DatagramPacket(payload, payload.length, relay));
        } catch (IOException e) {
            log.debug("Failed to send {} datagram: {}", (char) payload[0], e.getMessage());
        }
    }
}
