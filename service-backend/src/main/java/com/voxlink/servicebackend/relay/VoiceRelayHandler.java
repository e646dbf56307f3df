package com.voxlink.servicebackend.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides what to do with one inbound datagram and returns the datagrams to send in
 * response. Never throws for bad input: anything malformed, unauthorized or spoofed is
 * counted and dropped.
 */
public class VoiceRelayHandler {
    private static final Logger log = LoggerFactory.getLogger(VoiceRelayHandler.class);

    private final RelayState state;
    private final ControlRateLimiter rateLimiter;
    private final RelayAccessPolicy accessPolicy;
    private final RelayProperties properties;
    private final Clock clock;

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();

    public VoiceRelayHandler(RelayState state,
                             ControlRateLimiter rateLimiter,
                             RelayAccessPolicy accessPolicy,
                             RelayProperties properties,
                             Clock clock) {
        this.state = state;
        this.rateLimiter = rateLimiter;
        this.accessPolicy = accessPolicy;
        this.properties = properties;
        this.clock = clock;
    }

    public List<OutboundDatagram> handle(byte[] data, int length, InetSocketAddress sender) {
        received.incrementAndGet();
        RelayPacketType type = RelayPacketType.of(data, length);
        if (type == null) {
            return drop("unrecognized datagram", sender);
        }
        Instant now = clock.instant();
        if (type.control() && !rateLimiter.tryAcquire(sender, type, now)) {
            rateLimited.incrementAndGet();
            log.trace("Rate limited {} from {}", type, sender);
            return List.of();
        }

        return switch (type) {
            case JOIN -> join(RelayFrames.textFields(data, length), sender, now);
            case ROOM_JOIN -> roomJoin(RelayFrames.textFields(data, length), sender, now);
            case ROOM_LEAVE -> roomLeave(RelayFrames.textFields(data, length), sender);
            case SET_PAIR -> setPair(RelayFrames.textFields(data, length), sender);
            case PING -> pong(data, length, sender);
            case AUDIO -> audio(data, length, sender, now);
            case PONG, RELAYED_AUDIO -> drop("server-bound " + type, sender);
        };
    }

    /**
     * Evicts silent endpoints and idle rate-limit windows.
     */
    public void sweep() {
        Instant now = clock.instant();
        List<String> evicted = state.evictSilent(now.minus(properties.endpointTtl()));
        rateLimiter.prune(now);
        if (!evicted.isEmpty()) {
            log.info("Evicted {} silent relay endpoint(s): {}", evicted.size(), evicted);
        }
    }

    // J|login|token
    private List<OutboundDatagram> join(List<String> fields, InetSocketAddress sender, Instant now) {
        String login = fields.get(0);
        String token = fields.size() > 1 ? fields.get(1) : "";
        if (login.isEmpty()) {
            return drop("join without login", sender);
        }
        if (token.isEmpty()) {
            if (!properties.legacyTokenlessJoin()) {
                return drop("token-less join", sender);
            }
        } else if (!tokenNames(token, login)) {
            return drop("join with invalid token for '" + login + "'", sender);
        }
        state.bind(login, sender, now);
        return List.of();
    }

    // C|login|token|room_id
    private List<OutboundDatagram> roomJoin(List<String> fields, InetSocketAddress sender, Instant now) {
        if (fields.size() < 3) {
            return drop("short room join", sender);
        }
        String login = fields.get(0);
        long roomId = parseRoomId(fields.get(2));
        if (roomId <= 0) {
            return drop("room join without room id", sender);
        }
        if (!tokenNames(fields.get(1), login)) {
            return drop("room join with invalid token for '" + login + "'", sender);
        }
        if (!accessPolicy.canJoinRoom(login, roomId)) {
            return drop("room " + roomId + " denied for '" + login + "'", sender);
        }
        if (!state.isBoundTo(sender, login)) {
            state.bind(login, sender, now);
        }
        state.joinRoom(login, roomId);
        return List.of();
    }

    // L|login|room_id
    private List<OutboundDatagram> roomLeave(List<String> fields, InetSocketAddress sender) {
        if (fields.size() < 2) {
            return drop("short room leave", sender);
        }
        String login = fields.get(0);
        if (!state.isBoundTo(sender, login)) {
            return drop("room leave for unbound '" + login + "'", sender);
        }
        state.leaveRoom(login, parseRoomId(fields.get(1)));
        return List.of();
    }

    // S|sender|token|user_a|user_b|flag, or legacy S|user_a|user_b|flag
    private List<OutboundDatagram> setPair(List<String> fields, InetSocketAddress sender) {
        String actor;
        String userA;
        String userB;
        String flag;
        if (fields.size() == 5) {
            actor = fields.get(0);
            if (!tokenNames(fields.get(1), actor) || !state.isBoundTo(sender, actor)) {
                return drop("pairing by unauthenticated '" + actor + "'", sender);
            }
            userA = fields.get(2);
            userB = fields.get(3);
            flag = fields.get(4);
        } else if (fields.size() == 3 && properties.legacyPairing()) {
            userA = fields.get(0);
            userB = fields.get(1);
            flag = fields.get(2);
            Optional<String> bound = state.loginAt(sender);
            if (bound.isEmpty()) {
                return drop("legacy pairing from unbound address", sender);
            }
            actor = bound.get();
        } else {
            return drop("malformed pairing", sender);
        }

        if (userA.isEmpty() || userB.isEmpty() || userA.equals(userB)) {
            return drop("pairing with invalid logins", sender);
        }
        if (!actor.equals(userA) && !actor.equals(userB)) {
            return drop("'" + actor + "' tried to pair '" + userA + "' and '" + userB + "'", sender);
        }
        if ("1".equals(flag)) {
            if (!accessPolicy.canPair(userA, userB)) {
                return drop("pairing without active call: '" + userA + "' and '" + userB + "'", sender);
            }
            state.setPair(userA, userB);
        } else if ("0".equals(flag)) {
            state.clearPair(userA, userB);
        } else {
            return drop("pairing flag '" + flag + "'", sender);
        }
        return List.of();
    }

    // P|seq|send_time -> Q|seq|send_time
    private List<OutboundDatagram> pong(byte[] data, int length, InetSocketAddress sender) {
        byte[] reply = Arrays.copyOf(data, length);
        reply[0] = RelayPacketType.PONG.tag();
        return List.of(new OutboundDatagram(reply, sender));
    }

    // A|from_login|<pcm> -> R|from_login|<pcm>
    private List<OutboundDatagram> audio(byte[] data, int length, InetSocketAddress sender, Instant now) {
        int sep = RelayFrames.indexOf(data, length, RelayPacketType.SEPARATOR, 2);
        if (sep < 0) {
            return drop("audio without sender", sender);
        }
        String from = new String(data, 2, sep - 2, StandardCharsets.UTF_8);
        if (!state.touch(from, sender, now)) {
            return drop("audio for '" + from + "' from unbound address", sender);
        }
        if (state.roomOf(from).isEmpty()) {
            Optional<String> peer = state.pairedWith(from);
            if (peer.isPresent() && !accessPolicy.callActive(from, peer.get())) {
                state.clearPair(from, peer.get());
                return drop("audio for ended call '" + from + "' <-> '" + peer.get() + "'", sender);
            }
        }
        List<InetSocketAddress> targets = state.audioTargets(from);
        if (targets.isEmpty()) {
            dropped.incrementAndGet();
            return List.of();
        }
        byte[] relayed = Arrays.copyOf(data, length);
        relayed[0] = RelayPacketType.RELAYED_AUDIO.tag();
        List<OutboundDatagram> out = new ArrayList<>(targets.size());
        for (InetSocketAddress target : targets) {
            out.add(new OutboundDatagram(relayed, target));
        }
        forwarded.addAndGet(out.size());
        return out;
    }

    private boolean tokenNames(String token, String login) {
        if (token == null || token.isEmpty() || login == null || login.isEmpty()) {
            return false;
        }
        return accessPolicy.loginForToken(token).map(login::equals).orElse(false);
    }

    private static long parseRoomId(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private List<OutboundDatagram> drop(String reason, InetSocketAddress sender) {
        dropped.incrementAndGet();
        log.debug("Dropped datagram from {}: {}", sender, reason);
        return List.of();
    }

    public long getReceived() {
        return received.get();
    }

    public long getForwarded() {
        return forwarded.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getRateLimited() {
        return rateLimited.get();
    }

    public RelayState state() {
        return state;
    }
}
