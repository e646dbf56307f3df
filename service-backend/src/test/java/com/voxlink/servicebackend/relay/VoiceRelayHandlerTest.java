package com.voxlink.servicebackend.relay;

import com.voxlink.servicebackend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VoiceRelayHandlerTest {
    private static final InetSocketAddress ALICE_ADDR = new InetSocketAddress("10.0.0.1", 40001);
    private static final InetSocketAddress BOB_ADDR = new InetSocketAddress("10.0.0.2", 40002);
    private static final InetSocketAddress CAROL_ADDR = new InetSocketAddress("10.0.0.3", 40003);
    private static final InetSocketAddress MALLORY_ADDR = new InetSocketAddress("10.6.6.6", 40666);

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final FakeAccess access = new FakeAccess();
    private VoiceRelayHandler handler;

    @BeforeEach
    void setUp() {
        access.tokens.put("tok-alice", "alice");
        access.tokens.put("tok-bob", "bob");
        access.tokens.put("tok-carol", "carol");
        access.tokens.put("tok-mallory", "mallory");
        handler = newHandler(false, false, 40);
    }

    @Test
    void joinBindsOnlyWithAMatchingToken() {
        send("J|alice|tok-alice", ALICE_ADDR);
        send("J|bob|tok-alice", BOB_ADDR);
        send("J|carol", CAROL_ADDR);

        assertTrue(handler.state().isBoundTo(ALICE_ADDR, "alice"));
        assertFalse(handler.state().isBoundTo(BOB_ADDR, "bob"));
        assertFalse(handler.state().isBoundTo(CAROL_ADDR, "carol"));
        assertEquals(2, handler.getDropped());
    }

    @Test
    void tokenlessJoinOnlyInLegacyMode() {
        handler = newHandler(true, false, 40);
        send("J|carol", CAROL_ADDR);
        assertTrue(handler.state().isBoundTo(CAROL_ADDR, "carol"));
    }

    @Test
    void rebindingFromNewAddressDropsOldMapping() {
        InetSocketAddress moved = new InetSocketAddress("10.0.0.1", 50000);
        send("J|alice|tok-alice", ALICE_ADDR);
        send("J|alice|tok-alice", moved);

        assertFalse(handler.state().isBoundTo(ALICE_ADDR, "alice"));
        assertTrue(handler.state().isBoundTo(moved, "alice"));
        assertEquals(1, handler.state().endpointCount());
    }

    @Test
    void pairedAudioIsForwardedAsRelayedCopy() {
        pairAliceAndBob();

        byte[] audio = audio("alice", new byte[]{1, 2, 3, 4});
        List<OutboundDatagram> out = handler.handle(audio, audio.length, ALICE_ADDR);

        assertEquals(1, out.size());
        assertEquals(BOB_ADDR, out.get(0).target());
        byte[] expected = audio.clone();
        expected[0] = 'R';
        assertArrayEquals(expected, out.get(0).payload());
        assertEquals(1, handler.getForwarded());
    }

    @Test
    void spoofedAudioIsDropped() {
        pairAliceAndBob();
        send("J|mallory|tok-mallory", MALLORY_ADDR);

        byte[] spoofed = audio("alice", new byte[]{9, 9});
        List<OutboundDatagram> out = handler.handle(spoofed, spoofed.length, MALLORY_ADDR);

        assertTrue(out.isEmpty());
        assertEquals(0, handler.getForwarded());
    }

    @Test
    void pairingRequiresFriendsWithActiveCall() {
        send("J|alice|tok-alice", ALICE_ADDR);
        send("J|bob|tok-bob", BOB_ADDR);

        send("S|alice|tok-alice|alice|bob|1", ALICE_ADDR);
        assertEquals(Optional.empty(), handler.state().pairedWith("alice"));

        access.pairable.add(Set.of("alice", "bob"));
        send("S|alice|tok-alice|alice|bob|1", ALICE_ADDR);
        assertEquals(Optional.of("bob"), handler.state().pairedWith("alice"));
    }

    @Test
    void thirdPartyCannotPairOthers() {
        access.pairable.add(Set.of("alice", "bob"));
        send("J|alice|tok-alice", ALICE_ADDR);
        send("J|bob|tok-bob", BOB_ADDR);
        send("J|mallory|tok-mallory", MALLORY_ADDR);

        send("S|mallory|tok-mallory|alice|bob|1", MALLORY_ADDR);
        send("S|alice|tok-mallory|alice|bob|1", MALLORY_ADDR);

        assertEquals(Optional.empty(), handler.state().pairedWith("alice"));
    }

    @Test
    void pairingFromAddressNotBoundToSenderIsDropped() {
        access.pairable.add(Set.of("alice", "bob"));
        send("J|bob|tok-bob", BOB_ADDR);

        send("S|alice|tok-alice|alice|bob|1", MALLORY_ADDR);

        assertEquals(Optional.empty(), handler.state().pairedWith("bob"));
    }

    @Test
    void legacyPairingOnlyWhenEnabled() {
        access.pairable.add(Set.of("alice", "bob"));
        send("J|alice|tok-alice", ALICE_ADDR);
        send("S|alice|bob|1", ALICE_ADDR);
        assertEquals(Optional.empty(), handler.state().pairedWith("alice"));

        handler = newHandler(false, true, 40);
        send("J|alice|tok-alice", ALICE_ADDR);
        send("S|alice|bob|1", ALICE_ADDR);
        assertEquals(Optional.of("bob"), handler.state().pairedWith("alice"));
    }

    @Test
    void clearingPairStopsForwarding() {
        pairAliceAndBob();
        send("S|bob|tok-bob|alice|bob|0", BOB_ADDR);

        byte[] audio = audio("alice", new byte[]{1});
        assertTrue(handler.handle(audio, audio.length, ALICE_ADDR).isEmpty());
    }

    @Test
    void newPairReplacesOldOne() {
        pairAliceAndBob();
        access.pairable.add(Set.of("alice", "carol"));
        send("J|carol|tok-carol", CAROL_ADDR);
        send("S|alice|tok-alice|alice|carol|1", ALICE_ADDR);

        assertEquals(Optional.of("carol"), handler.state().pairedWith("alice"));
        assertEquals(Optional.empty(), handler.state().pairedWith("bob"));
    }

    @Test
    void roomAudioFansOutToOtherMembers() {
        access.rooms.put("alice", 5L);
        access.rooms.put("bob", 5L);
        access.rooms.put("carol", 5L);
        send("C|alice|tok-alice|5", ALICE_ADDR);
        send("C|bob|tok-bob|5", BOB_ADDR);
        send("C|carol|tok-carol|5", CAROL_ADDR);

        byte[] audio = audio("alice", new byte[]{7, 7});
        List<OutboundDatagram> out = handler.handle(audio, audio.length, ALICE_ADDR);

        Set<InetSocketAddress> targets = new HashSet<>();
        out.forEach(d -> targets.add(d.target()));
        assertEquals(Set.of(BOB_ADDR, CAROL_ADDR), targets);
    }

    @Test
    void roomJoinRequiresVoiceAccess() {
        send("C|mallory|tok-mallory|5", MALLORY_ADDR);
        assertEquals(Optional.empty(), handler.state().roomOf("mallory"));
    }

    @Test
    void deniedRoomJoinLeavesExistingBindingAlone() {
        InetSocketAddress elsewhere = new InetSocketAddress("10.0.0.9", 40009);
        pairAliceAndBob();

        send("C|alice|tok-alice|5", elsewhere);

        assertTrue(handler.state().isBoundTo(ALICE_ADDR, "alice"));
        assertFalse(handler.state().isBoundTo(elsewhere, "alice"));
        assertEquals(Optional.empty(), handler.state().roomOf("alice"));
        byte[] audio = audio("alice", new byte[]{3});
        assertEquals(1, handler.handle(audio, audio.length, ALICE_ADDR).size());
    }

    @Test
    void audioStopsOnceTheCallIsOver() {
        pairAliceAndBob();
        access.pairable.remove(Set.of("alice", "bob"));

        byte[] audio = audio("alice", new byte[]{1, 2});
        assertTrue(handler.handle(audio, audio.length, ALICE_ADDR).isEmpty());
        assertEquals(Optional.empty(), handler.state().pairedWith("alice"));
        assertEquals(Optional.empty(), handler.state().pairedWith("bob"));
        assertEquals(0, handler.getForwarded());
    }

    @Test
    void roomLeaveOnlyFromBoundAddress() {
        access.rooms.put("alice", 5L);
        send("C|alice|tok-alice|5", ALICE_ADDR);

        send("L|alice|5", MALLORY_ADDR);
        assertEquals(Optional.of(5L), handler.state().roomOf("alice"));

        send("L|alice|5", ALICE_ADDR);
        assertEquals(Optional.empty(), handler.state().roomOf("alice"));
        assertEquals(0, handler.state().roomCount());
    }

    @Test
    void pingIsEchoedAsPongVerbatim() {
        byte[] ping = "P|17|1714557600.123".getBytes(StandardCharsets.UTF_8);
        List<OutboundDatagram> out = handler.handle(ping, ping.length, MALLORY_ADDR);

        assertEquals(1, out.size());
        assertEquals(MALLORY_ADDR, out.get(0).target());
        assertEquals("Q|17|1714557600.123", new String(out.get(0).payload(), StandardCharsets.UTF_8));
    }

    @Test
    void controlTrafficIsRateLimitedPerAddressAndType() {
        handler = newHandler(false, false, 3);
        for (int i = 0; i < 5; i++) {
            send("P|" + i + "|0", MALLORY_ADDR);
        }
        assertEquals(2, handler.getRateLimited());

        clock.advance(Duration.ofMillis(1001));
        byte[] ping = "P|9|0".getBytes(StandardCharsets.UTF_8);
        assertEquals(1, handler.handle(ping, ping.length, MALLORY_ADDR).size());
    }

    @Test
    void audioIsNotRateLimited() {
        handler = newHandler(false, false, 3);
        pairAliceAndBob();
        byte[] audio = audio("alice", new byte[]{1, 2});
        for (int i = 0; i < 50; i++) {
            handler.handle(audio, audio.length, ALICE_ADDR);
        }
        assertEquals(50, handler.getForwarded());
    }

    @Test
    void malformedDatagramsAreDroppedWithoutThrowing() {
        String[] junk = {"", "X", "A|", "A|noseparator", "Z|what", "S|||", "S|a|b|c|d|e|f|g", "C|alice|tok-alice|abc",
                "J|", "Q|1|2", "R|alice|x"};
        for (String datagram : junk) {
            byte[] data = datagram.getBytes(StandardCharsets.UTF_8);
            assertTrue(handler.handle(data, data.length, MALLORY_ADDR).isEmpty(), datagram);
        }
        assertEquals(junk.length, handler.getReceived());
    }

    @Test
    void sweepEvictsSilentEndpointsWithTheirRoutes() {
        pairAliceAndBob();
        clock.advance(Duration.ofSeconds(15));
        byte[] audio = audio("alice", new byte[]{1});
        handler.handle(audio, audio.length, ALICE_ADDR);
        clock.advance(Duration.ofSeconds(6));

        handler.sweep();

        assertTrue(handler.state().isBoundTo(ALICE_ADDR, "alice"));
        assertFalse(handler.state().isBoundTo(BOB_ADDR, "bob"));
        assertEquals(Optional.empty(), handler.state().pairedWith("alice"));
    }

    private void pairAliceAndBob() {
        access.pairable.add(Set.of("alice", "bob"));
        send("J|alice|tok-alice", ALICE_ADDR);
        send("J|bob|tok-bob", BOB_ADDR);
        send("S|alice|tok-alice|alice|bob|1", ALICE_ADDR);
        assertEquals(Optional.of("bob"), handler.state().pairedWith("alice"));
    }

    private void send(String datagram, InetSocketAddress from) {
        byte[] data = datagram.getBytes(StandardCharsets.UTF_8);
        handler.handle(data, data.length, from);
    }

    private static byte[] audio(String from, byte[] pcm) {
        byte[] head = ("A|" + from + "|").getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[head.length + pcm.length];
        System.arraycopy(head, 0, out, 0, head.length);
        System.arraycopy(pcm, 0, out, head.length, pcm.length);
        return out;
    }

    private VoiceRelayHandler newHandler(boolean tokenlessJoin, boolean legacyPairing, int rateLimit) {
        RelayProperties properties = new RelayProperties("127.0.0.1", 0, 8192, Duration.ofSeconds(20),
                Duration.ofSeconds(5), rateLimit, Duration.ofSeconds(1), tokenlessJoin, legacyPairing);
        return new VoiceRelayHandler(new RelayState(),
                new ControlRateLimiter(rateLimit, Duration.ofSeconds(1)), access, properties, clock);
    }

    private static class FakeAccess implements RelayAccessPolicy {
        final Map<String, String> tokens = new HashMap<>();
        final Map<String, Long> rooms = new HashMap<>();
        final Set<Set<String>> pairable = new HashSet<>();

        @Override
        public Optional<String> loginForToken(String token) {
            return Optional.ofNullable(tokens.get(token));
        }

        @Override
        public boolean canJoinRoom(String login, long channelId) {
            Long room = rooms.get(login);
            return room != null && room == channelId;
        }

        @Override
        public boolean canPair(String userA, String userB) {
            return pairable.contains(Set.of(userA, userB));
        }

        @Override
        public boolean callActive(String userA, String userB) {
            return pairable.contains(Set.of(userA, userB));
        }
    }
}
