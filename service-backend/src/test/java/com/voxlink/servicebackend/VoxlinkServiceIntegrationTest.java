package com.voxlink.servicebackend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voxlink.servicebackend.channel.Channel;
import com.voxlink.servicebackend.channel.ChannelRole;
import com.voxlink.servicebackend.channel.JpaChannelDirectory;
import com.voxlink.servicebackend.client.ClientSession;
import com.voxlink.servicebackend.client.ControlClient;
import com.voxlink.servicebackend.client.RelayClient;
import com.voxlink.servicebackend.common.ErrorKind;
import com.voxlink.servicebackend.common.ServiceException;
import com.voxlink.servicebackend.control.ControlServer;
import com.voxlink.servicebackend.control.FrameCodec;
import com.voxlink.servicebackend.relay.VoiceRelayServer;
import com.voxlink.servicebackend.social.FriendshipService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class VoxlinkServiceIntegrationTest {

    @Autowired
    private ControlServer controlServer;

    @Autowired
    private VoiceRelayServer relayServer;

    @Autowired
    private FriendshipService friendships;

    @Autowired
    private JpaChannelDirectory channels;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MockMvc mockMvc;

    private ControlClient control;
    private InetSocketAddress relayAddress;

    @BeforeEach
    void setUp() {
        InetAddress loopback = InetAddress.getLoopbackAddress();
        control = new ControlClient(new InetSocketAddress(loopback, controlServer.getLocalPort()), objectMapper);
        relayAddress = new InetSocketAddress(loopback, relayServer.getLocalPort());
    }

    @Test
    void aliceCallsBobAndTheirAudioIsRelayed() throws Exception {
        String aliceLogin = unique("alice");
        String bobLogin = unique("bob");
        ClientSession.register(control, aliceLogin, "secret", "Alice");
        ClientSession.register(control, bobLogin, "secret", "Bob");
        friendships.befriend(aliceLogin, bobLogin);
        ClientSession alice = ClientSession.login(control, aliceLogin, "secret");
        ClientSession bob = ClientSession.login(control, bobLogin, "secret");

        alice.callUser(bobLogin);
        List<JsonNode> incoming = bob.pollEvents();
        assertEquals(1, incoming.size());
        assertEquals("incoming_call", incoming.get(0).path("type").asText());
        assertEquals(aliceLogin, incoming.get(0).path("from_user").asText());

        ServiceException busy = assertThrows(ServiceException.class, () -> alice.callUser(bobLogin));
        assertEquals(ErrorKind.CONFLICT, busy.kind());

        bob.acceptCall(aliceLogin);
        assertEquals("call_accepted", alice.pollEvents().get(0).path("type").asText());
        assertEquals("call_started", bob.pollEvents().get(0).path("type").asText());

        try (RelayClient aliceRelay = new RelayClient(relayAddress);
             RelayClient bobRelay = new RelayClient(relayAddress)) {
            byte[] pcm = new byte[640];
            Arrays.fill(pcm, (byte) 3);
            byte[] received = null;
            byte[] buffer = new byte[RelayClient.MAX_DATAGRAM_BYTES];
            for (int attempt = 0; attempt < 20 && received == null; attempt++) {
                bobRelay.join(bobLogin, bob.token());
                aliceRelay.join(aliceLogin, alice.token());
                aliceRelay.setPair(aliceLogin, alice.token(), bobLogin, true);
                aliceRelay.sendAudio(aliceLogin, pcm, pcm.length);
                int length = bobRelay.receive(buffer);
                if (length > 0) {
                    received = Arrays.copyOf(buffer, length);
                }
            }
            if (received == null) {
                fail("Relayed audio never arrived");
            }
            byte[] head = ("R|" + aliceLogin + "|").getBytes(StandardCharsets.UTF_8);
            assertArrayEquals(head, Arrays.copyOf(received, head.length));
            assertArrayEquals(pcm, Arrays.copyOfRange(received, head.length, received.length));
        }

        alice.endCall(bobLogin);
        JsonNode ended = bob.pollEvents().get(0);
        assertEquals("call_ended", ended.path("type").asText());
        assertEquals(aliceLogin, ended.path("by_user").asText());
    }

    @Test
    void relayRefusesToPairWithoutAnActiveCall() throws Exception {
        String aliceLogin = unique("alice");
        String bobLogin = unique("bob");
        ClientSession.register(control, aliceLogin, "secret", "Alice");
        ClientSession.register(control, bobLogin, "secret", "Bob");
        friendships.befriend(aliceLogin, bobLogin);
        ClientSession alice = ClientSession.login(control, aliceLogin, "secret");
        ClientSession bob = ClientSession.login(control, bobLogin, "secret");

        try (RelayClient aliceRelay = new RelayClient(relayAddress);
             RelayClient bobRelay = new RelayClient(relayAddress)) {
            bobRelay.join(bobLogin, bob.token());
            aliceRelay.join(aliceLogin, alice.token());
            aliceRelay.setPair(aliceLogin, alice.token(), bobLogin, true);
            byte[] buffer = new byte[RelayClient.MAX_DATAGRAM_BYTES];
            for (int i = 0; i < 5; i++) {
                aliceRelay.sendAudio(aliceLogin, new byte[640], 640);
                assertEquals(0, bobRelay.receive(buffer));
            }
        }
    }

    @Test
    void channelVoiceRoomListsLiveParticipants() throws Exception {
        String ownerLogin = unique("owner");
        String memberLogin = unique("member");
        ClientSession.register(control, ownerLogin, "secret", "Owner");
        ClientSession.register(control, memberLogin, "secret", "Member");
        Channel channel = channels.createChannel("general", ownerLogin, ChannelRole.MEMBER, ChannelRole.MEMBER);
        channels.addMember(channel.getId(), memberLogin, ChannelRole.MEMBER);
        ClientSession owner = ClientSession.login(control, ownerLogin, "secret");
        ClientSession member = ClientSession.login(control, memberLogin, "secret");

        owner.setChannelVoicePresence(channel.getId(), true);
        member.setChannelVoicePresence(channel.getId(), false);

        List<JsonNode> participants = member.channelVoiceParticipants(channel.getId());
        assertEquals(2, participants.size());
        assertEquals(ownerLogin, participants.get(0).path("login").asText());
        assertEquals("owner", participants.get(0).path("role").asText());
        assertTrue(participants.get(0).path("speaking").asBoolean());
        assertTrue(participants.get(1).path("online").asBoolean());

        member.leaveChannelVoice(channel.getId());
        assertEquals(1, owner.channelVoiceParticipants(channel.getId()).size());
    }

    @Test
    void legacyRawJsonRequestGetsFramedResponse() throws Exception {
        String login = unique("legacy");
        ClientSession.register(control, login, "secret", "Legacy");

        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), controlServer.getLocalPort())) {
            socket.setSoTimeout(5000);
            String raw = "{\"action\":\"find_user\",\"target_login\":\"" + login + "\"}";
            socket.getOutputStream().write(raw.getBytes(StandardCharsets.UTF_8));
            socket.shutdownOutput();

            JsonNode response = objectMapper.readTree(FrameCodec.readFrame(socket.getInputStream(), 1 << 20));
            assertEquals("ok", response.path("status").asText());
            assertEquals("Legacy", response.path("nickname").asText());
        }
    }

    @Test
    void healthReportsBothServers() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.relay.port").value(relayServer.getLocalPort()));

        mockMvc.perform(get("/api/voice/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sampleRate").value(16000))
                .andExpect(jsonPath("$.bytesPerPacket").value(640));
    }

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
