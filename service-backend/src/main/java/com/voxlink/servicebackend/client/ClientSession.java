package com.voxlink.servicebackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.voxlink.servicebackend.common.ErrorKind;
import com.voxlink.servicebackend.common.ServiceException;
import com.voxlink.servicebackend.control.ControlAction;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A signed-in client. Error responses surface as {@link ServiceException} carrying the
 * server's error code.
 */
public class ClientSession {
    private final ControlClient client;
    private final String login;
    private final String token;
    private final String nickname;

    private ClientSession(ControlClient client, JsonNode loginResponse) {
        this.client = client;
        this.login = loginResponse.path("login").asText();
        this.token = loginResponse.path("token").asText();
        this.nickname = loginResponse.path("nickname").asText(login);
    }

    public static void register(ControlClient client, String login, String password, String nickname)
            throws IOException {
        checked(client.send(ControlAction.REGISTER, null,
                Map.of("login", login, "password", password, "nickname", nickname)));
    }

    public static ClientSession login(ControlClient client, String login, String password) throws IOException {
        JsonNode response = checked(client.send(ControlAction.LOGIN, null,
                Map.of("login", login, "password", password)));
        return new ClientSession(client, response);
    }

    public static ClientSession resume(ControlClient client, String token) throws IOException {
        JsonNode response = checked(client.send(ControlAction.RESUME_SESSION, null, Map.of("token", token)));
        return new ClientSession(client, response);
    }

    public String login() {
        return login;
    }

    public String token() {
        return token;
    }

    public String nickname() {
        return nickname;
    }

    public JsonNode findUser(String targetLogin) throws IOException {
        return checked(client.send(ControlAction.FIND_USER, token, Map.of("target_login", targetLogin)));
    }

    public void heartbeat() throws IOException {
        checked(client.send(ControlAction.HEARTBEAT, token));
    }

    public void callUser(String callee) throws IOException {
        checked(client.send(ControlAction.CALL_USER, token, Map.of("to_user", callee)));
    }

    public void acceptCall(String caller) throws IOException {
        checked(client.send(ControlAction.ACCEPT_CALL, token, Map.of("from_user", caller)));
    }

    public void declineCall(String caller) throws IOException {
        checked(client.send(ControlAction.DECLINE_CALL, token, Map.of("from_user", caller)));
    }

    public void endCall(String peer) throws IOException {
        checked(client.send(ControlAction.END_CALL, token, Map.of("with_user", peer)));
    }

    public List<JsonNode> pollEvents() throws IOException {
        JsonNode response = checked(client.send(ControlAction.POLL_EVENTS, token));
        List<JsonNode> events = new ArrayList<>();
        response.path("events").forEach(events::add);
        return events;
    }

    public void setChannelVoicePresence(long channelId, boolean speaking) throws IOException {
        checked(client.send(ControlAction.SET_CHANNEL_VOICE_PRESENCE, token,
                Map.of("channel_id", channelId, "speaking", speaking, "joined", true)));
    }

    public void leaveChannelVoice(long channelId) throws IOException {
        checked(client.send(ControlAction.LEAVE_CHANNEL_VOICE, token, Map.of("channel_id", channelId)));
    }

    public List<JsonNode> channelVoiceParticipants(long channelId) throws IOException {
        JsonNode response = checked(client.send(ControlAction.GET_CHANNEL_VOICE_PARTICIPANTS, token,
                Map.of("channel_id", channelId)));
        List<JsonNode> participants = new ArrayList<>();
        response.path("participants").forEach(participants::add);
        return participants;
    }

    public void releaseCallState() throws IOException {
        checked(client.send(ControlAction.RELEASE_CALL_STATE, token));
    }

    public void logout() throws IOException {
        checked(client.send(ControlAction.LOGOUT, token));
    }

    static JsonNode checked(JsonNode response) {
        if ("ok".equals(response.path("status").asText())) {
            return response;
        }
        ErrorKind kind = ErrorKind.fromCode(response.path("code").asText()).orElse(ErrorKind.TRANSIENT);
        throw new ServiceException(kind, response.path("message").asText("Request failed"));
    }
}
