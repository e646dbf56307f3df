package com.voxlink.servicebackend.control;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Control channel actions. {@code idempotent} actions may be retried by clients after a
 * transport failure; every other action is sent at most once.
 */
public enum ControlAction {
    REGISTER("register", false, false),
    LOGIN("login", false, false),
    RESUME_SESSION("resume_session", false, true),
    FIND_USER("find_user", false, true),
    HEARTBEAT("heartbeat", true, true),
    STATUS("status", true, true),
    LOGOUT("logout", true, false),
    RELEASE_CALL_STATE("release_call_state", true, false),
    PRESENCE_OFFLINE("presence_offline", true, false),
    // drains the queue on read
    POLL_EVENTS("poll_events", true, false),
    CALL_USER("call_user", true, false),
    ACCEPT_CALL("accept_call", true, false),
    DECLINE_CALL("decline_call", true, false),
    END_CALL("end_call", true, false),
    SET_CHANNEL_VOICE_PRESENCE("set_channel_voice_presence", true, false),
    LEAVE_CHANNEL_VOICE("leave_channel_voice", true, false),
    GET_CHANNEL_VOICE_PARTICIPANTS("get_channel_voice_participants", true, true);

    private static final Map<String, ControlAction> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ControlAction::wireName, Function.identity()));

    private final String wireName;
    private final boolean authenticated;
    private final boolean idempotent;

    ControlAction(String wireName, boolean authenticated, boolean idempotent) {
        this.wireName = wireName;
        this.authenticated = authenticated;
        this.idempotent = idempotent;
    }

    public String wireName() {
        return wireName;
    }

    public boolean authenticated() {
        return authenticated;
    }

    public boolean idempotent() {
        return idempotent;
    }

    public static Optional<ControlAction> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(name.trim()));
    }
}
