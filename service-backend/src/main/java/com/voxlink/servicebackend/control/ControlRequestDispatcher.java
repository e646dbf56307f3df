package com.voxlink.servicebackend.control;

import com.fasterxml.jackson.databind.JsonNode;
import com.voxlink.servicebackend.call.CallSignalingEngine;
import com.voxlink.servicebackend.common.ErrorKind;
import com.voxlink.servicebackend.common.ServiceException;
import com.voxlink.servicebackend.event.EventOutbox;
import com.voxlink.servicebackend.event.PendingEvent;
import com.voxlink.servicebackend.security.AuthenticatedUser;
import com.voxlink.servicebackend.session.SessionManager;
import com.voxlink.servicebackend.session.SessionManager.IssuedSession;
import com.voxlink.servicebackend.user.UserProfile;
import com.voxlink.servicebackend.user.UserService;
import com.voxlink.servicebackend.voice.VoiceParticipantDto;
import com.voxlink.servicebackend.voice.VoicePresenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns one decoded control request into one response map.
 *
 * <p>Stale calls are pruned before anything else. Authenticated actions resolve their
 * token first and fail closed. Domain failures become error responses carrying a code;
 * anything unexpected is logged and answered with a generic message.
 */
@Component
public class ControlRequestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ControlRequestDispatcher.class);

    private final SessionManager sessions;
    private final UserService users;
    private final CallSignalingEngine calls;
    private final EventOutbox outbox;
    private final VoicePresenceService voicePresence;

    public ControlRequestDispatcher(SessionManager sessions,
                                    UserService users,
                                    CallSignalingEngine calls,
                                    EventOutbox outbox,
                                    VoicePresenceService voicePresence) {
        this.sessions = sessions;
        this.users = users;
        this.calls = calls;
        this.outbox = outbox;
        this.voicePresence = voicePresence;
    }

    public Map<String, Object> dispatch(JsonNode request) {
        calls.pruneStale();

        String actionName = text(request, "action");
        if (actionName.isEmpty()) {
            return ControlResponses.error(ErrorKind.MALFORMED, "No action");
        }
        Optional<ControlAction> action = ControlAction.fromWire(actionName);
        if (action.isEmpty()) {
            log.warn("Unknown control action '{}'", actionName);
            return ControlResponses.error(ErrorKind.MALFORMED, "Unknown action");
        }

        try {
            AuthenticatedUser user = action.get().authenticated()
                    ? sessions.require(text(request, "token"))
                    : null;
            return handle(action.get(), request, user);
        } catch (ServiceException e) {
            log.warn("Action {} rejected ({}): {}", actionName, e.kind().code(), e.getMessage());
            return ControlResponses.error(e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Action {} failed", actionName, e);
            return ControlResponses.internalError();
        }
    }

    private Map<String, Object> handle(ControlAction action, JsonNode request, AuthenticatedUser user) {
        return switch (action) {
            case REGISTER -> {
                users.register(text(request, "login"), rawText(request, "password"),
                        text(request, "nickname"), rawText(request, "avatar"));
                yield ControlResponses.ok();
            }
            case LOGIN -> {
                UserProfile profile = users.authenticate(text(request, "login"), rawText(request, "password"));
                IssuedSession issued = sessions.createSession(profile.login());
                yield sessionResponse(profile, issued.token(), issued.expiresAt());
            }
            case RESUME_SESSION -> resumeSession(request);
            case FIND_USER -> findUser(request);
            case HEARTBEAT -> {
                calls.markActivity(user.login());
                yield ControlResponses.ok();
            }
            case STATUS -> ControlResponses.ok(Map.of("login", user.login(), "online", sessions.isOnline(user.login())));
            case LOGOUT -> {
                calls.cleanupForUser(user.login());
                sessions.invalidate(user);
                yield ControlResponses.ok();
            }
            case RELEASE_CALL_STATE -> {
                calls.cleanupForUser(user.login());
                yield ControlResponses.ok();
            }
            case PRESENCE_OFFLINE -> {
                sessions.softOffline(user);
                yield ControlResponses.ok();
            }
            case POLL_EVENTS -> {
                calls.markActivity(user.login());
                List<Map<String, Object>> events = outbox.drain(user.login()).stream()
                        .map(PendingEvent::toWire)
                        .toList();
                yield ControlResponses.ok(Map.of("events", events));
            }
            case CALL_USER -> {
                calls.startCall(user.login(), text(request, "to_user")).orThrow();
                yield ControlResponses.ok();
            }
            case ACCEPT_CALL -> callResult(calls.acceptCall(user.login(), text(request, "from_user")));
            case DECLINE_CALL -> callResult(calls.declineCall(user.login(), text(request, "from_user")));
            case END_CALL -> callResult(calls.endCall(user.login(), text(request, "with_user")));
            case SET_CHANNEL_VOICE_PRESENCE -> {
                voicePresence.setPresence(user.login(), channelId(request),
                        request.path("speaking").asBoolean(false),
                        request.path("joined").asBoolean(true));
                yield ControlResponses.ok();
            }
            case LEAVE_CHANNEL_VOICE -> {
                voicePresence.leave(user.login(), channelId(request));
                yield ControlResponses.ok();
            }
            case GET_CHANNEL_VOICE_PARTICIPANTS -> {
                List<VoiceParticipantDto> participants =
                        voicePresence.listParticipants(channelId(request), user.login());
                yield ControlResponses.ok(Map.of("participants", participants));
            }
        };
    }

    private Map<String, Object> resumeSession(JsonNode request) {
        AuthenticatedUser resumed = sessions.validate(text(request, "token"))
                .orElseThrow(() -> new ServiceException(ErrorKind.AUTH_INVALID, "Session is no longer valid"));
        sessions.touch(resumed);
        UserProfile profile = users.findProfile(resumed.login())
                .orElseGet(() -> UserProfile.placeholder(resumed.login()));
        return sessionResponse(profile, resumed.token(), resumed.expiresAt());
    }

    private Map<String, Object> findUser(JsonNode request) {
        String target = text(request, "target_login");
        if (target.isEmpty()) {
            target = text(request, "login");
        }
        if (target.isEmpty()) {
            throw new ServiceException(ErrorKind.MALFORMED, "User login is not specified");
        }
        UserProfile profile = users.findProfile(target)
                .orElseThrow(() -> new ServiceException(ErrorKind.NOT_FOUND, "User not found"));
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("login", profile.login());
        fields.put("nickname", profile.nickname());
        fields.put("avatar", profile.avatar());
        fields.put("online", sessions.isOnline(profile.login()));
        return ControlResponses.ok(fields);
    }

    private static Map<String, Object> sessionResponse(UserProfile profile, String token, Instant expiresAt) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("login", profile.login());
        fields.put("nickname", profile.nickname());
        fields.put("avatar", profile.avatar());
        fields.put("token", token);
        fields.put("expires_at", expiresAt.toString());
        return ControlResponses.ok(fields);
    }

    private static Map<String, Object> callResult(boolean applied) {
        if (!applied) {
            throw new ServiceException(ErrorKind.NOT_FOUND, "No matching call");
        }
        return ControlResponses.ok();
    }

    private static long channelId(JsonNode request) {
        return request.path("channel_id").asLong(0);
    }

    private static String text(JsonNode request, String field) {
        return rawText(request, field).trim();
    }

    private static String rawText(JsonNode request, String field) {
        JsonNode node = request.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        return node.asText();
    }
}
