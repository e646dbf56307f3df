package com.voxlink.servicebackend.call;

import com.voxlink.servicebackend.common.ErrorKind;
import com.voxlink.servicebackend.common.Outcome;
import com.voxlink.servicebackend.event.EventOutbox;
import com.voxlink.servicebackend.event.EventType;
import com.voxlink.servicebackend.session.PresenceDirectory;
import com.voxlink.servicebackend.social.FriendDirectory;
import com.voxlink.servicebackend.user.UserCredentialService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One-to-one call state: RINGING on {@code startCall}, ACTIVE once the callee accepts,
 * gone after decline, end, cleanup or staleness.
 *
 * <p>A login belongs to at most one pair. Liveness is tracked per side; a pair where
 * either side has been silent for longer than {@code staleAfter} is removed by
 * {@link #pruneStale()} and both sides get {@code call_ended} from {@code system}.
 * Events are queued after the state lock is released.
 */
public class CallSignalingEngine {
    private static final Logger log = LoggerFactory.getLogger(CallSignalingEngine.class);

    static final String SYSTEM = "system";

    private final UserCredentialService users;
    private final FriendDirectory friends;
    private final PresenceDirectory presence;
    private final EventOutbox outbox;
    private final Duration staleAfter;
    private final Clock clock;

    private final Object lock = new Object();
    // login -> pair; both members map to the same instance
    private final Map<String, CallPair> pairs = new HashMap<>();

    public CallSignalingEngine(UserCredentialService users,
                               FriendDirectory friends,
                               PresenceDirectory presence,
                               EventOutbox outbox,
                               Duration staleAfter,
                               Clock clock) {
        this.users = users;
        this.friends = friends;
        this.presence = presence;
        this.outbox = outbox;
        this.staleAfter = staleAfter;
        this.clock = clock;
    }

    public Outcome startCall(String caller, String callee) {
        pruneStale();

        if (isBlank(caller) || isBlank(callee)) {
            return Outcome.failure(ErrorKind.MALFORMED, "Callee is not specified");
        }
        if (caller.equals(callee)) {
            return Outcome.failure(ErrorKind.MALFORMED, "You cannot call yourself");
        }
        if (!users.userExists(callee)) {
            return Outcome.failure(ErrorKind.NOT_FOUND, "User not found");
        }
        if (!friends.areFriends(caller, callee)) {
            return Outcome.failure(ErrorKind.FORBIDDEN, "You can only call friends");
        }
        if (!presence.isOnline(callee)) {
            return Outcome.failure(ErrorKind.CONFLICT, "User is offline");
        }

        synchronized (lock) {
            if (pairs.containsKey(caller) || pairs.containsKey(callee)) {
                return Outcome.failure(ErrorKind.CONFLICT, "User is busy");
            }
            CallPair pair = new CallPair(caller, callee, clock.instant());
            pairs.put(caller, pair);
            pairs.put(callee, pair);
        }

        log.info("Call ringing: '{}' -> '{}'", caller, callee);
        outbox.push(callee, EventType.INCOMING_CALL, Map.of("from_user", caller));
        return Outcome.ok();
    }

    /**
     * Promotes the ringing pair placed by {@code caller} to {@code acceptor}. Fails
     * without side effects when there is no such ringing pair.
     */
    public boolean acceptCall(String acceptor, String caller) {
        pruneStale();

        synchronized (lock) {
            CallPair pair = pairOf(acceptor, caller);
            if (pair == null || pair.status() != CallStatus.RINGING || !pair.caller().equals(caller)) {
                return false;
            }
            pair.activate(clock.instant());
        }

        log.info("Call active: '{}' <-> '{}'", caller, acceptor);
        outbox.push(caller, EventType.CALL_ACCEPTED, Map.of("by_user", acceptor, "with_user", acceptor));
        outbox.push(acceptor, EventType.CALL_STARTED, Map.of("with_user", caller));
        return true;
    }

    public boolean declineCall(String decliner, String caller) {
        pruneStale();

        if (!removePair(decliner, caller)) {
            return false;
        }
        log.info("Call declined by '{}' (caller '{}')", decliner, caller);
        outbox.push(caller, EventType.CALL_DECLINED, Map.of("by_user", decliner));
        return true;
    }

    public boolean endCall(String user, String other) {
        pruneStale();

        if (!removePair(user, other)) {
            return false;
        }
        log.info("Call ended by '{}' (peer '{}')", user, other);
        outbox.push(other, EventType.CALL_ENDED, Map.of("with_user", user, "by_user", user));
        return true;
    }

    public void markActivity(String login) {
        if (isBlank(login)) {
            return;
        }
        synchronized (lock) {
            CallPair pair = pairs.get(login);
            if (pair != null) {
                pair.touch(login, clock.instant());
            }
        }
    }

    /**
     * Removes every pair with a side silent for longer than the stale threshold.
     *
     * @return the number of pairs removed
     */
    public int pruneStale() {
        Instant cutoff = clock.instant().minus(staleAfter);
        List<CallPair> stale = new ArrayList<>();

        synchronized (lock) {
            Set<CallPair> seen = new HashSet<>();
            for (CallPair pair : pairs.values()) {
                if (seen.add(pair) && pair.silentSince(cutoff)) {
                    stale.add(pair);
                }
            }
            for (CallPair pair : stale) {
                pairs.remove(pair.caller());
                pairs.remove(pair.callee());
            }
        }

        for (CallPair pair : stale) {
            log.info("Released stale call '{}' <-> '{}' ({})", pair.caller(), pair.callee(), pair.status());
            outbox.push(pair.caller(), EventType.CALL_ENDED, Map.of("with_user", pair.callee(), "by_user", SYSTEM));
            outbox.push(pair.callee(), EventType.CALL_ENDED, Map.of("with_user", pair.caller(), "by_user", SYSTEM));
        }
        return stale.size();
    }

    /**
     * Drops whatever pair {@code login} is in, ringing or active, and tells the peer.
     */
    public boolean cleanupForUser(String login) {
        String peer;
        synchronized (lock) {
            CallPair pair = pairs.get(login);
            if (pair == null) {
                return false;
            }
            peer = pair.peerOf(login);
            pairs.remove(login);
            pairs.remove(peer);
        }
        log.info("Released call state of '{}' (peer '{}')", login, peer);
        outbox.push(peer, EventType.CALL_ENDED, Map.of("with_user", login, "by_user", login));
        return true;
    }

    public boolean isActivePair(String a, String b) {
        synchronized (lock) {
            CallPair pair = pairOf(a, b);
            return pair != null && pair.status() == CallStatus.ACTIVE;
        }
    }

    public Optional<String> peerOf(String login) {
        synchronized (lock) {
            CallPair pair = pairs.get(login);
            return pair == null ? Optional.empty() : Optional.of(pair.peerOf(login));
        }
    }

    public Optional<CallStatus> statusOf(String login) {
        synchronized (lock) {
            CallPair pair = pairs.get(login);
            return pair == null ? Optional.empty() : Optional.of(pair.status());
        }
    }

    public int pairCount() {
        synchronized (lock) {
            return pairs.size() / 2;
        }
    }

    private boolean removePair(String a, String b) {
        synchronized (lock) {
            if (pairOf(a, b) == null) {
                return false;
            }
            pairs.remove(a);
            pairs.remove(b);
            return true;
        }
    }

    // caller holds lock
    private CallPair pairOf(String a, String b) {
        if (isBlank(a) || isBlank(b) || a.equals(b)) {
            return null;
        }
        CallPair pair = pairs.get(a);
        if (pair == null || !b.equals(pair.peerOf(a))) {
            return null;
        }
        return pair;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Mutable pair state, only touched under the engine lock.
     */
    static final class CallPair {
        private final String caller;
        private final String callee;
        private final Instant createdAt;
        private CallStatus status = CallStatus.RINGING;
        private Instant updatedAt;
        private Instant callerActivity;
        private Instant calleeActivity;

        CallPair(String caller, String callee, Instant now) {
            this.caller = caller;
            this.callee = callee;
            this.createdAt = now;
            this.updatedAt = now;
            this.callerActivity = now;
            this.calleeActivity = now;
        }

        String caller() {
            return caller;
        }

        String callee() {
            return callee;
        }

        CallStatus status() {
            return status;
        }

        Instant createdAt() {
            return createdAt;
        }

        Instant updatedAt() {
            return updatedAt;
        }

        String peerOf(String login) {
            return caller.equals(login) ? callee : caller;
        }

        void activate(Instant now) {
            status = CallStatus.ACTIVE;
            updatedAt = now;
            callerActivity = now;
            calleeActivity = now;
        }

        void touch(String login, Instant now) {
            if (caller.equals(login)) {
                callerActivity = now;
            } else if (callee.equals(login)) {
                calleeActivity = now;
            }
        }

        boolean silentSince(Instant cutoff) {
            return callerActivity.isBefore(cutoff) || calleeActivity.isBefore(cutoff);
        }
    }
}
