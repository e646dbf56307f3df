package com.voxlink.servicebackend.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routing tables of the relay, all guarded by one lock: bound endpoints (with the
 * reverse address map), private pairs and channel rooms.
 *
 * <p>A login has at most one endpoint, at most one pair and at most one room. Nothing
 * here performs I/O.
 */
public class RelayState {
    private static final Logger log = LoggerFactory.getLogger(RelayState.class);

    private final Object lock = new Object();

    private final Map<String, Endpoint> endpoints = new HashMap<>();
    private final Map<InetSocketAddress, String> loginsByAddress = new HashMap<>();
    // login -> peer, stored in both directions
    private final Map<String, String> pairs = new HashMap<>();
    private final Map<Long, Set<String>> rooms = new HashMap<>();
    private final Map<String, Long> roomOf = new HashMap<>();

    /**
     * Binds {@code login} to {@code address}, replacing any previous address of the login
     * and any previous login at the address.
     */
    public void bind(String login, InetSocketAddress address, Instant now) {
        synchronized (lock) {
            Endpoint previous = endpoints.get(login);
            if (previous != null && !previous.address().equals(address)) {
                loginsByAddress.remove(previous.address());
                log.debug("'{}' moved from {} to {}", login, previous.address(), address);
            }
            String displaced = loginsByAddress.put(address, login);
            if (displaced != null && !displaced.equals(login)) {
                endpoints.remove(displaced);
                removeFromRoom(displaced);
                removePair(displaced);
            }
            endpoints.put(login, new Endpoint(address, now));
        }
    }

    public boolean isBoundTo(InetSocketAddress address, String login) {
        synchronized (lock) {
            return login != null && login.equals(loginsByAddress.get(address));
        }
    }

    public Optional<String> loginAt(InetSocketAddress address) {
        synchronized (lock) {
            return Optional.ofNullable(loginsByAddress.get(address));
        }
    }

    /**
     * Refreshes the endpoint's last-seen time if {@code address} is bound to {@code login}.
     */
    public boolean touch(String login, InetSocketAddress address, Instant now) {
        synchronized (lock) {
            if (!login.equals(loginsByAddress.get(address))) {
                return false;
            }
            endpoints.put(login, new Endpoint(address, now));
            return true;
        }
    }

    public void joinRoom(String login, long roomId) {
        synchronized (lock) {
            Long current = roomOf.get(login);
            if (current != null && current == roomId) {
                return;
            }
            removeFromRoom(login);
            rooms.computeIfAbsent(roomId, k -> new HashSet<>()).add(login);
            roomOf.put(login, roomId);
        }
        log.info("'{}' joined relay room {}", login, roomId);
    }

    public boolean leaveRoom(String login, long roomId) {
        synchronized (lock) {
            Long current = roomOf.get(login);
            if (current == null || current != roomId) {
                return false;
            }
            removeFromRoom(login);
        }
        log.info("'{}' left relay room {}", login, roomId);
        return true;
    }

    /**
     * Pairs two logins, dropping any other pair either of them was in.
     */
    public void setPair(String userA, String userB) {
        synchronized (lock) {
            removePair(userA);
            removePair(userB);
            pairs.put(userA, userB);
            pairs.put(userB, userA);
        }
        log.info("Relay pair set: '{}' <-> '{}'", userA, userB);
    }

    public boolean clearPair(String userA, String userB) {
        synchronized (lock) {
            if (!userB.equals(pairs.get(userA))) {
                return false;
            }
            pairs.remove(userA);
            pairs.remove(userB);
        }
        log.info("Relay pair cleared: '{}' <-> '{}'", userA, userB);
        return true;
    }

    /**
     * Where audio from {@code login} goes: every other bound member of its room, else
     * its bound pair peer, else nowhere.
     */
    public List<InetSocketAddress> audioTargets(String login) {
        synchronized (lock) {
            Long roomId = roomOf.get(login);
            if (roomId != null) {
                List<InetSocketAddress> targets = new ArrayList<>();
                for (String member : rooms.getOrDefault(roomId, Set.of())) {
                    Endpoint endpoint = endpoints.get(member);
                    if (!member.equals(login) && endpoint != null) {
                        targets.add(endpoint.address());
                    }
                }
                return targets;
            }
            String peer = pairs.get(login);
            if (peer != null) {
                Endpoint endpoint = endpoints.get(peer);
                if (endpoint != null) {
                    return List.of(endpoint.address());
                }
            }
            return List.of();
        }
    }

    /**
     * Evicts endpoints last seen before {@code cutoff} together with their room and pair
     * membership.
     *
     * @return the evicted logins
     */
    public List<String> evictSilent(Instant cutoff) {
        List<String> evicted = new ArrayList<>();
        synchronized (lock) {
            var it = endpoints.entrySet().iterator();
            while (it.hasNext()) {
                var entry = it.next();
                if (entry.getValue().lastSeen().isBefore(cutoff)) {
                    String login = entry.getKey();
                    it.remove();
                    loginsByAddress.remove(entry.getValue().address(), login);
                    removeFromRoom(login);
                    removePair(login);
                    evicted.add(login);
                }
            }
        }
        return evicted;
    }

    public Optional<Long> roomOf(String login) {
        synchronized (lock) {
            return Optional.ofNullable(roomOf.get(login));
        }
    }

    public Optional<String> pairedWith(String login) {
        synchronized (lock) {
            return Optional.ofNullable(pairs.get(login));
        }
    }

    public int endpointCount() {
        synchronized (lock) {
            return endpoints.size();
        }
    }

    public int roomCount() {
        synchronized (lock) {
            return rooms.size();
        }
    }

    // caller holds lock
    private void removeFromRoom(String login) {
        Long roomId = roomOf.remove(login);
        if (roomId == null) {
            return;
        }
        Set<String> members = rooms.get(roomId);
        if (members != null) {
            members.remove(login);
            if (members.isEmpty()) {
                rooms.remove(roomId);
            }
        }
    }

    // caller holds lock
    private void removePair(String login) {
        String peer = pairs.remove(login);
        if (peer != null) {
            pairs.remove(peer, login);
        }
    }

    private record Endpoint(InetSocketAddress address, Instant lastSeen) {
    }
}
