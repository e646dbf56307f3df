package com.voxlink.servicebackend.voice;

import com.voxlink.servicebackend.channel.ChannelAccessPolicy;
import com.voxlink.servicebackend.channel.ChannelDirectory;
import com.voxlink.servicebackend.channel.ChannelRole;
import com.voxlink.servicebackend.common.ErrorKind;
import com.voxlink.servicebackend.common.ServiceException;
import com.voxlink.servicebackend.session.PresenceDirectory;
import com.voxlink.servicebackend.user.UserCredentialService;
import com.voxlink.servicebackend.user.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Channel voice room membership held as short leases. A lease not refreshed within the
 * TTL is treated as gone and is dropped on the next access to its channel or by
 * {@link #sweep()}.
 */
public class VoicePresenceService {
    private static final Logger log = LoggerFactory.getLogger(VoicePresenceService.class);

    private static final Comparator<VoiceParticipantDto> LISTING_ORDER =
            Comparator.comparing(VoiceParticipantDto::isSpeaking).reversed()
                    .thenComparing(p -> p.getNickname().toLowerCase(Locale.ROOT))
                    .thenComparing(p -> p.getLogin().toLowerCase(Locale.ROOT));

    private final ChannelAccessPolicy accessPolicy;
    private final ChannelDirectory channels;
    private final UserCredentialService users;
    private final PresenceDirectory presence;
    private final Duration ttl;
    private final Clock clock;

    private final Object lock = new Object();
    // channel id -> login -> lease
    private final Map<Long, Map<String, Lease>> leases = new HashMap<>();

    public VoicePresenceService(ChannelAccessPolicy accessPolicy,
                                ChannelDirectory channels,
                                UserCredentialService users,
                                PresenceDirectory presence,
                                Duration ttl,
                                Clock clock) {
        this.accessPolicy = accessPolicy;
        this.channels = channels;
        this.users = users;
        this.presence = presence;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Refreshes (or, with {@code joined = false}, removes) the caller's lease.
     *
     * @throws ServiceException {@code MALFORMED} for a non-positive channel id,
     *                          {@code FORBIDDEN} for non-members or a join below the voice role
     */
    public void setPresence(String login, long channelId, boolean speaking, boolean joined) {
        requireChannelId(channelId);
        if (!accessPolicy.isMember(login, channelId)) {
            throw new ServiceException(ErrorKind.FORBIDDEN, "No access to channel");
        }
        if (joined && !accessPolicy.canJoinVoice(login, channelId)) {
            throw new ServiceException(ErrorKind.FORBIDDEN, "Your role does not allow joining voice in this channel");
        }

        Instant now = clock.instant();
        synchronized (lock) {
            pruneChannel(channelId, now);
            if (!joined) {
                removeLease(channelId, login);
                return;
            }
            Lease previous = leases.computeIfAbsent(channelId, k -> new HashMap<>())
                    .put(login, new Lease(speaking, now));
            if (previous == null) {
                log.info("'{}' joined voice in channel {}", login, channelId);
            }
        }
    }

    public void leave(String login, long channelId) {
        requireChannelId(channelId);
        synchronized (lock) {
            if (removeLease(channelId, login)) {
                log.info("'{}' left voice in channel {}", login, channelId);
            }
        }
    }

    public List<VoiceParticipantDto> listParticipants(long channelId, String requester) {
        requireChannelId(channelId);
        if (!accessPolicy.isMember(requester, channelId)) {
            throw new ServiceException(ErrorKind.FORBIDDEN, "No access to channel");
        }
        if (channels.ownerOf(channelId).isEmpty()) {
            throw new ServiceException(ErrorKind.NOT_FOUND, "Channel not found");
        }

        Map<String, Lease> snapshot;
        synchronized (lock) {
            pruneChannel(channelId, clock.instant());
            Map<String, Lease> channel = leases.get(channelId);
            snapshot = channel == null ? Map.of() : new HashMap<>(channel);
        }
        if (snapshot.isEmpty()) {
            return List.of();
        }

        Map<String, UserProfile> profiles = users.findProfiles(snapshot.keySet());
        Set<String> online = presence.onlineAmong(snapshot.keySet());
        Map<String, ChannelRole> roles = channels.rolesOf(channelId, snapshot.keySet());

        List<VoiceParticipantDto> participants = new ArrayList<>(snapshot.size());
        snapshot.forEach((login, lease) -> {
            UserProfile profile = profiles.getOrDefault(login, UserProfile.placeholder(login));
            ChannelRole role = roles.getOrDefault(login, ChannelRole.MEMBER);
            participants.add(new VoiceParticipantDto(
                    login,
                    profile.nickname() == null || profile.nickname().isBlank() ? login : profile.nickname(),
                    profile.avatar() == null ? "" : profile.avatar(),
                    role.wireName(),
                    lease.speaking(),
                    online.contains(login)
            ));
        });
        participants.sort(LISTING_ORDER);
        return participants;
    }

    /**
     * Drops expired leases in every channel.
     *
     * @return the number of leases removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        synchronized (lock) {
            for (Long channelId : new ArrayList<>(leases.keySet())) {
                removed += pruneChannel(channelId, now);
            }
        }
        if (removed > 0) {
            log.debug("Expired {} voice lease(s)", removed);
        }
        return removed;
    }

    public int activeLeaseCount() {
        synchronized (lock) {
            return leases.values().stream().mapToInt(Map::size).sum();
        }
    }

    // caller holds lock
    private int pruneChannel(long channelId, Instant now) {
        Map<String, Lease> channel = leases.get(channelId);
        if (channel == null) {
            return 0;
        }
        Instant cutoff = now.minus(ttl);
        int before = channel.size();
        channel.values().removeIf(lease -> lease.lastSeen().isBefore(cutoff));
        if (channel.isEmpty()) {
            leases.remove(channelId);
        }
        return before - channel.size();
    }

    // caller holds lock
    private boolean removeLease(long channelId, String login) {
        Map<String, Lease> channel = leases.get(channelId);
        if (channel == null) {
            return false;
        }
        boolean removed = channel.remove(login) != null;
        if (channel.isEmpty()) {
            leases.remove(channelId);
        }
        return removed;
    }

    private static void requireChannelId(long channelId) {
        if (channelId <= 0) {
            throw new ServiceException(ErrorKind.MALFORMED, "Channel is not specified");
        }
    }

    private record Lease(boolean speaking, Instant lastSeen) {
    }
}
