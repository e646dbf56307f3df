package com.voxlink.servicebackend.channel;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of channels and memberships consumed by voice presence and the relay.
 */
public interface ChannelDirectory {
    Optional<String> ownerOf(long channelId);

    /**
     * Effective role of {@code login}: {@link ChannelRole#OWNER} for the owner, the
     * normalized stored role for a member, empty for non-members and unknown channels.
     */
    Optional<ChannelRole> roleOf(long channelId, String login);

    /**
     * Effective roles for several logins in one lookup, with the same rules as
     * {@link #roleOf(long, String)}. Non-members are absent from the result.
     */
    Map<String, ChannelRole> rolesOf(long channelId, Collection<String> logins);

    Optional<ChannelRole> voiceMinRole(long channelId);

    Optional<ChannelRole> textMinRole(long channelId);
}
