package com.voxlink.servicebackend.channel;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed {@link ChannelDirectory} for unit tests.
 */
public class InMemoryChannelDirectory implements ChannelDirectory {
    private final Map<Long, String> owners = new HashMap<>();
    private final Map<Long, ChannelRole> voiceMin = new HashMap<>();
    private final Map<Long, ChannelRole> textMin = new HashMap<>();
    private final Map<Long, Map<String, ChannelRole>> members = new HashMap<>();
    private int roleOfCalls;
    private int rolesOfCalls;

    public InMemoryChannelDirectory channel(long id, String owner, ChannelRole textMinRole, ChannelRole voiceMinRole) {
        owners.put(id, owner);
        textMin.put(id, textMinRole);
        voiceMin.put(id, voiceMinRole);
        members.computeIfAbsent(id, k -> new HashMap<>()).put(owner, ChannelRole.MEMBER);
        return this;
    }

    public InMemoryChannelDirectory member(long id, String login, ChannelRole role) {
        members.computeIfAbsent(id, k -> new HashMap<>()).put(login, role);
        return this;
    }

    @Override
    public Optional<String> ownerOf(long channelId) {
        return Optional.ofNullable(owners.get(channelId));
    }

    @Override
    public Optional<ChannelRole> roleOf(long channelId, String login) {
        roleOfCalls++;
        if (!owners.containsKey(channelId) || login == null) {
            return Optional.empty();
        }
        if (login.equals(owners.get(channelId))) {
            return Optional.of(ChannelRole.OWNER);
        }
        return Optional.ofNullable(members.getOrDefault(channelId, Map.of()).get(login));
    }

    @Override
    public Map<String, ChannelRole> rolesOf(long channelId, Collection<String> logins) {
        rolesOfCalls++;
        if (!owners.containsKey(channelId)) {
            return Map.of();
        }
        Map<String, ChannelRole> roles = new HashMap<>();
        Map<String, ChannelRole> channel = members.getOrDefault(channelId, Map.of());
        for (String login : logins) {
            if (login.equals(owners.get(channelId))) {
                roles.put(login, ChannelRole.OWNER);
            } else if (channel.containsKey(login)) {
                roles.put(login, channel.get(login));
            }
        }
        return roles;
    }

    public int roleOfCalls() {
        return roleOfCalls;
    }

    public int rolesOfCalls() {
        return rolesOfCalls;
    }

    @Override
    public Optional<ChannelRole> voiceMinRole(long channelId) {
        return Optional.ofNullable(voiceMin.get(channelId));
    }

    @Override
    public Optional<ChannelRole> textMinRole(long channelId) {
        return Optional.ofNullable(textMin.get(channelId));
    }
}
