package com.voxlink.servicebackend.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class JpaChannelDirectory implements ChannelDirectory {
    private static final Logger log = LoggerFactory.getLogger(JpaChannelDirectory.class);

    private final ChannelRepository channels;
    private final ChannelMemberRepository members;
    private final Clock clock;

    public JpaChannelDirectory(ChannelRepository channels, ChannelMemberRepository members, Clock clock) {
        this.channels = channels;
        this.members = members;
        this.clock = clock;
    }

    @Override
    public Optional<String> ownerOf(long channelId) {
        return channels.findById(channelId).map(Channel::getOwnerLogin);
    }

    @Override
    public Optional<ChannelRole> roleOf(long channelId, String login) {
        if (login == null) {
            return Optional.empty();
        }
        Optional<Channel> channel = channels.findById(channelId);
        if (channel.isEmpty()) {
            return Optional.empty();
        }
        if (login.equals(channel.get().getOwnerLogin())) {
            return Optional.of(ChannelRole.OWNER);
        }
        return members.findByChannelIdAndLogin(channelId, login)
                .map(member -> ChannelRole.parseAssignable(member.getRole()));
    }

    @Override
    public Map<String, ChannelRole> rolesOf(long channelId, Collection<String> logins) {
        Optional<Channel> channel = channels.findById(channelId);
        if (channel.isEmpty() || logins.isEmpty()) {
            return Map.of();
        }
        Map<String, ChannelRole> roles = new HashMap<>();
        for (ChannelMember member : members.findByChannelIdAndLoginIn(channelId, logins)) {
            roles.put(member.getLogin(), ChannelRole.parseAssignable(member.getRole()));
        }
        String owner = channel.get().getOwnerLogin();
        if (logins.contains(owner)) {
            roles.put(owner, ChannelRole.OWNER);
        }
        return roles;
    }

    @Override
    public Optional<ChannelRole> voiceMinRole(long channelId) {
        return channels.findById(channelId).map(c -> ChannelRole.parseAssignable(c.getVoiceMinRole()));
    }

    @Override
    public Optional<ChannelRole> textMinRole(long channelId) {
        return channels.findById(channelId).map(c -> ChannelRole.parseAssignable(c.getTextMinRole()));
    }

    /**
     * Creates a channel with its owner as the first member.
     */
    @Transactional
    public Channel createChannel(String name, String ownerLogin, ChannelRole textMinRole, ChannelRole voiceMinRole) {
        Channel channel = channels.save(new Channel(
                name,
                ownerLogin,
                ChannelRole.parseAssignable(textMinRole.wireName()).wireName(),
                ChannelRole.parseAssignable(voiceMinRole.wireName()).wireName(),
                clock.instant()
        ));
        members.save(new ChannelMember(channel.getId(), ownerLogin, ChannelRole.MEMBER.wireName(), clock.instant()));
        log.info("Channel {} '{}' created by '{}'", channel.getId(), name, ownerLogin);
        return channel;
    }

    @Transactional
    public void addMember(long channelId, String login, ChannelRole role) {
        ChannelMember member = members.findByChannelIdAndLogin(channelId, login)
                .orElseGet(() -> new ChannelMember(channelId, login, role.wireName(), clock.instant()));
        member.setRole(ChannelRole.parseAssignable(role.wireName()).wireName());
        members.save(member);
    }
}
