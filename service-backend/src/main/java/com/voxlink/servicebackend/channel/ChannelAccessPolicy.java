package com.voxlink.servicebackend.channel;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Role gates for channel voice and text. The owner always passes; non-members never do.
 */
@Component
public class ChannelAccessPolicy {
    private final ChannelDirectory directory;

    public ChannelAccessPolicy(ChannelDirectory directory) {
        this.directory = directory;
    }

    public boolean isMember(String login, long channelId) {
        return directory.roleOf(channelId, login).isPresent();
    }

    public boolean canJoinVoice(String login, long channelId) {
        return passes(directory.roleOf(channelId, login), directory.voiceMinRole(channelId));
    }

    public boolean canSendText(String login, long channelId) {
        return passes(directory.roleOf(channelId, login), directory.textMinRole(channelId));
    }

    private static boolean passes(Optional<ChannelRole> role, Optional<ChannelRole> required) {
        if (role.isEmpty() || required.isEmpty()) {
            return false;
        }
        return role.get().atLeast(required.get());
    }
}
