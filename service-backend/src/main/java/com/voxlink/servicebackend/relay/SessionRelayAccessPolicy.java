package com.voxlink.servicebackend.relay;

import com.voxlink.servicebackend.call.CallSignalingEngine;
import com.voxlink.servicebackend.channel.ChannelAccessPolicy;
import com.voxlink.servicebackend.security.AuthenticatedUser;
import com.voxlink.servicebackend.session.SessionManager;
import com.voxlink.servicebackend.social.FriendDirectory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class SessionRelayAccessPolicy implements RelayAccessPolicy {
    private final SessionManager sessions;
    private final ChannelAccessPolicy channelAccess;
    private final FriendDirectory friends;
    private final CallSignalingEngine calls;

    public SessionRelayAccessPolicy(SessionManager sessions,
                                    ChannelAccessPolicy channelAccess,
                                    FriendDirectory friends,
                                    CallSignalingEngine calls) {
        this.sessions = sessions;
        this.channelAccess = channelAccess;
        this.friends = friends;
        this.calls = calls;
    }

    @Override
    public Optional<String> loginForToken(String token) {
        return sessions.validate(token).map(AuthenticatedUser::login);
    }

    @Override
    public boolean canJoinRoom(String login, long channelId) {
        return channelAccess.canJoinVoice(login, channelId);
    }

    @Override
    public boolean canPair(String userA, String userB) {
        return calls.isActivePair(userA, userB) && friends.areFriends(userA, userB);
    }

    @Override
    public boolean callActive(String userA, String userB) {
        return calls.isActivePair(userA, userB);
    }
}
