package com.voxlink.servicebackend.relay;

import java.util.Optional;

/**
 * What the relay asks the rest of the service before changing routing state.
 */
public interface RelayAccessPolicy {

    /**
     * @return the login of a live session token, empty for anything else
     */
    Optional<String> loginForToken(String token);

    boolean canJoinRoom(String login, long channelId);

    /**
     * True only for friends with an active call between them.
     */
    boolean canPair(String userA, String userB);

    /**
     * In-memory call check, cheap enough for every audio frame.
     */
    boolean callActive(String userA, String userB);
}
