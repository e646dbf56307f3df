package com.voxlink.servicebackend.social;

public interface FriendDirectory {
    /**
     * False for blank logins and for a login paired with itself.
     */
    boolean areFriends(String userA, String userB);
}
