package com.voxlink.servicebackend.user;

/**
 * Public part of an account: what other users see.
 */
public record UserProfile(String login, String nickname, String avatar) {

    public static UserProfile from(AppUser user) {
        return new UserProfile(user.getLogin(), user.getNickname(), user.getAvatar());
    }

    /**
     * Stand-in for a login that has no account row; the nickname falls back to the login.
     */
    public static UserProfile placeholder(String login) {
        return new UserProfile(login, login, "");
    }
}
