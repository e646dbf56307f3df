package com.voxlink.servicebackend.channel;

import java.util.Locale;

/**
 * Channel roles ordered by rank. {@link #OWNER} is never stored; it is derived from
 * the channel's owner login.
 */
public enum ChannelRole {
    MEMBER("member", 1),
    MODERATOR("moderator", 2),
    ADMIN("admin", 3),
    OWNER("owner", 4);

    private final String wireName;
    private final int rank;

    ChannelRole(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    public String wireName() {
        return wireName;
    }

    public int rank() {
        return rank;
    }

    public boolean atLeast(ChannelRole required) {
        return rank >= required.rank;
    }

    /**
     * Normalizes a stored member role or a minimum-access setting. Only member,
     * moderator and admin are assignable; anything else, owner included, reads as member.
     */
    public static ChannelRole parseAssignable(String raw) {
        if (raw == null) {
            return MEMBER;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "moderator" -> MODERATOR;
            case "admin" -> ADMIN;
            default -> MEMBER;
        };
    }
}
