package com.voxlink.servicebackend.session;

import java.util.Collection;
import java.util.Set;

/**
 * Derived online state, consumed by call signaling and voice participant listings.
 */
public interface PresenceDirectory {
    boolean isOnline(String login);

    Set<String> onlineAmong(Collection<String> logins);
}
