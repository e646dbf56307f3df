package com.voxlink.servicebackend.security;

import java.security.Principal;
import java.time.Instant;

/**
 * Per-request identity resolved from a session token. Passed explicitly to every
 * authenticated operation; there is no ambient "current user".
 */
public record AuthenticatedUser(String login, String sessionId, String token, Instant expiresAt) implements Principal {
    @Override
    public String getName() {
        return login;
    }
}
