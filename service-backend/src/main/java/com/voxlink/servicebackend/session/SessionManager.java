package com.voxlink.servicebackend.session;

import com.voxlink.servicebackend.common.ErrorKind;
import com.voxlink.servicebackend.common.ServiceException;
import com.voxlink.servicebackend.security.AuthenticatedUser;
import com.voxlink.servicebackend.security.JwtService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues and validates session tokens and derives online presence from last-seen times.
 *
 * <p>Presence is never stored as a flag: a login is online while one of its unexpired
 * sessions was created or seen within the online window. Frequent pollers would turn
 * every request into a write, so {@link #touch(AuthenticatedUser)} writes at most once
 * per {@code touchMinInterval} per session.
 */
@Service
public class SessionManager implements PresenceDirectory {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final UserSessionRepository repository;
    private final JwtService jwtService;
    private final SessionProperties properties;
    private final Clock clock;

    // session id -> time of the last successful last_seen write
    private final ConcurrentHashMap<String, Instant> touchCache = new ConcurrentHashMap<>();

    public SessionManager(UserSessionRepository repository,
                          JwtService jwtService,
                          SessionProperties properties,
                          Clock clock) {
        this.repository = repository;
        this.jwtService = jwtService;
        this.properties = properties;
        this.clock = clock;
    }

    public IssuedSession createSession(String login) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(properties.ttl());
        String sessionId = UUID.randomUUID().toString();

        repository.save(new UserSession(sessionId, login, now, expiresAt));
        String token = jwtService.generateToken(login, sessionId, now, expiresAt);
        log.info("Session created for '{}' (expires {})", login, expiresAt);
        return new IssuedSession(token, login, expiresAt);
    }

    /**
     * Resolves a token to its login. Missing, forged, unknown, revoked and expired
     * tokens all resolve to empty.
     */
    public Optional<AuthenticatedUser> validate(String token) {
        return jwtService.parse(token).flatMap(claims -> {
            Optional<UserSession> row = repository.findById(claims.sessionId());
            if (row.isEmpty()) {
                return Optional.empty();
            }
            UserSession session = row.get();
            if (!session.getLogin().equals(claims.login())) {
                log.warn("Session {} presented with mismatched login '{}'", session.getId(), claims.login());
                return Optional.empty();
            }
            if (session.isExpired(clock.instant())) {
                repository.delete(session);
                touchCache.remove(session.getId());
                return Optional.empty();
            }
            return Optional.of(new AuthenticatedUser(session.getLogin(), session.getId(), token, session.getExpiresAt()));
        });
    }

    /**
     * Validates and touches in one step, failing closed.
     *
     * @throws ServiceException {@link ErrorKind#AUTH_REQUIRED} without a token,
     *                          {@link ErrorKind#AUTH_INVALID} for a token that does not resolve
     */
    public AuthenticatedUser require(String token) {
        if (token == null || token.isBlank()) {
            throw new ServiceException(ErrorKind.AUTH_REQUIRED, "Authorization required");
        }
        AuthenticatedUser user = validate(token)
                .orElseThrow(() -> new ServiceException(ErrorKind.AUTH_INVALID,
                        "Session is no longer valid. Please sign in again."));
        touch(user);
        return user;
    }

    public void touch(AuthenticatedUser user) {
        Instant now = clock.instant();
        String sessionId = user.sessionId();

        Instant previous = touchCache.get(sessionId);
        if (previous != null && now.isBefore(previous.plus(properties.touchMinInterval()))) {
            return;
        }
        touchCache.put(sessionId, now);
        try {
            repository.updateLastSeen(sessionId, now);
        } catch (DataAccessException e) {
            // let the next request retry the write
            touchCache.remove(sessionId);
            log.warn("Failed to touch session {}: {}", sessionId, e.getMessage());
        }
    }

    public void invalidate(AuthenticatedUser user) {
        repository.deleteById(user.sessionId());
        touchCache.remove(user.sessionId());
        log.info("Session {} of '{}' invalidated", user.sessionId(), user.login());
    }

    /**
     * Pushes last-seen outside the online window while keeping the token usable for
     * a later {@code resume_session}.
     */
    public void softOffline(AuthenticatedUser user) {
        Instant outside = clock.instant()
                .minus(properties.onlineWindow())
                .minusSeconds(5);
        repository.updateLastSeen(user.sessionId(), outside);
        touchCache.remove(user.sessionId());
        log.debug("Session {} of '{}' marked offline", user.sessionId(), user.login());
    }

    @Override
    public boolean isOnline(String login) {
        if (login == null || login.isBlank()) {
            return false;
        }
        Instant now = clock.instant();
        return repository.countOnline(login, now, now.minus(properties.onlineWindow())) > 0;
    }

    @Override
    public Set<String> onlineAmong(Collection<String> logins) {
        if (logins.isEmpty()) {
            return Set.of();
        }
        Instant now = clock.instant();
        return new HashSet<>(repository.findOnlineLogins(logins, now, now.minus(properties.onlineWindow())));
    }

    public int purgeExpired() {
        Instant now = clock.instant();
        touchCache.values().removeIf(touchedAt -> touchedAt.isBefore(now.minus(properties.touchMinInterval())));
        int removed = repository.deleteExpired(now);
        if (removed > 0) {
            log.info("Purged {} expired session(s)", removed);
        }
        return removed;
    }

    public record IssuedSession(String token, String login, Instant expiresAt) {
    }
}
