package com.voxlink.servicebackend.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Signs and parses session tokens. The token only carries the session id and login;
 * whether the session is still alive is decided by the session store.
 */
@Component
public class JwtService {
    private final JwtProperties properties;
    private final Key signingKey;
    private final Clock clock;

    public JwtService(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(String login, String sessionId, Instant issuedAt, Instant expiresAt) {
        return Jwts.builder()
                .setId(sessionId)
                .setSubject(login)
                .setIssuer(properties.issuer())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @return the claims of a well-formed, correctly signed, unexpired token; empty otherwise
     */
    public Optional<SessionClaims> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(clock.instant()))
                    .requireIssuer(properties.issuer())
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            if (claims.getId() == null || claims.getSubject() == null) {
                return Optional.empty();
            }
            return Optional.of(new SessionClaims(
                    claims.getId(),
                    claims.getSubject(),
                    claims.getExpiration().toInstant()));
        } catch (JwtException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public record SessionClaims(String sessionId, String login, Instant expiresAt) {
    }
}
