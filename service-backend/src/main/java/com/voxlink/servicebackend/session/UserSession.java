package com.voxlink.servicebackend.session;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "user_sessions",
        indexes = @Index(name = "ix_user_sessions_login", columnList = "login"))
public class UserSession {
    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String login;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant lastSeen;

    @Column(nullable = false)
    private Instant expiresAt;

    protected UserSession() {
    }

    public UserSession(String id, String login, Instant createdAt, Instant expiresAt) {
        this.id = id;
        this.login = login;
        this.createdAt = createdAt;
        this.lastSeen = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getId() {
        return id;
    }

    public String getLogin() {
        return login;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
