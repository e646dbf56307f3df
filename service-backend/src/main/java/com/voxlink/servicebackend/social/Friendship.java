package com.voxlink.servicebackend.social;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Mutual friendship stored once per pair, logins in ascending order.
 */
@Entity
@Table(name = "friendships",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_friendships_pair", columnNames = {"user_low", "user_high"})
        })
public class Friendship {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_low", nullable = false, length = 64)
    private String userLow;

    @Column(name = "user_high", nullable = false, length = 64)
    private String userHigh;

    @Column(nullable = false)
    private Instant createdAt;

    protected Friendship() {
    }

    public Friendship(String userLow, String userHigh, Instant createdAt) {
        this.userLow = userLow;
        this.userHigh = userHigh;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getUserLow() {
        return userLow;
    }

    public String getUserHigh() {
        return userHigh;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
