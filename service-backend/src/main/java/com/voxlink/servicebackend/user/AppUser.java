package com.voxlink.servicebackend.user;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "app_users",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_app_users_login", columnNames = "login")
        })
public class AppUser {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String login;

    @Column(nullable = false, length = 100)
    private String nickname;

    @Column(nullable = false, length = 512)
    private String avatar = "";

    @Column(nullable = false)
    private String passwordHash;

    @Column(nullable = false)
    private Instant createdAt;

    protected AppUser() {
    }

    public AppUser(String login, String nickname, String avatar, String passwordHash, Instant createdAt) {
        this.login = login;
        this.nickname = nickname;
        this.avatar = avatar == null ? "" : avatar;
        this.passwordHash = passwordHash;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getLogin() {
        return login;
    }

    public String getNickname() {
        return nickname;
    }

    public void setNickname(String nickname) {
        this.nickname = nickname;
    }

    public String getAvatar() {
        return avatar;
    }

    public void setAvatar(String avatar) {
        this.avatar = avatar;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
