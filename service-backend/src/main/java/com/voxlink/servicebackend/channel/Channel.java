package com.voxlink.servicebackend.channel;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "channels")
public class Channel {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 64)
    private String ownerLogin;

    @Column(nullable = false, length = 16)
    private String textMinRole = "member";

    @Column(nullable = false, length = 16)
    private String voiceMinRole = "member";

    @Column(nullable = false)
    private Instant createdAt;

    protected Channel() {
    }

    public Channel(String name, String ownerLogin, String textMinRole, String voiceMinRole, Instant createdAt) {
        this.name = name;
        this.ownerLogin = ownerLogin;
        this.textMinRole = textMinRole;
        this.voiceMinRole = voiceMinRole;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getOwnerLogin() {
        return ownerLogin;
    }

    public String getTextMinRole() {
        return textMinRole;
    }

    public void setTextMinRole(String textMinRole) {
        this.textMinRole = textMinRole;
    }

    public String getVoiceMinRole() {
        return voiceMinRole;
    }

    public void setVoiceMinRole(String voiceMinRole) {
        this.voiceMinRole = voiceMinRole;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
