package com.voxlink.servicebackend.channel;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "channel_members",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_channel_members", columnNames = {"channel_id", "login"})
        })
public class ChannelMember {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "channel_id", nullable = false)
    private Long channelId;

    @Column(nullable = false, length = 64)
    private String login;

    // raw stored value; read through ChannelRole.parseAssignable
    @Column(nullable = false, length = 16)
    private String role;

    @Column(nullable = false)
    private Instant joinedAt;

    protected ChannelMember() {
    }

    public ChannelMember(Long channelId, String login, String role, Instant joinedAt) {
        this.channelId = channelId;
        this.login = login;
        this.role = role;
        this.joinedAt = joinedAt;
    }

    public Long getId() {
        return id;
    }

    public Long getChannelId() {
        return channelId;
    }

    public String getLogin() {
        return login;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }
}
