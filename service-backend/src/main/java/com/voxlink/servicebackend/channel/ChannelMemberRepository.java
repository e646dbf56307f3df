package com.voxlink.servicebackend.channel;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ChannelMemberRepository extends JpaRepository<ChannelMember, Long> {
    Optional<ChannelMember> findByChannelIdAndLogin(Long channelId, String login);

    List<ChannelMember> findByChannelIdAndLoginIn(Long channelId, Collection<String> logins);
}
