package com.voxlink.servicebackend.config;

import com.voxlink.servicebackend.call.CallProperties;
import com.voxlink.servicebackend.call.CallSignalingEngine;
import com.voxlink.servicebackend.channel.ChannelAccessPolicy;
import com.voxlink.servicebackend.channel.ChannelDirectory;
import com.voxlink.servicebackend.event.EventOutbox;
import com.voxlink.servicebackend.session.PresenceDirectory;
import com.voxlink.servicebackend.session.SessionProperties;
import com.voxlink.servicebackend.social.FriendDirectory;
import com.voxlink.servicebackend.user.UserCredentialService;
import com.voxlink.servicebackend.voice.VoicePresenceProperties;
import com.voxlink.servicebackend.voice.VoicePresenceService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * In-memory signaling and presence state, all driven by one {@link Clock}.
 */
@Configuration
@EnableConfigurationProperties({SessionProperties.class, CallProperties.class, VoicePresenceProperties.class})
public class StateConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventOutbox eventOutbox(CallProperties properties, Clock clock) {
        return new EventOutbox(properties.eventQueueLimit(), properties.eventTtl(), clock);
    }

    @Bean
    public CallSignalingEngine callSignalingEngine(UserCredentialService users,
                                                   FriendDirectory friends,
                                                   PresenceDirectory presence,
                                                   EventOutbox outbox,
                                                   CallProperties properties,
                                                   Clock clock) {
        return new CallSignalingEngine(users, friends, presence, outbox, properties.staleAfter(), clock);
    }

    @Bean
    public VoicePresenceService voicePresenceService(ChannelAccessPolicy accessPolicy,
                                                     ChannelDirectory channels,
                                                     UserCredentialService users,
                                                     PresenceDirectory presence,
                                                     VoicePresenceProperties properties,
                                                     Clock clock) {
        return new VoicePresenceService(accessPolicy, channels, users, presence, properties.ttl(), clock);
    }
}
