package com.voxlink.servicebackend.voice;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of a channel voice room listing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoiceParticipantDto {

    private String login;
    private String nickname;
    private String avatar;
    private String role;       // wire name of the effective channel role
    private boolean speaking;
    private boolean online;    // session-derived, not voice lease
}
