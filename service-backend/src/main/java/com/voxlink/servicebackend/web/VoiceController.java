package com.voxlink.servicebackend.web;

import com.voxlink.servicebackend.client.AudioStreamConfig;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/voice")
public class VoiceController {

    /**
     * Audio parameters every client must use on the relay.
     */
    @GetMapping("/config")
    public ResponseEntity<AudioStreamConfig> getAudioConfig() {
        return ResponseEntity.ok(AudioStreamConfig.createDefault());
    }
}
