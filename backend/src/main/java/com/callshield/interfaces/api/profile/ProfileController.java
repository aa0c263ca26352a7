package com.callshield.interfaces.api.profile;

import com.callshield.application.profile.ScammerProfileService;
import com.callshield.application.profile.ScammerProfileView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/profiles")
@RequiredArgsConstructor
public class ProfileController {

    private final ScammerProfileService profileService;

    @GetMapping
    public ResponseEntity<List<ScammerProfileView>> listProfiles() {
        return ResponseEntity.ok(profileService.listProfiles());
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<ScammerProfileView> findBySession(@PathVariable String sessionId) {
        return profileService.findBySession(sessionId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
