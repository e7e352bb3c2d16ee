package com.klubtool.backend.modules.auth.presentation;

import com.klubtool.backend.modules.auth.application.ProfileService;
import com.klubtool.backend.modules.auth.presentation.dto.MembershipOverviewResponse;
import com.klubtool.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Profile")
public class ProfileController {

    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping("/profile/me")
    public ResponseEntity<UserProfileResponse> currentUser() {
        return ResponseEntity.ok(profileService.loadProfile());
    }

    @GetMapping("/profile/memberships")
    public ResponseEntity<MembershipOverviewResponse> memberships() {
        return ResponseEntity.ok(profileService.loadMemberships());
    }
}
