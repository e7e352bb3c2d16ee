package com.klubtool.backend.modules.auth.application;

import java.util.List;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.auth.domain.Permission;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.auth.presentation.dto.MembershipOverviewResponse;
import com.klubtool.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class ProfileService {

    private final MembershipResolver membershipResolver;

    public ProfileService(MembershipResolver membershipResolver) {
        this.membershipResolver = membershipResolver;
    }

    public UserProfileResponse loadProfile() {
        PortalUser user = currentUser();
        return new UserProfileResponse(
                user.getId(),
                user.getLoginId(),
                user.getFullName(),
                user.getEmail(),
                user.getRole() == null ? null : user.getRole().getName(),
                user.getRole() == null
                        ? List.of()
                        : user.getRole().grantedPermissions().stream().map(Permission::code).sorted().toList(),
                user.getLanguage(),
                user.isSuperuser()
        );
    }

    public MembershipOverviewResponse loadMemberships() {
        return MembershipOverviewResponse.from(membershipResolver.resolve(currentUser()));
    }

    private PortalUser currentUser() {
        return membershipResolver.findCurrentUser().orElseThrow(ProblemException::forbidden);
    }
}
