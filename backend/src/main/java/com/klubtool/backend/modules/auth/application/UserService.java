package com.klubtool.backend.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.auth.domain.Role;
import com.klubtool.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.klubtool.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.klubtool.backend.modules.auth.presentation.dto.UpdateUserRequest;
import com.klubtool.backend.modules.auth.presentation.dto.UserRequest;
import com.klubtool.backend.modules.auth.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative user accounts. Granting or revoking the superuser flag, assigning roles and touching
 * superuser accounts are reserved to superusers.
 */
@Service
@Transactional
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final PortalUserRepository portalUserRepository;
    private final RoleRepository roleRepository;
    private final PasswordEncoder passwordEncoder;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;

    public UserService(
            PortalUserRepository portalUserRepository,
            RoleRepository roleRepository,
            PasswordEncoder passwordEncoder,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService
    ) {
        this.portalUserRepository = portalUserRepository;
        this.roleRepository = roleRepository;
        this.passwordEncoder = passwordEncoder;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
    }

    @Transactional(readOnly = true)
    public List<UserResponse> listUsers() {
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.LIST,
                AccessTarget.of(ResourceType.USER));
        return portalUserRepository.findAllOrderByName().stream().map(UserService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(UUID userId) {
        PortalUser user = loadUser(userId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW,
                AccessTarget.of(ResourceType.USER));
        return toResponse(user);
    }

    public UserResponse createUser(UserRequest request) {
        MembershipContext context = membershipResolver.resolveCurrentUser();
        accessDecisionService.require(context, AccessAction.CREATE, AccessTarget.of(ResourceType.USER));
        String loginId = request.loginId().trim();
        if (portalUserRepository.findByLoginIdIgnoreCase(loginId).isPresent()) {
            throw new ProblemException(HttpStatus.CONFLICT, "LOGIN_ID_TAKEN");
        }
        ensureMaySetSuperuser(context, request.superuser());
        ensureMayAssignRole(context, request.roleId() != null);

        PortalUser user = new PortalUser();
        user.setLoginId(loginId);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFullName(request.fullName().trim());
        user.setEmail(request.email().trim());
        user.setLanguage(request.language() == null ? PortalUser.DEFAULT_LANGUAGE : request.language());
        user.setSuperuser(Boolean.TRUE.equals(request.superuser()));
        if (request.roleId() != null) {
            user.setRole(loadRole(request.roleId()));
        }
        PortalUser saved = portalUserRepository.save(user);
        log.info("User {} created by {}", saved.getId(), context.userId());
        return toResponse(saved);
    }

    public UserResponse updateUser(UUID userId, UpdateUserRequest request) {
        PortalUser user = loadUser(userId);
        MembershipContext context = membershipResolver.resolveCurrentUser();
        accessDecisionService.require(context, AccessAction.EDIT, AccessTarget.of(ResourceType.USER));
        ensureMayManage(context, user);
        ensureMaySetSuperuser(context, request.superuser());
        ensureMayAssignRole(context, request.roleId() != null || Boolean.TRUE.equals(request.clearRole()));

        if (request.password() != null) {
            user.setPasswordHash(passwordEncoder.encode(request.password()));
        }
        if (request.fullName() != null) {
            user.setFullName(request.fullName().trim());
        }
        if (request.email() != null) {
            user.setEmail(request.email().trim());
        }
        if (Boolean.TRUE.equals(request.clearRole())) {
            user.setRole(null);
        } else if (request.roleId() != null) {
            user.setRole(loadRole(request.roleId()));
        }
        if (request.language() != null) {
            user.setLanguage(request.language());
        }
        if (request.superuser() != null) {
            user.setSuperuser(request.superuser());
        }
        if (request.active() != null) {
            user.setActive(request.active());
        }
        return toResponse(user);
    }

    public void deleteUser(UUID userId) {
        PortalUser user = loadUser(userId);
        MembershipContext context = membershipResolver.resolveCurrentUser();
        accessDecisionService.require(context, AccessAction.DELETE, AccessTarget.of(ResourceType.USER));
        ensureMayManage(context, user);
        if (user.getId().equals(context.userId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "CANNOT_DELETE_SELF");
        }
        portalUserRepository.delete(user);
        log.info("User {} deleted by {}", user.getId(), context.userId());
    }

    private static void ensureMaySetSuperuser(MembershipContext context, Boolean superuser) {
        if (superuser != null && !context.superuser()) {
            throw ProblemException.forbidden();
        }
    }

    private static void ensureMayManage(MembershipContext context, PortalUser target) {
        if (target.isSuperuser() && !context.superuser()) {
            throw ProblemException.forbidden();
        }
    }

    // Roles carry permissions, so handing them out is as privileged as editing them.
    private static void ensureMayAssignRole(MembershipContext context, boolean changesRole) {
        if (changesRole && !context.superuser()) {
            throw ProblemException.forbidden();
        }
    }

    private PortalUser loadUser(UUID userId) {
        return portalUserRepository.findWithRoleById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
    }

    private Role loadRole(UUID roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> ProblemException.notFound("ROLE_NOT_FOUND"));
    }

    private static UserResponse toResponse(PortalUser user) {
        Role role = user.getRole();
        return new UserResponse(
                user.getId(),
                user.getLoginId(),
                user.getFullName(),
                user.getEmail(),
                role == null ? null : role.getId(),
                role == null ? null : role.getName(),
                user.getLanguage(),
                user.isSuperuser(),
                user.isActive(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
