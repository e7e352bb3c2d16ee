package com.klubtool.backend.modules.auth.application;

import static com.klubtool.backend.global.common.TextValues.trimToNull;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.auth.domain.Permission;
import com.klubtool.backend.modules.auth.domain.Role;
import com.klubtool.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.klubtool.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.klubtool.backend.modules.auth.presentation.dto.RoleRequest;
import com.klubtool.backend.modules.auth.presentation.dto.RoleResponse;
import com.klubtool.backend.modules.auth.presentation.dto.UpdateRoleRequest;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Global roles and their permission strings. Superusers only.
 */
@Service
@Transactional
public class RoleService {

    private static final AccessTarget ROLES = AccessTarget.of(ResourceType.ROLE);

    private final RoleRepository roleRepository;
    private final PortalUserRepository portalUserRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;

    public RoleService(
            RoleRepository roleRepository,
            PortalUserRepository portalUserRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService
    ) {
        this.roleRepository = roleRepository;
        this.portalUserRepository = portalUserRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles() {
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.LIST, ROLES);
        return roleRepository.findAllByOrderByNameAsc().stream().map(RoleService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public RoleResponse getRole(UUID roleId) {
        Role role = loadRole(roleId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, ROLES);
        return toResponse(role);
    }

    public RoleResponse createRole(RoleRequest request) {
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.CREATE, ROLES);
        String name = request.name().trim();
        ensureUniqueName(name);
        Set<Permission> permissions = parsePermissions(request.permissions());

        Role role = new Role();
        role.setName(name);
        role.setDescription(trimToNull(request.description()));
        role.replacePermissions(permissions);
        return toResponse(roleRepository.save(role));
    }

    public RoleResponse updateRole(UUID roleId, UpdateRoleRequest request) {
        Role role = loadRole(roleId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, ROLES);

        if (request.name() != null && !request.name().trim().equalsIgnoreCase(role.getName())) {
            String name = request.name().trim();
            ensureUniqueName(name);
            role.setName(name);
        }
        if (request.description() != null) {
            role.setDescription(trimToNull(request.description()));
        }
        if (request.permissions() != null) {
            role.replacePermissions(parsePermissions(request.permissions()));
        }
        if (request.active() != null) {
            role.setActive(request.active());
        }
        return toResponse(role);
    }

    public void deleteRole(UUID roleId) {
        Role role = loadRole(roleId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE, ROLES);
        if (portalUserRepository.existsByRole_Id(role.getId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROLE_IN_USE");
        }
        roleRepository.delete(role);
    }

    /**
     * Rejects the whole request when any code is unknown, naming the offending codes.
     */
    static Set<Permission> parsePermissions(Set<String> codes) {
        Set<Permission> parsed = EnumSet.noneOf(Permission.class);
        if (codes == null) {
            return parsed;
        }
        Set<String> unknown = new TreeSet<>();
        for (String code : codes) {
            Permission.fromCode(code).ifPresentOrElse(parsed::add, () -> unknown.add(String.valueOf(code)));
        }
        if (!unknown.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error",
                    "permissions: UNKNOWN_PERMISSION " + String.join(", ", unknown));
        }
        return parsed;
    }

    private Role loadRole(UUID roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> ProblemException.notFound("ROLE_NOT_FOUND"));
    }

    private void ensureUniqueName(String name) {
        if (roleRepository.findByNameIgnoreCase(name).isPresent()) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROLE_NAME_TAKEN");
        }
    }

    private static RoleResponse toResponse(Role role) {
        return new RoleResponse(
                role.getId(),
                role.getName(),
                role.getDescription(),
                role.getPermissionCodes().stream().sorted().toList(),
                role.isActive()
        );
    }
}
