package com.klubtool.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.auth.domain.Permission;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.klubtool.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.klubtool.backend.modules.auth.presentation.dto.UpdateUserRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private PortalUserRepository portalUserRepository;
    @Mock
    private RoleRepository roleRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private MembershipResolver membershipResolver;
    @Mock
    private AccessDecisionService accessDecisionService;

    private UserService service;
    private UUID editorId;

    @BeforeEach
    void setUp() {
        service = new UserService(portalUserRepository, roleRepository, passwordEncoder, membershipResolver,
                accessDecisionService);
        editorId = UUID.randomUUID();
    }

    @Test
    @DisplayName("user editors cannot change a superuser's password")
    void editorCannotResetSuperuserPassword() {
        PortalUser admin = user(UUID.randomUUID(), true);
        admin.setPasswordHash("old");
        when(portalUserRepository.findWithRoleById(admin.getId())).thenReturn(Optional.of(admin));
        when(membershipResolver.resolveCurrentUser()).thenReturn(context(false, Permission.USER_EDIT));

        assertThatThrownBy(() -> service.updateUser(admin.getId(), passwordOnly("attacker-pass")))
                .isInstanceOfSatisfying(ProblemException.class,
                        problem -> assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));

        assertThat(admin.getPasswordHash()).isEqualTo("old");
        verifyNoInteractions(passwordEncoder);
    }

    @Test
    void editorCannotDeleteSuperuser() {
        PortalUser admin = user(UUID.randomUUID(), true);
        when(portalUserRepository.findWithRoleById(admin.getId())).thenReturn(Optional.of(admin));
        when(membershipResolver.resolveCurrentUser()).thenReturn(context(false, Permission.USER_DELETE));

        assertThatThrownBy(() -> service.deleteUser(admin.getId())).isInstanceOf(ProblemException.class);

        verify(portalUserRepository, never()).delete(any());
    }

    @Test
    @DisplayName("user editors cannot hand out roles, not even to themselves")
    void editorCannotAssignRoles() {
        PortalUser self = user(editorId, false);
        when(portalUserRepository.findWithRoleById(editorId)).thenReturn(Optional.of(self));
        when(membershipResolver.resolveCurrentUser()).thenReturn(context(false, Permission.USER_EDIT));
        UpdateUserRequest request = new UpdateUserRequest(null, null, null, UUID.randomUUID(), null, null, null, null);

        assertThatThrownBy(() -> service.updateUser(editorId, request)).isInstanceOf(ProblemException.class);

        assertThat(self.getRole()).isNull();
        verifyNoInteractions(roleRepository);
    }

    @Test
    void editorUpdatesRegularUser() {
        PortalUser member = user(UUID.randomUUID(), false);
        when(portalUserRepository.findWithRoleById(member.getId())).thenReturn(Optional.of(member));
        when(membershipResolver.resolveCurrentUser()).thenReturn(context(false, Permission.USER_EDIT));
        when(passwordEncoder.encode("Neues-Passwort1")).thenReturn("hashed");

        service.updateUser(member.getId(), passwordOnly("Neues-Passwort1"));

        assertThat(member.getPasswordHash()).isEqualTo("hashed");
    }

    @Test
    void superuserMayEditOtherSuperusers() {
        PortalUser admin = user(UUID.randomUUID(), true);
        when(portalUserRepository.findWithRoleById(admin.getId())).thenReturn(Optional.of(admin));
        when(membershipResolver.resolveCurrentUser()).thenReturn(context(true));
        UpdateUserRequest request = new UpdateUserRequest(null, null, null, null, null, null, null, false);

        service.updateUser(admin.getId(), request);

        assertThat(admin.isActive()).isFalse();
    }

    private static UpdateUserRequest passwordOnly(String password) {
        return new UpdateUserRequest(password, null, null, null, null, null, null, null);
    }

    private static PortalUser user(UUID id, boolean superuser) {
        PortalUser user = new PortalUser();
        ReflectionTestUtils.setField(user, "id", id);
        user.setLoginId("user-" + id);
        user.setSuperuser(superuser);
        return user;
    }

    private MembershipContext context(boolean superuser, Permission... permissions) {
        return new MembershipContext(editorId, true, superuser, Set.of(permissions), List.of(), List.of(),
                List.of(), List.of(), List.of(), List.of(), Set.of(), Set.of());
    }
}
