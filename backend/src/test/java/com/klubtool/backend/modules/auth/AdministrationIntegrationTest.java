package com.klubtool.backend.modules.auth;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.modules.auth.domain.Permission;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.group.domain.StructuralRole;
import com.klubtool.backend.support.AbstractPostgresIntegrationTest;
import com.klubtool.backend.support.TestDataFactory;
import com.klubtool.backend.support.TestDataFactory.Fixture;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AdministrationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestDataFactory testData;

    @Test
    @DisplayName("user managers create accounts but cannot grant superuser")
    void userManagerCreatesAccounts() throws Exception {
        PortalUser manager = testData.createUserWithPermissions("manager", Set.of(Permission.USER_CREATE));
        String loginId = "new-" + UUID.randomUUID().toString().substring(0, 8);

        mockMvc.perform(post("/users")
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(manager))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(userJson(loginId, null)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.loginId").value(loginId));

        mockMvc.perform(post("/users")
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(manager))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(userJson(loginId.toUpperCase(), null)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("LOGIN_ID_TAKEN"));

        mockMvc.perform(post("/users")
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(manager))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(userJson(loginId + "x", true)))
                .andExpect(status().isForbidden());
    }

    @Test
    void invalidUserPayloadIsRejected() throws Exception {
        PortalUser superuser = testData.createSuperuser("admin");

        mockMvc.perform(post("/users")
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(superuser))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"loginId": "short-pw", "password": "123", "fullName": "Kurz", "email": "kurz@example.org"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail").value("password: PASSWORD_LENGTH_INVALID"));
    }

    @Test
    @DisplayName("roles are managed by superusers only")
    void rolesAreSuperuserOnly() throws Exception {
        PortalUser clerk = testData.createUserWithPermissions("clerk", Set.of(Permission.ROLE_VIEW));
        PortalUser superuser = testData.createSuperuser("admin");

        mockMvc.perform(get("/roles").header(HttpHeaders.AUTHORIZATION, testData.bearer(clerk)))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/roles")
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(superuser))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Bad role %s", "permissions": ["motion.view", "motion.fly"]}
                                """.formatted(UUID.randomUUID())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail").value("permissions: UNKNOWN_PERMISSION motion.fly"));
    }

    @Test
    void roleInUseCannotBeDeleted() throws Exception {
        PortalUser holder = testData.createUserWithPermissions("holder", Set.of(Permission.SESSION_VIEW));
        PortalUser superuser = testData.createSuperuser("admin");

        UUID roleId = holder.getRole().getId();

        mockMvc.perform(delete("/roles/{roleId}", roleId)
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(superuser)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ROLE_IN_USE"));
    }

    @Test
    @DisplayName("the membership overview names groups, locals and councils")
    void membershipOverview() throws Exception {
        Fixture district = testData.createLocalWithGroup("Margareten");
        PortalUser leader = testData.createUser("leader");
        testData.addMember(district.groupId(), leader, StructuralRole.LEADER);

        mockMvc.perform(get("/profile/memberships").header(HttpHeaders.AUTHORIZATION, testData.bearer(leader)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupMemberships[0].groupId").value(district.groupId().toString()))
                .andExpect(jsonPath("$.leaderGroups[0].roles[0]").value("LEADER"))
                .andExpect(jsonPath("$.adminGroups").isEmpty())
                .andExpect(jsonPath("$.locals[0].id").value(district.localId().toString()))
                .andExpect(jsonPath("$.councils[0].id").value(district.councilId().toString()));
    }

    private static String userJson(String loginId, Boolean superuser) {
        return """
                {"loginId": "%s", "password": "Sicher123!", "fullName": "Neue Person",
                 "email": "%s@example.org", "language": "de", "superuser": %s}
                """.formatted(loginId, loginId, superuser);
    }
}
