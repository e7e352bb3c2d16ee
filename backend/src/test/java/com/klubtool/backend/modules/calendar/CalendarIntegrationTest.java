package com.klubtool.backend.modules.calendar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.klubtool.backend.modules.auth.domain.Permission;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.committee.domain.CommitteeRole;
import com.klubtool.backend.support.AbstractPostgresIntegrationTest;
import com.klubtool.backend.support.TestDataFactory;
import com.klubtool.backend.support.TestDataFactory.Fixture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class CalendarIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestDataFactory testData;

    private Fixture district;
    private PortalUser member;
    private UUID meetingId;
    private UUID sessionId;

    @BeforeEach
    void setUp() {
        district = testData.createLocalWithGroup("Wieden");
        member = testData.createUser("member");
        testData.addMember(district.groupId(), member);
        meetingId = testData.createGroupMeeting(district.groupId(), "Klausur", OffsetDateTime.now().plusDays(2));
        sessionId = testData.createSession(district.councilId(), OffsetDateTime.now().plusDays(5));
    }

    @Test
    @DisplayName("upcoming events combine group meetings and council sessions")
    void listsUpcomingEvents() throws Exception {
        mockMvc.perform(get("/calendar/events").header(HttpHeaders.AUTHORIZATION, testData.bearer(member)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(meetingId.toString()))
                .andExpect(jsonPath("$[0].type").value("group_meeting"))
                .andExpect(jsonPath("$[0].url").value("/group-meetings/" + meetingId))
                .andExpect(jsonPath("$[*].id", hasItem(sessionId.toString())));
    }

    @Test
    void exportIsAnAttachment() throws Exception {
        mockMvc.perform(get("/calendar/export.ics").header(HttpHeaders.AUTHORIZATION, testData.bearer(member)))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/calendar"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("attachment; filename=\"personal-calendar.ics\"")))
                .andExpect(content().string(containsString("UID:groupmeeting-" + meetingId + "@")))
                .andExpect(content().string(containsString("SUMMARY:Klausur\r\n")));
    }

    @Test
    @DisplayName("unknown feed tokens get the uniform 403 and never a redirect")
    void unknownFeedTokenForbidden() throws Exception {
        mockMvc.perform(get("/calendar/feed/{token}.ics", "not-a-real-token"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    @DisplayName("a subscription token opens the feed until it is replaced or revoked")
    void subscriptionLifecycle() throws Exception {
        String firstToken = subscribe();

        mockMvc.perform(get("/calendar/feed/{token}.ics", firstToken))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/calendar"))
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, containsString("no-cache")))
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, containsString("private")))
                .andExpect(content().string(containsString("BEGIN:VCALENDAR\r\n")))
                .andExpect(content().string(containsString("SUMMARY:Klausur\r\n")));

        String secondToken = subscribe();
        assertThat(secondToken).isNotEqualTo(firstToken);
        mockMvc.perform(get("/calendar/feed/{token}.ics", firstToken))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/calendar/feed/{token}.ics", secondToken))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/calendar/subscription").header(HttpHeaders.AUTHORIZATION, testData.bearer(member)))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/calendar/feed/{token}.ics", secondToken))
                .andExpect(status().isForbidden());
    }

    @Test
    void sessionExportRequiresCouncilReach() throws Exception {
        PortalUser outsider = testData.createUser("outsider");

        mockMvc.perform(get("/sessions/{sessionId}/export.ics", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(outsider)))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/sessions/{sessionId}/export.ics", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(member)))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("session-" + sessionId + ".ics")));
    }

    @Test
    @DisplayName("an excused session leaves the personal calendar")
    void excusedSessionIsHidden() throws Exception {
        testData.excuse(sessionId, member);

        mockMvc.perform(get("/calendar/events").header(HttpHeaders.AUTHORIZATION, testData.bearer(member)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", hasItem(meetingId.toString())))
                .andExpect(jsonPath("$[*].id", not(hasItem(sessionId.toString()))));
    }

    @Test
    @DisplayName("cancelled meetings reach subscribers as cancelled but leave the export")
    void cancelledMeetingPropagatesToFeedOnly() throws Exception {
        testData.cancelGroupMeeting(meetingId);
        String feedToken = subscribe();

        mockMvc.perform(get("/calendar/export.ics").header(HttpHeaders.AUTHORIZATION, testData.bearer(member)))
                .andExpect(status().isOk())
                .andExpect(content().string(not(containsString("UID:groupmeeting-" + meetingId + "@"))));

        mockMvc.perform(get("/calendar/feed/{token}.ics", feedToken))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("UID:groupmeeting-" + meetingId + "@")))
                .andExpect(content().string(containsString("STATUS:CANCELLED\r\nSEQUENCE:1\r\n")));
    }

    @Test
    @DisplayName("sessions held by a committee stay off the council calendar")
    void committeeSessionsAreExcluded() throws Exception {
        UUID committeeId = testData.createCommittee(district.councilId(), "Bauausschuss");
        UUID committeeSessionId = testData.createCommitteeSession(district.councilId(), committeeId,
                OffsetDateTime.now().plusDays(3));

        mockMvc.perform(get("/calendar/events").header(HttpHeaders.AUTHORIZATION, testData.bearer(member)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", hasItem(sessionId.toString())))
                .andExpect(jsonPath("$[*].id", not(hasItem(committeeSessionId.toString()))));
    }

    @Test
    @DisplayName("substitutes see exactly the committee meetings they stand in for")
    void substituteSeesAssignedMeetingOnly() throws Exception {
        UUID committeeId = testData.createCommittee(district.councilId(), "Finanzausschuss");
        PortalUser regular = testData.createUser("regular");
        PortalUser substitute = testData.createUser("substitute");
        UUID regularMemberId = testData.addCommitteeMember(committeeId, regular, CommitteeRole.MEMBER);
        UUID substituteMemberId = testData.addCommitteeMember(committeeId, substitute,
                CommitteeRole.SUBSTITUTE_MEMBER);
        UUID assigned = testData.createCommitteeMeeting(committeeId, "Budgetberatung",
                OffsetDateTime.now().plusDays(4));
        UUID unassigned = testData.createCommitteeMeeting(committeeId, "Rechnungsabschluss",
                OffsetDateTime.now().plusDays(6));
        testData.assignSubstitute(assigned, regularMemberId, substituteMemberId);

        mockMvc.perform(get("/calendar/events").header(HttpHeaders.AUTHORIZATION, testData.bearer(substitute)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", hasItem(assigned.toString())))
                .andExpect(jsonPath("$[*].id", not(hasItem(unassigned.toString()))));

        mockMvc.perform(get("/calendar/events").header(HttpHeaders.AUTHORIZATION, testData.bearer(regular)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", hasItem(assigned.toString())))
                .andExpect(jsonPath("$[*].id", hasItem(unassigned.toString())));
    }

    @Test
    @DisplayName("a permission grant applies even without a structural role")
    void permissionOutranksMissingStructuralRole() throws Exception {
        PortalUser plainMember = testData.createUser("plain");
        testData.addMember(district.groupId(), plainMember);
        PortalUser deleter = testData.createUserWithPermissions("deleter", Set.of(Permission.GROUP_DELETE));
        testData.addMember(district.groupId(), deleter);

        mockMvc.perform(delete("/group-meetings/{meetingId}", meetingId)
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(plainMember)))
                .andExpect(status().isForbidden());
        mockMvc.perform(delete("/group-meetings/{meetingId}", meetingId)
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(deleter)))
                .andExpect(status().isNoContent());
    }

    private String subscribe() throws Exception {
        MvcResult result = mockMvc.perform(post("/calendar/subscription")
                        .header(HttpHeaders.AUTHORIZATION, testData.bearer(member)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.feedUrl", containsString("/calendar/feed/")))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("token").asText();
    }
}
