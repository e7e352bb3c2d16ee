package com.klubtool.backend.support;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.modules.auth.application.JwtTokenService;
import com.klubtool.backend.modules.auth.domain.Permission;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.auth.domain.Role;
import com.klubtool.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.klubtool.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.klubtool.backend.modules.committee.domain.Committee;
import com.klubtool.backend.modules.committee.domain.CommitteeMeeting;
import com.klubtool.backend.modules.committee.domain.CommitteeMember;
import com.klubtool.backend.modules.committee.domain.CommitteeParticipationSubstitute;
import com.klubtool.backend.modules.committee.domain.CommitteeRole;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeMeetingRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeMemberRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeParticipationSubstituteRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeRepository;
import com.klubtool.backend.modules.council.domain.CouncilSession;
import com.klubtool.backend.modules.council.domain.SessionExcuse;
import com.klubtool.backend.modules.council.infrastructure.persistence.CouncilSessionRepository;
import com.klubtool.backend.modules.council.infrastructure.persistence.SessionExcuseRepository;
import com.klubtool.backend.modules.group.domain.GroupMeeting;
import com.klubtool.backend.modules.group.domain.GroupMember;
import com.klubtool.backend.modules.group.domain.PoliticalGroup;
import com.klubtool.backend.modules.group.domain.StructuralRole;
import com.klubtool.backend.modules.group.infrastructure.persistence.GroupMeetingRepository;
import com.klubtool.backend.modules.group.infrastructure.persistence.GroupMemberRepository;
import com.klubtool.backend.modules.group.infrastructure.persistence.PoliticalGroupRepository;
import com.klubtool.backend.modules.local.domain.Council;
import com.klubtool.backend.modules.local.domain.Local;
import com.klubtool.backend.modules.local.domain.Party;
import com.klubtool.backend.modules.local.infrastructure.persistence.CouncilRepository;
import com.klubtool.backend.modules.local.infrastructure.persistence.LocalRepository;
import com.klubtool.backend.modules.local.infrastructure.persistence.PartyRepository;
import com.klubtool.backend.modules.motion.domain.Motion;
import com.klubtool.backend.modules.motion.domain.MotionKind;
import com.klubtool.backend.modules.motion.infrastructure.persistence.MotionRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists fixture rows with unique names so test classes can share one database.
 */
@Component
@Transactional
public class TestDataFactory {

    public static final String DEFAULT_PASSWORD = "Passw0rd!";

    private final PortalUserRepository portalUserRepository;
    private final RoleRepository roleRepository;
    private final LocalRepository localRepository;
    private final PartyRepository partyRepository;
    private final CouncilRepository councilRepository;
    private final PoliticalGroupRepository groupRepository;
    private final GroupMemberRepository groupMemberRepository;
    private final GroupMeetingRepository groupMeetingRepository;
    private final CouncilSessionRepository sessionRepository;
    private final MotionRepository motionRepository;
    private final SessionExcuseRepository excuseRepository;
    private final CommitteeRepository committeeRepository;
    private final CommitteeMemberRepository committeeMemberRepository;
    private final CommitteeMeetingRepository committeeMeetingRepository;
    private final CommitteeParticipationSubstituteRepository substituteRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public TestDataFactory(
            PortalUserRepository portalUserRepository,
            RoleRepository roleRepository,
            LocalRepository localRepository,
            PartyRepository partyRepository,
            CouncilRepository councilRepository,
            PoliticalGroupRepository groupRepository,
            GroupMemberRepository groupMemberRepository,
            GroupMeetingRepository groupMeetingRepository,
            CouncilSessionRepository sessionRepository,
            MotionRepository motionRepository,
            SessionExcuseRepository excuseRepository,
            CommitteeRepository committeeRepository,
            CommitteeMemberRepository committeeMemberRepository,
            CommitteeMeetingRepository committeeMeetingRepository,
            CommitteeParticipationSubstituteRepository substituteRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.portalUserRepository = portalUserRepository;
        this.roleRepository = roleRepository;
        this.localRepository = localRepository;
        this.partyRepository = partyRepository;
        this.councilRepository = councilRepository;
        this.groupRepository = groupRepository;
        this.groupMemberRepository = groupMemberRepository;
        this.groupMeetingRepository = groupMeetingRepository;
        this.sessionRepository = sessionRepository;
        this.motionRepository = motionRepository;
        this.excuseRepository = excuseRepository;
        this.committeeRepository = committeeRepository;
        this.committeeMemberRepository = committeeMemberRepository;
        this.committeeMeetingRepository = committeeMeetingRepository;
        this.substituteRepository = substituteRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public PortalUser createUser(String prefix) {
        String loginId = uniqueLoginId(prefix);
        PortalUser user = new PortalUser();
        user.setLoginId(loginId);
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));
        user.setFullName("Test " + prefix);
        user.setEmail(loginId + "@example.org");
        user.setLanguage(PortalUser.DEFAULT_LANGUAGE);
        return portalUserRepository.save(user);
    }

    public PortalUser createSuperuser(String prefix) {
        PortalUser user = createUser(prefix);
        user.setSuperuser(true);
        return portalUserRepository.save(user);
    }

    public PortalUser createUserWithPermissions(String prefix, Set<Permission> permissions) {
        Role role = new Role();
        role.setName("role-" + shortId());
        role.replacePermissions(permissions.isEmpty() ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(permissions));
        role = roleRepository.save(role);

        PortalUser user = createUser(prefix);
        user.setRole(role);
        return portalUserRepository.save(user);
    }

    /**
     * A local with its council, one party and one group belonging to that party.
     */
    public Fixture createLocalWithGroup(String name) {
        String suffix = shortId();
        Local local = new Local();
        local.setName(name + " " + suffix);
        local.setCode(suffix.toUpperCase(Locale.ROOT));
        local = localRepository.save(local);

        Council council = new Council();
        council.setName("Bezirksvertretung " + suffix);
        council.setLocal(local);
        council = councilRepository.save(council);

        Party party = new Party();
        party.setName("Partei " + suffix);
        party.setLocal(local);
        party = partyRepository.save(party);

        PoliticalGroup group = new PoliticalGroup();
        group.setName("Klub " + suffix);
        group.setParty(party);
        group = groupRepository.save(group);

        return new Fixture(local.getId(), council.getId(), group.getId());
    }

    public UUID addMember(UUID groupId, PortalUser user, StructuralRole... roles) {
        GroupMember member = new GroupMember();
        member.setGroup(groupRepository.getReferenceById(groupId));
        member.setUser(user);
        member.replaceRoles(roles.length == 0 ? Set.of() : EnumSet.of(roles[0], roles));
        return groupMemberRepository.save(member).getId();
    }

    public UUID createSession(UUID councilId, OffsetDateTime scheduledAt) {
        CouncilSession session = new CouncilSession();
        session.setTitle("Sitzung " + shortId());
        session.setCouncil(councilRepository.getReferenceById(councilId));
        session.setScheduledAt(scheduledAt);
        session.setLocation("Amtshaus");
        return sessionRepository.save(session).getId();
    }

    public UUID createCommitteeSession(UUID councilId, UUID committeeId, OffsetDateTime scheduledAt) {
        CouncilSession session = new CouncilSession();
        session.setTitle("Ausschusssitzung " + shortId());
        session.setCouncil(councilRepository.getReferenceById(councilId));
        session.setCommittee(committeeRepository.getReferenceById(committeeId));
        session.setScheduledAt(scheduledAt);
        return sessionRepository.save(session).getId();
    }

    public void excuse(UUID sessionId, PortalUser user) {
        excuseRepository.save(new SessionExcuse(sessionRepository.getReferenceById(sessionId), user, null));
    }

    public UUID createCommittee(UUID councilId, String name) {
        Committee committee = new Committee();
        committee.setName(name + " " + shortId());
        committee.setCouncil(councilRepository.getReferenceById(councilId));
        return committeeRepository.save(committee).getId();
    }

    public UUID addCommitteeMember(UUID committeeId, PortalUser user, CommitteeRole role) {
        CommitteeMember member = new CommitteeMember();
        member.setCommittee(committeeRepository.getReferenceById(committeeId));
        member.setUser(user);
        member.setRole(role);
        return committeeMemberRepository.save(member).getId();
    }

    public UUID createCommitteeMeeting(UUID committeeId, String title, OffsetDateTime scheduledAt) {
        CommitteeMeeting meeting = new CommitteeMeeting();
        meeting.setCommittee(committeeRepository.getReferenceById(committeeId));
        meeting.setTitle(title);
        meeting.setScheduledAt(scheduledAt);
        return committeeMeetingRepository.save(meeting).getId();
    }

    public void assignSubstitute(UUID meetingId, UUID memberId, UUID substituteMemberId) {
        substituteRepository.save(new CommitteeParticipationSubstitute(
                committeeMeetingRepository.getReferenceById(meetingId),
                committeeMemberRepository.getReferenceById(memberId),
                committeeMemberRepository.getReferenceById(substituteMemberId)));
    }

    public void cancelGroupMeeting(UUID meetingId) {
        GroupMeeting meeting = groupMeetingRepository.findById(meetingId).orElseThrow();
        meeting.cancel();
    }

    public UUID createGroupMeeting(UUID groupId, String title, OffsetDateTime scheduledAt) {
        GroupMeeting meeting = new GroupMeeting();
        meeting.setGroup(groupRepository.getReferenceById(groupId));
        meeting.setTitle(title);
        meeting.setScheduledAt(scheduledAt);
        return groupMeetingRepository.save(meeting).getId();
    }

    public UUID createMotion(UUID sessionId, UUID groupId, String title) {
        Motion motion = new Motion(MotionKind.MOTION);
        motion.setTitle(title);
        motion.setText("Antragstext");
        motion.setSession(sessionRepository.getReferenceById(sessionId));
        motion.setGroup(groupRepository.getReferenceById(groupId));
        return motionRepository.save(motion).getId();
    }

    public String bearer(PortalUser user) {
        return "Bearer " + jwtTokenService.issueAccessToken(user.getId(), user.getLoginId());
    }

    private static String uniqueLoginId(String prefix) {
        return (prefix + "-" + shortId()).toLowerCase(Locale.ROOT);
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public record Fixture(UUID localId, UUID councilId, UUID groupId) {
    }
}
