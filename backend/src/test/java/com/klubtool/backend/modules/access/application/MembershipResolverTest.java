package com.klubtool.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.access.domain.GroupMembershipView;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.access.domain.NamedRef;
import com.klubtool.backend.modules.auth.domain.Permission;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.auth.domain.Role;
import com.klubtool.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeMemberRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeParticipationSubstituteRepository;
import com.klubtool.backend.modules.group.domain.GroupMember;
import com.klubtool.backend.modules.group.domain.PoliticalGroup;
import com.klubtool.backend.modules.group.domain.StructuralRole;
import com.klubtool.backend.modules.group.infrastructure.persistence.GroupMemberRepository;
import com.klubtool.backend.modules.local.domain.Council;
import com.klubtool.backend.modules.local.domain.Local;
import com.klubtool.backend.modules.local.domain.Party;
import com.klubtool.backend.modules.local.infrastructure.persistence.CouncilRepository;
import com.klubtool.backend.modules.local.infrastructure.persistence.LocalRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class MembershipResolverTest {

    @Mock
    private PortalUserRepository portalUserRepository;
    @Mock
    private GroupMemberRepository groupMemberRepository;
    @Mock
    private CommitteeMemberRepository committeeMemberRepository;
    @Mock
    private CommitteeParticipationSubstituteRepository substituteRepository;
    @Mock
    private LocalRepository localRepository;
    @Mock
    private CouncilRepository councilRepository;

    private MembershipResolver resolver;
    private PortalUser user;

    @BeforeEach
    void setUp() {
        resolver = new MembershipResolver(portalUserRepository, groupMemberRepository, committeeMemberRepository,
                substituteRepository, localRepository, councilRepository);
        user = new PortalUser();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
    }

    @Test
    void nullUserIsAnonymous() {
        assertThat(resolver.resolve(null).authenticated()).isFalse();
    }

    @Test
    @DisplayName("memberships reach locals and councils through the party chain")
    void resolvesMembershipChain() {
        Local local = local("Wien Mitte");
        Council council = council("Bezirksvertretung", local);
        GroupMember leader = member(group("Klub B", local), StructuralRole.LEADER);
        GroupMember admin = member(group("Klub A", null), StructuralRole.GROUP_ADMIN);
        UUID committeeId = UUID.randomUUID();
        UUID meetingId = UUID.randomUUID();

        when(groupMemberRepository.findActiveWithChainByUserId(user.getId())).thenReturn(List.of(leader, admin));
        when(councilRepository.findByLocalIds(anyCollection())).thenReturn(List.of(council));
        when(committeeMemberRepository.findActiveRegularCommitteeIds(user.getId())).thenReturn(List.of(committeeId));
        when(substituteRepository.findMeetingIdsBySubstituteUserId(user.getId())).thenReturn(List.of(meetingId));

        MembershipContext context = resolver.resolve(user);

        assertThat(context.authenticated()).isTrue();
        assertThat(context.groupMemberships()).extracting(GroupMembershipView::groupName)
                .containsExactly("Klub B", "Klub A");
        GroupMembershipView reaching = context.groupMemberships().get(0);
        assertThat(reaching.localId()).isEqualTo(local.getId());
        assertThat(reaching.councilId()).isEqualTo(council.getId());
        assertThat(context.groupMemberships().get(1).localId()).isNull();
        assertThat(context.leaderGroups()).extracting(GroupMembershipView::groupName).containsExactly("Klub B");
        assertThat(context.adminGroups()).extracting(GroupMembershipView::groupName).containsExactly("Klub A");
        assertThat(context.allGroups()).hasSize(2);
        assertThat(context.locals()).containsExactly(new NamedRef(local.getId(), "Wien Mitte"));
        assertThat(context.councils()).containsExactly(new NamedRef(council.getId(), "Bezirksvertretung"));
        assertThat(context.committeeIds()).containsExactly(committeeId);
        assertThat(context.substituteMeetingIds()).containsExactly(meetingId);
        verify(localRepository, never()).findByActiveTrueOrderByNameAsc();
    }

    @Test
    @DisplayName("superusers reach every active local and council")
    void superuserReachesEverything() {
        user.setSuperuser(true);
        Local first = local("Graz");
        Local second = local("amstetten");
        when(groupMemberRepository.findActiveWithChainByUserId(user.getId())).thenReturn(List.of());
        when(localRepository.findByActiveTrueOrderByNameAsc()).thenReturn(List.of(first, second));
        when(councilRepository.findActiveOrderByName()).thenReturn(List.of(council("Gemeinderat", first)));
        when(committeeMemberRepository.findActiveRegularCommitteeIds(user.getId())).thenReturn(List.of());
        when(substituteRepository.findMeetingIdsBySubstituteUserId(user.getId())).thenReturn(List.of());

        MembershipContext context = resolver.resolve(user);

        assertThat(context.superuser()).isTrue();
        assertThat(context.locals()).extracting(NamedRef::name).containsExactly("amstetten", "Graz");
        assertThat(context.councils()).extracting(NamedRef::name).containsExactly("Gemeinderat");
        verify(councilRepository, never()).findByLocalIds(anyCollection());
    }

    @Test
    void permissionsComeFromTheRole() {
        Role role = new Role();
        role.replacePermissions(EnumSet.of(Permission.SESSION_VIEW));
        user.setRole(role);
        when(groupMemberRepository.findActiveWithChainByUserId(user.getId())).thenReturn(List.of());
        when(committeeMemberRepository.findActiveRegularCommitteeIds(user.getId())).thenReturn(List.of());
        when(substituteRepository.findMeetingIdsBySubstituteUserId(user.getId())).thenReturn(List.of());

        MembershipContext context = resolver.resolve(user);

        assertThat(context.permissions()).containsExactly(Permission.SESSION_VIEW);
        assertThat(context.groupMemberships()).isEmpty();
    }

    private GroupMember member(PoliticalGroup group, StructuralRole role) {
        GroupMember member = new GroupMember();
        member.setUser(user);
        member.setGroup(group);
        member.replaceRoles(EnumSet.of(role));
        ReflectionTestUtils.setField(member, "id", UUID.randomUUID());
        return member;
    }

    private static PoliticalGroup group(String name, Local local) {
        PoliticalGroup group = new PoliticalGroup();
        group.setName(name);
        if (local != null) {
            Party party = new Party();
            party.setName("Partei");
            party.setLocal(local);
            ReflectionTestUtils.setField(party, "id", UUID.randomUUID());
            group.setParty(party);
        }
        ReflectionTestUtils.setField(group, "id", UUID.randomUUID());
        return group;
    }

    private static Local local(String name) {
        Local local = new Local();
        local.setName(name);
        ReflectionTestUtils.setField(local, "id", UUID.randomUUID());
        return local;
    }

    private static Council council(String name, Local local) {
        Council council = new Council();
        council.setName(name);
        council.setLocal(local);
        ReflectionTestUtils.setField(council, "id", UUID.randomUUID());
        return council;
    }
}
