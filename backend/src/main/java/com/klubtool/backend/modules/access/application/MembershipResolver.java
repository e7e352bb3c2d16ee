package com.klubtool.backend.modules.access.application;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import com.klubtool.backend.global.security.SecurityUtils;
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
import com.klubtool.backend.modules.local.infrastructure.persistence.CouncilRepository;
import com.klubtool.backend.modules.local.infrastructure.persistence.LocalRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Computes a user's memberships and the locals and councils they reach. Read-only.
 */
@Service
@Transactional(readOnly = true)
public class MembershipResolver {

    private static final Comparator<NamedRef> BY_NAME =
            Comparator.comparing(NamedRef::name, String.CASE_INSENSITIVE_ORDER).thenComparing(ref -> ref.id().toString());

    private final PortalUserRepository portalUserRepository;
    private final GroupMemberRepository groupMemberRepository;
    private final CommitteeMemberRepository committeeMemberRepository;
    private final CommitteeParticipationSubstituteRepository substituteRepository;
    private final LocalRepository localRepository;
    private final CouncilRepository councilRepository;

    public MembershipResolver(
            PortalUserRepository portalUserRepository,
            GroupMemberRepository groupMemberRepository,
            CommitteeMemberRepository committeeMemberRepository,
            CommitteeParticipationSubstituteRepository substituteRepository,
            LocalRepository localRepository,
            CouncilRepository councilRepository
    ) {
        this.portalUserRepository = portalUserRepository;
        this.groupMemberRepository = groupMemberRepository;
        this.committeeMemberRepository = committeeMemberRepository;
        this.substituteRepository = substituteRepository;
        this.localRepository = localRepository;
        this.councilRepository = councilRepository;
    }

    /**
     * Context of the authenticated caller; anonymous when there is none or the account is inactive.
     */
    public MembershipContext resolveCurrentUser() {
        return findCurrentUser()
                .map(this::resolve)
                .orElseGet(MembershipContext::anonymous);
    }

    public Optional<PortalUser> findCurrentUser() {
        return SecurityUtils.findCurrentUserId()
                .flatMap(portalUserRepository::findWithRoleById)
                .filter(PortalUser::isActive);
    }

    public MembershipContext resolve(PortalUser user) {
        if (user == null) {
            return MembershipContext.anonymous();
        }
        UUID userId = user.getId();

        List<GroupMember> members = groupMemberRepository.findActiveWithChainByUserId(userId);
        Map<UUID, Local> reachableLocals = new LinkedHashMap<>();
        for (GroupMember member : members) {
            localOf(member.getGroup()).ifPresent(local -> reachableLocals.putIfAbsent(local.getId(), local));
        }
        Map<UUID, Council> councilsByLocalId = new LinkedHashMap<>();
        if (!reachableLocals.isEmpty()) {
            for (Council council : councilRepository.findByLocalIds(reachableLocals.keySet())) {
                councilsByLocalId.put(council.getLocal().getId(), council);
            }
        }

        List<GroupMembershipView> memberships = members.stream()
                .map(member -> toView(member, councilsByLocalId))
                .toList();
        List<GroupMembershipView> leaderGroups = memberships.stream()
                .filter(view -> view.holdsAny(StructuralRole.LEADERSHIP))
                .toList();
        List<GroupMembershipView> adminGroups = memberships.stream()
                .filter(view -> view.roles().contains(StructuralRole.GROUP_ADMIN))
                .toList();
        Map<UUID, GroupMembershipView> allGroups = new LinkedHashMap<>();
        leaderGroups.forEach(view -> allGroups.putIfAbsent(view.groupId(), view));
        adminGroups.forEach(view -> allGroups.putIfAbsent(view.groupId(), view));

        List<NamedRef> locals;
        List<NamedRef> councils;
        if (user.isSuperuser()) {
            locals = toSortedRefs(localRepository.findByActiveTrueOrderByNameAsc().stream()
                    .map(local -> new NamedRef(local.getId(), local.getName())));
            councils = toSortedRefs(councilRepository.findActiveOrderByName().stream()
                    .map(council -> new NamedRef(council.getId(), council.getName())));
        } else {
            locals = toSortedRefs(reachableLocals.values().stream()
                    .map(local -> new NamedRef(local.getId(), local.getName())));
            councils = toSortedRefs(councilsByLocalId.values().stream()
                    .map(council -> new NamedRef(council.getId(), council.getName())));
        }

        Set<UUID> committeeIds = new LinkedHashSet<>(committeeMemberRepository.findActiveRegularCommitteeIds(userId));
        Set<UUID> substituteMeetingIds =
                new LinkedHashSet<>(substituteRepository.findMeetingIdsBySubstituteUserId(userId));

        return new MembershipContext(
                userId,
                true,
                user.isSuperuser(),
                grantedPermissions(user),
                memberships,
                leaderGroups,
                adminGroups,
                List.copyOf(allGroups.values()),
                locals,
                councils,
                committeeIds,
                substituteMeetingIds
        );
    }

    private Set<Permission> grantedPermissions(PortalUser user) {
        Role role = user.getRole();
        return role == null ? EnumSet.noneOf(Permission.class) : role.grantedPermissions();
    }

    private static GroupMembershipView toView(GroupMember member, Map<UUID, Council> councilsByLocalId) {
        PoliticalGroup group = member.getGroup();
        UUID localId = localOf(group).map(Local::getId).orElse(null);
        Council council = localId == null ? null : councilsByLocalId.get(localId);
        Set<StructuralRole> roles = member.getRoles().isEmpty()
                ? EnumSet.noneOf(StructuralRole.class)
                : EnumSet.copyOf(member.getRoles());
        return new GroupMembershipView(member.getId(), group.getId(), group.getName(), roles,
                localId, council == null ? null : council.getId());
    }

    private static List<NamedRef> toSortedRefs(Stream<NamedRef> refs) {
        return refs.distinct().sorted(BY_NAME).toList();
    }

    private static Optional<Local> localOf(PoliticalGroup group) {
        if (group == null || group.getParty() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(group.getParty().getLocal());
    }
}
