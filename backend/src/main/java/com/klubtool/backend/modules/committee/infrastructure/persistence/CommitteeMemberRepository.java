package com.klubtool.backend.modules.committee.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.committee.domain.CommitteeMember;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommitteeMemberRepository extends JpaRepository<CommitteeMember, UUID> {

    @Query("""
            select distinct cm.committee.id
              from CommitteeMember cm
             where cm.user.id = :userId
               and cm.active = true
               and cm.role <> com.klubtool.backend.modules.committee.domain.CommitteeRole.SUBSTITUTE_MEMBER
            """)
    List<UUID> findActiveRegularCommitteeIds(@Param("userId") UUID userId);

    @EntityGraph(attributePaths = "user")
    List<CommitteeMember> findByCommittee_IdOrderByRoleAsc(UUID committeeId);

    boolean existsByCommittee_IdAndUser_Id(UUID committeeId, UUID userId);

    @EntityGraph(attributePaths = {"committee", "user"})
    @Query("select cm from CommitteeMember cm where cm.id in :ids")
    List<CommitteeMember> findDetailedByIds(@Param("ids") Collection<UUID> ids);
}
