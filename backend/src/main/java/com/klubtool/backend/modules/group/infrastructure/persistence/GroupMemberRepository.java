package com.klubtool.backend.modules.group.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.group.domain.GroupMember;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface GroupMemberRepository extends JpaRepository<GroupMember, UUID> {

    /**
     * Active memberships with the group, party and local loaded in one pass.
     */
    @EntityGraph(attributePaths = {"group", "group.party", "group.party.local", "roles"})
    @Query("""
            select gm
              from GroupMember gm
             where gm.user.id = :userId
               and gm.active = true
             order by gm.group.name
            """)
    List<GroupMember> findActiveWithChainByUserId(@Param("userId") UUID userId);

    @EntityGraph(attributePaths = {"group", "user", "roles"})
    @Query("select gm from GroupMember gm where gm.id = :id")
    Optional<GroupMember> findDetailedById(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"group", "user", "roles"})
    @Query("select gm from GroupMember gm order by gm.group.name, gm.user.fullName")
    List<GroupMember> findAllDetailed();

    @EntityGraph(attributePaths = {"group", "user", "roles"})
    @Query("select gm from GroupMember gm where gm.group.id = :groupId order by gm.user.fullName")
    List<GroupMember> findByGroupId(@Param("groupId") UUID groupId);

    boolean existsByGroup_IdAndUser_Id(UUID groupId, UUID userId);
}
