package com.klubtool.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.auth.domain.PortalUser;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PortalUserRepository extends JpaRepository<PortalUser, UUID> {

    @Query("select pu from PortalUser pu where lower(pu.loginId) = lower(:loginId)")
    Optional<PortalUser> findByLoginIdIgnoreCase(@Param("loginId") String loginId);

    @EntityGraph(attributePaths = "role")
    @Query("select pu from PortalUser pu where pu.id = :id")
    Optional<PortalUser> findWithRoleById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "role")
    @Query("select pu from PortalUser pu order by lower(pu.fullName), lower(pu.loginId)")
    List<PortalUser> findAllOrderByName();

    boolean existsByRole_Id(UUID roleId);
}
