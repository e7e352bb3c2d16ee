package com.klubtool.backend.modules.local.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.local.domain.Council;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CouncilRepository extends JpaRepository<Council, UUID> {

    @EntityGraph(attributePaths = "local")
    @Query("select c from Council c where c.local.id in :localIds order by c.name")
    List<Council> findByLocalIds(@Param("localIds") Collection<UUID> localIds);

    @EntityGraph(attributePaths = "local")
    @Query("select c from Council c where c.active = true order by c.name")
    List<Council> findActiveOrderByName();

    @EntityGraph(attributePaths = "local")
    @Query("select c from Council c order by c.name")
    List<Council> findAllOrderByName();

    @EntityGraph(attributePaths = "local")
    @Query("select c from Council c where c.id = :id")
    Optional<Council> findWithLocalById(@Param("id") UUID id);

    boolean existsByLocal_Id(UUID localId);
}
