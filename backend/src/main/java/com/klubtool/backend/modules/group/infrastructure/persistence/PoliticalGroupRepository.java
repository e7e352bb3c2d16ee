package com.klubtool.backend.modules.group.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.group.domain.PoliticalGroup;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PoliticalGroupRepository extends JpaRepository<PoliticalGroup, UUID> {

    @EntityGraph(attributePaths = {"party", "party.local"})
    @Query("select g from PoliticalGroup g where g.id = :id")
    Optional<PoliticalGroup> findWithChainById(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"party", "party.local"})
    @Query("select g from PoliticalGroup g order by g.name")
    List<PoliticalGroup> findAllOrderByName();

    @EntityGraph(attributePaths = {"party", "party.local"})
    @Query("select g from PoliticalGroup g where g.id in :ids order by g.name")
    List<PoliticalGroup> findByIdsOrderByName(@Param("ids") Collection<UUID> ids);
}
