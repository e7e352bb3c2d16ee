package com.klubtool.backend.modules.committee.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.committee.domain.Committee;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommitteeRepository extends JpaRepository<Committee, UUID> {

    @EntityGraph(attributePaths = "council")
    @Query("select c from Committee c where c.id = :id")
    Optional<Committee> findWithCouncilById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "council")
    @Query("select c from Committee c order by c.name")
    List<Committee> findAllOrderByName();
}
