package com.klubtool.backend.modules.motion.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.motion.domain.Motion;
import com.klubtool.backend.modules.motion.domain.MotionKind;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MotionRepository extends JpaRepository<Motion, UUID> {

    @EntityGraph(attributePaths = {"group", "session", "session.council", "submittedBy"})
    @Query("select m from Motion m where m.id = :id and m.kind = :kind")
    Optional<Motion> findDetailedById(@Param("id") UUID id, @Param("kind") MotionKind kind);

    @EntityGraph(attributePaths = {"group", "session", "session.council", "submittedBy"})
    @Query("select m from Motion m where m.kind = :kind order by m.createdAt desc")
    List<Motion> findAllByKind(@Param("kind") MotionKind kind);

    @EntityGraph(attributePaths = {"group", "session", "session.council", "submittedBy"})
    @Query("""
            select m
              from Motion m
             where m.kind = :kind
               and m.group.id in :groupIds
             order by m.createdAt desc
            """)
    List<Motion> findByKindAndGroupIds(@Param("kind") MotionKind kind, @Param("groupIds") Collection<UUID> groupIds);
}
