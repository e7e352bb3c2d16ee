package com.klubtool.backend.modules.council.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.council.domain.CouncilSession;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CouncilSessionRepository extends JpaRepository<CouncilSession, UUID> {

    /**
     * Active plenary sessions (no committee) of the given councils from {@code from} on,
     * minus those the user has excused themselves from.
     */
    @EntityGraph(attributePaths = "council")
    @Query("""
            select s
              from CouncilSession s
             where s.council.id in :councilIds
               and s.committee is null
               and s.active = true
               and s.scheduledAt >= :from
               and not exists (
                    select 1
                      from SessionExcuse se
                     where se.session = s
                       and se.user.id = :userId
               )
             order by s.scheduledAt
            """)
    List<CouncilSession> findCalendarSessions(
            @Param("councilIds") Collection<UUID> councilIds,
            @Param("userId") UUID userId,
            @Param("from") OffsetDateTime from
    );

    @EntityGraph(attributePaths = {"council", "council.local", "committee"})
    @Query("select s from CouncilSession s where s.id = :id")
    Optional<CouncilSession> findDetailedById(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"council", "council.local", "committee"})
    @Query("select s from CouncilSession s order by s.scheduledAt desc")
    List<CouncilSession> findAllOrderByScheduledAtDesc();

    @EntityGraph(attributePaths = {"council", "council.local", "committee"})
    @Query("select s from CouncilSession s where s.council.id in :councilIds order by s.scheduledAt desc")
    List<CouncilSession> findByCouncilIds(@Param("councilIds") Collection<UUID> councilIds);
}
