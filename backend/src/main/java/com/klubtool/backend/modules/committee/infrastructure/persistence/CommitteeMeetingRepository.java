package com.klubtool.backend.modules.committee.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.committee.domain.CommitteeMeeting;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommitteeMeetingRepository extends JpaRepository<CommitteeMeeting, UUID> {

    @EntityGraph(attributePaths = "committee")
    @Query("""
            select m
              from CommitteeMeeting m
             where m.committee.id in :committeeIds
               and m.active = true
               and m.scheduledAt >= :from
             order by m.scheduledAt
            """)
    List<CommitteeMeeting> findActiveByCommitteeIds(
            @Param("committeeIds") Collection<UUID> committeeIds,
            @Param("from") OffsetDateTime from
    );

    @EntityGraph(attributePaths = "committee")
    @Query("""
            select m
              from CommitteeMeeting m
             where m.id in :meetingIds
               and m.active = true
               and m.scheduledAt >= :from
             order by m.scheduledAt
            """)
    List<CommitteeMeeting> findActiveByIds(
            @Param("meetingIds") Collection<UUID> meetingIds,
            @Param("from") OffsetDateTime from
    );

    @EntityGraph(attributePaths = {"committee", "committee.council"})
    @Query("select m from CommitteeMeeting m where m.id = :id")
    Optional<CommitteeMeeting> findDetailedById(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"committee", "committee.council"})
    @Query("select m from CommitteeMeeting m order by m.scheduledAt desc")
    List<CommitteeMeeting> findAllOrderByScheduledAtDesc();

    @EntityGraph(attributePaths = {"committee", "committee.council"})
    @Query("""
            select m
              from CommitteeMeeting m
             where m.committee.id in :committeeIds
                or m.id in :meetingIds
                or m.committee.council.id in :councilIds
             order by m.scheduledAt desc
            """)
    List<CommitteeMeeting> findVisible(
            @Param("committeeIds") Collection<UUID> committeeIds,
            @Param("meetingIds") Collection<UUID> meetingIds,
            @Param("councilIds") Collection<UUID> councilIds
    );
}
