package com.klubtool.backend.modules.group.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.group.domain.GroupMeeting;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface GroupMeetingRepository extends JpaRepository<GroupMeeting, UUID> {

    /**
     * With {@code includeCancelled}, cancelled meetings are returned even when inactive.
     */
    @EntityGraph(attributePaths = "group")
    @Query("""
            select m
              from GroupMeeting m
             where m.group.id in :groupIds
               and m.scheduledAt >= :from
               and (m.active = true
                    or (:includeCancelled = true
                        and m.status = com.klubtool.backend.modules.group.domain.GroupMeetingStatus.CANCELLED))
             order by m.scheduledAt
            """)
    List<GroupMeeting> findCalendarMeetings(
            @Param("groupIds") Collection<UUID> groupIds,
            @Param("from") OffsetDateTime from,
            @Param("includeCancelled") boolean includeCancelled
    );

    @EntityGraph(attributePaths = "group")
    @Query("select m from GroupMeeting m where m.id = :id")
    Optional<GroupMeeting> findWithGroupById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "group")
    @Query("select m from GroupMeeting m order by m.scheduledAt desc")
    List<GroupMeeting> findAllOrderByScheduledAtDesc();

    @EntityGraph(attributePaths = "group")
    @Query("select m from GroupMeeting m where m.group.id in :groupIds order by m.scheduledAt desc")
    List<GroupMeeting> findByGroupIds(@Param("groupIds") Collection<UUID> groupIds);
}
