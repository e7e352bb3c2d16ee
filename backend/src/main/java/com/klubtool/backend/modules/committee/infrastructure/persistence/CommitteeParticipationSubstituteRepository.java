package com.klubtool.backend.modules.committee.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.committee.domain.CommitteeParticipationSubstitute;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommitteeParticipationSubstituteRepository
        extends JpaRepository<CommitteeParticipationSubstitute, UUID> {

    @Query("""
            select distinct s.committeeMeeting.id
              from CommitteeParticipationSubstitute s
             where s.substituteMember.user.id = :userId
            """)
    List<UUID> findMeetingIdsBySubstituteUserId(@Param("userId") UUID userId);

    @EntityGraph(attributePaths = {"member", "member.user", "substituteMember", "substituteMember.user"})
    List<CommitteeParticipationSubstitute> findByCommitteeMeeting_Id(UUID committeeMeetingId);

    @Modifying
    @Query("delete from CommitteeParticipationSubstitute s where s.committeeMeeting.id = :meetingId")
    void deleteByCommitteeMeetingId(@Param("meetingId") UUID meetingId);
}
