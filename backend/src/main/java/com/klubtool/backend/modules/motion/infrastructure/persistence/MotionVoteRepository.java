package com.klubtool.backend.modules.motion.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.motion.domain.MotionVote;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MotionVoteRepository extends JpaRepository<MotionVote, UUID> {

    Optional<MotionVote> findByMotionIdAndVoterId(UUID motionId, UUID voterId);

    @Query("""
            select new com.klubtool.backend.modules.motion.infrastructure.persistence.MotionVoteCount(
                       v.motion.id, v.choice, count(v))
              from MotionVote v
             where v.motion.id in :motionIds
             group by v.motion.id, v.choice
            """)
    List<MotionVoteCount> countByChoice(@Param("motionIds") Collection<UUID> motionIds);
}
