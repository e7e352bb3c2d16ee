package com.klubtool.backend.modules.calendar.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.calendar.domain.CalendarSubscriptionToken;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CalendarSubscriptionTokenRepository extends JpaRepository<CalendarSubscriptionToken, UUID> {

    @EntityGraph(attributePaths = {"user", "user.role"})
    Optional<CalendarSubscriptionToken> findByTokenHash(String tokenHash);

    @Query("""
            select t
              from CalendarSubscriptionToken t
             where t.user.id = :userId
               and t.revokedAt is null
            """)
    List<CalendarSubscriptionToken> findActiveByUserId(@Param("userId") UUID userId);
}
