package com.klubtool.backend.modules.council.infrastructure.persistence;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.modules.council.domain.SessionExcuse;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SessionExcuseRepository extends JpaRepository<SessionExcuse, UUID> {

    Optional<SessionExcuse> findBySession_IdAndUser_Id(UUID sessionId, UUID userId);

    @Query("""
            select e.session.id
              from SessionExcuse e
             where e.user.id = :userId
               and e.session.id in :sessionIds
            """)
    Set<UUID> findExcusedSessionIds(@Param("userId") UUID userId, @Param("sessionIds") Collection<UUID> sessionIds);
}
