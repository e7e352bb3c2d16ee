package com.klubtool.backend.modules.local.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.local.domain.Party;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PartyRepository extends JpaRepository<Party, UUID> {

    List<Party> findByLocal_IdOrderByNameAsc(UUID localId);
}
