package com.klubtool.backend.modules.local.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.local.domain.Local;

import org.springframework.data.jpa.repository.JpaRepository;

public interface LocalRepository extends JpaRepository<Local, UUID> {

    List<Local> findByActiveTrueOrderByNameAsc();

    List<Local> findAllByOrderByNameAsc();

    boolean existsByNameIgnoreCase(String name);

    boolean existsByCodeIgnoreCase(String code);
}
