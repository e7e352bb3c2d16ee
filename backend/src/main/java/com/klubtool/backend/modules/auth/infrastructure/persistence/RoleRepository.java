package com.klubtool.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.modules.auth.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    @Query("select r from Role r where lower(r.name) = lower(:name)")
    Optional<Role> findByNameIgnoreCase(@Param("name") String name);

    List<Role> findAllByOrderByNameAsc();
}
