package com.ayni.core.repository;

import com.ayni.core.domain.Role;
import com.ayni.core.domain.RoleAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RoleAssignmentRepository extends JpaRepository<RoleAssignment, UUID> {

    boolean existsByIdentityAndRole(String identity, Role role);

    Optional<RoleAssignment> findByIdentityAndRole(String identity, Role role);

    List<RoleAssignment> findByIdentity(String identity);

    long countByRole(Role role);
}
