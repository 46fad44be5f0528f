package com.ayni.core.repository;

import com.ayni.core.domain.Role;
import com.ayni.core.domain.UserReputation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserReputationRepository extends JpaRepository<UserReputation, UUID> {

    Optional<UserReputation> findByIdentityAndRole(String identity, Role role);

    List<UserReputation> findByIdentity(String identity);
}
