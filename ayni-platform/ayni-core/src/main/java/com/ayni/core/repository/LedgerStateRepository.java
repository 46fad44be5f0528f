package com.ayni.core.repository;

import com.ayni.core.domain.LedgerState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LedgerStateRepository extends JpaRepository<LedgerState, Long> {

    /**
     * Loads the state row with a write lock held until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM LedgerState s WHERE s.id = :id")
    Optional<LedgerState> findForUpdate(@Param("id") Long id);
}
