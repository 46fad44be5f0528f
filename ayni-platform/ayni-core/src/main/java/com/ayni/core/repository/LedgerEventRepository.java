package com.ayni.core.repository;

import com.ayni.core.domain.LedgerEvent;
import com.ayni.core.domain.LedgerEvent.EventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ledger events.
 * Append-only: the ledger never updates an event except to record its anchor.
 */
@Repository
public interface LedgerEventRepository extends JpaRepository<LedgerEvent, Long> {

    List<LedgerEvent> findByDonationIdOrderByIdAsc(Long donationId);

    @Query("SELECT e FROM LedgerEvent e WHERE e.subject = :identity OR e.actor = :identity ORDER BY e.id ASC")
    List<LedgerEvent> findByParticipant(@Param("identity") String identity);

    List<LedgerEvent> findByEventTypeOrderByIdAsc(EventType eventType);

    /**
     * Hash of the most recently appended event, for chaining.
     */
    @Query("SELECT e.eventHash FROM LedgerEvent e WHERE e.eventHash IS NOT NULL ORDER BY e.id DESC LIMIT 1")
    Optional<String> findLatestEventHash();

    Optional<LedgerEvent> findByEventHash(String eventHash);

    Optional<LedgerEvent> findTopByIdLessThanOrderByIdDesc(Long id);
}
