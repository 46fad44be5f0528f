package com.ayni.core.repository;

import com.ayni.core.domain.Donation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Donation records keyed by their sequential id. Records are never deleted by the ledger.
 */
@Repository
public interface DonationRepository extends JpaRepository<Donation, Long> {

    List<Donation> findByDonorOrderByIdAsc(String donor);

    List<Donation> findByNonprofitOrderByIdAsc(String nonprofit);
}
