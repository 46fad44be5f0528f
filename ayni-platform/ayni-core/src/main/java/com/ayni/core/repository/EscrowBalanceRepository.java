package com.ayni.core.repository;

import com.ayni.core.domain.EscrowBalance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.List;

@Repository
public interface EscrowBalanceRepository extends JpaRepository<EscrowBalance, Long> {

    List<EscrowBalance> findByBalanceGreaterThan(BigInteger threshold);
}
