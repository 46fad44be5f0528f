package com.ayni.api.state;

import com.ayni.core.domain.LedgerState;
import com.ayni.core.repository.LedgerStateRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Access to the single ledger state row and the ledger clock.
 */
@Service
public class LedgerStateService {

    private final LedgerStateRepository stateRepository;
    private final Clock clock;

    public LedgerStateService(LedgerStateRepository stateRepository, Clock clock) {
        this.stateRepository = stateRepository;
        this.clock = clock;
    }

    /**
     * Locks the state row for the rest of the caller's transaction, creating it on first use.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerState lockForUpdate() {
        return stateRepository.findForUpdate(LedgerState.SINGLETON_ID)
                .orElseGet(() -> stateRepository.saveAndFlush(LedgerState.genesis(now())));
    }

    /**
     * Current state without locking. Before the first write this is an unsaved genesis state.
     */
    @Transactional(readOnly = true)
    public LedgerState current() {
        return stateRepository.findById(LedgerState.SINGLETON_ID)
                .orElseGet(() -> LedgerState.genesis(now()));
    }

    /**
     * Ledger time, at second precision.
     */
    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
