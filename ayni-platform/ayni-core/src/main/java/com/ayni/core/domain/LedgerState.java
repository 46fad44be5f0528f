package com.ayni.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Ledger-wide counters and flags, stored as a single row. Mutating operations lock
 * this row so they are applied one at a time.
 */
@Entity
@Table(name = "ledger_state")
public class LedgerState {

    public static final Long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "donation_count", nullable = false)
    private long donationCount;

    @NotNull
    @Column(name = "custodied_total", nullable = false, precision = 38, scale = 0)
    private BigInteger custodiedTotal;

    @Column(nullable = false)
    private boolean paused;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected LedgerState() {}

    public static LedgerState genesis(Instant now) {
        var state = new LedgerState();
        state.id = SINGLETON_ID;
        state.donationCount = 0;
        state.custodiedTotal = BigInteger.ZERO;
        state.paused = false;
        state.updatedAt = now;
        return state;
    }

    /**
     * Assigns the next sequential donation id.
     */
    public long nextDonationId(Instant now) {
        this.donationCount = Math.addExact(donationCount, 1L);
        this.updatedAt = now;
        return donationCount;
    }

    public void addCustody(BigInteger amount, Instant now) {
        this.custodiedTotal = this.custodiedTotal.add(amount);
        this.updatedAt = now;
    }

    public void removeCustody(BigInteger amount, Instant now) {
        if (amount.compareTo(custodiedTotal) > 0) {
            throw new IllegalStateException("Vault holds " + custodiedTotal + ", cannot remove " + amount);
        }
        this.custodiedTotal = this.custodiedTotal.subtract(amount);
        this.updatedAt = now;
    }

    public void setPaused(boolean paused, Instant now) {
        this.paused = paused;
        this.updatedAt = now;
    }

    public Long getId() { return id; }
    public long getDonationCount() { return donationCount; }
    public BigInteger getCustodiedTotal() { return custodiedTotal; }
    public boolean isPaused() { return paused; }
    public Instant getUpdatedAt() { return updatedAt; }
}
