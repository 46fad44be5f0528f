package com.ayni.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Funds custodied for a single donation. Only the escrow vault mutates it.
 */
@Entity
@Table(name = "escrow_balances")
public class EscrowBalance {

    @Id
    @Column(name = "donation_id")
    private Long donationId;

    @NotNull
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger balance;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected EscrowBalance() {}

    public static EscrowBalance open(Long donationId, Instant now) {
        var escrow = new EscrowBalance();
        escrow.donationId = donationId;
        escrow.balance = BigInteger.ZERO;
        escrow.updatedAt = now;
        return escrow;
    }

    public void credit(BigInteger amount, Instant now) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        this.balance = this.balance.add(amount);
        this.updatedAt = now;
    }

    /**
     * Zeroes the balance and returns what it held.
     */
    public BigInteger drain(Instant now) {
        BigInteger prior = this.balance;
        this.balance = BigInteger.ZERO;
        this.updatedAt = now;
        return prior;
    }

    public boolean isEmpty() {
        return balance.signum() == 0;
    }

    public Long getDonationId() { return donationId; }
    public BigInteger getBalance() { return balance; }
    public Instant getUpdatedAt() { return updatedAt; }
}
