package com.ayni.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Funds paid out of the vault to an identity.
 */
@Entity
@Table(name = "wallet_balances")
public class WalletBalance {

    @Id
    @Column(name = "identity_address", length = 42)
    private String identity;

    @NotNull
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger balance;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected WalletBalance() {}

    public static WalletBalance open(String identity, Instant now) {
        var wallet = new WalletBalance();
        wallet.identity = identity;
        wallet.balance = BigInteger.ZERO;
        wallet.updatedAt = now;
        return wallet;
    }

    public void credit(BigInteger amount, Instant now) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        this.balance = this.balance.add(amount);
        this.updatedAt = now;
    }

    public String getIdentity() { return identity; }
    public BigInteger getBalance() { return balance; }
    public Instant getUpdatedAt() { return updatedAt; }
}
