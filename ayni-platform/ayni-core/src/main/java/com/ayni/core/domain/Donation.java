package com.ayni.core.domain;

import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * A donation offer and its lifecycle flags.
 *
 * Lifecycle: ACTIVE -> FUNDED -> DISTRIBUTED, or ACTIVE -> CANCELLED.
 * The funding deadline only moves forward, and only while the offer is active.
 */
@Entity
@Table(name = "donations", indexes = {
    @Index(name = "idx_donation_donor", columnList = "donor"),
    @Index(name = "idx_donation_nonprofit", columnList = "nonprofit")
})
public class Donation {

    /**
     * Latest deadline the ledger can store.
     */
    public static final Instant MAX_DEADLINE = Instant.parse("9999-12-31T23:59:59Z");

    private static final long SECONDS_PER_DAY = 86_400L;

    @Id
    private Long id;

    @NotNull
    @Column(nullable = false, updatable = false, length = 42)
    private String donor;

    @Column(length = 42)
    private String nonprofit;

    @NotNull
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger amount;

    @Min(1)
    @Max(10)
    @Column(name = "equity_percentage", nullable = false)
    private int equityPercentage;

    @NotNull
    @Column(name = "funding_deadline", nullable = false)
    private Instant fundingDeadline;

    @Column(name = "extension_days", nullable = false)
    private long extensionDays;

    @NotNull
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger valuation;

    @NotBlank
    @Column(name = "nonprofit_name", nullable = false, columnDefinition = "TEXT")
    private String nonprofitName;

    @NotBlank
    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private boolean distributed;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    protected Donation() {}

    public static Donation create(Long id, String donor, DonationTerms terms, Instant now, Duration fundingPeriod) {
        var donation = new Donation();
        donation.id = id;
        donation.donor = donor;
        donation.amount = terms.amount();
        donation.equityPercentage = terms.equityPercentage();
        donation.nonprofitName = terms.nonprofitName();
        donation.description = terms.description();
        donation.valuation = terms.valuation();
        donation.fundingDeadline = addSeconds(now, fundingPeriod.getSeconds());
        donation.extensionDays = 0;
        donation.active = true;
        donation.distributed = false;
        donation.createdAt = now;
        return donation;
    }

    /**
     * Accepts the offer: the funder becomes the nonprofit and the record leaves ACTIVE.
     */
    public void fund(String funder, BigInteger suppliedValue, Instant now) {
        if (!active) {
            throw LedgerException.of(LedgerError.DONATION_NOT_ACTIVE, "Donation " + id + " is not active");
        }
        if (Identities.same(donor, funder)) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED_ACCESS, "Donor cannot fund own donation " + id);
        }
        if (suppliedValue == null || suppliedValue.compareTo(amount) != 0) {
            throw LedgerException.of(LedgerError.INVALID_AMOUNT,
                    "Supplied value " + suppliedValue + " does not match amount " + amount);
        }
        if (now.isAfter(fundingDeadline)) {
            throw LedgerException.of(LedgerError.DEADLINE_PASSED, "Funding deadline passed for donation " + id);
        }
        this.nonprofit = funder;
        this.active = false;
    }

    /**
     * Checks that the caller may release the escrow. The escrow balance itself is
     * checked by the vault.
     */
    public void checkDistributable(String caller) {
        requireDonor(caller);
        if (distributed) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED_ACCESS, "Donation " + id + " already distributed");
        }
    }

    public void markDistributed() {
        this.distributed = true;
        this.active = false;
    }

    public void cancel(String caller) {
        requireDonor(caller);
        if (!active) {
            throw LedgerException.of(LedgerError.DONATION_NOT_ACTIVE, "Donation " + id + " is not active");
        }
        this.active = false;
    }

    /**
     * Pushes the funding deadline back by whole days. The cumulative extension is capped
     * and every arithmetic step is overflow checked.
     */
    public void extendDeadline(String caller, long days, Instant now, Duration maxExtension) {
        requireDonor(caller);
        if (!active) {
            throw LedgerException.of(LedgerError.DONATION_NOT_ACTIVE, "Donation " + id + " is not active");
        }
        if (now.isAfter(fundingDeadline)) {
            throw LedgerException.of(LedgerError.DEADLINE_PASSED, "Funding deadline passed for donation " + id);
        }
        if (days <= 0) {
            throw LedgerException.of(LedgerError.ZERO_VALUE, "Extension must be at least one day");
        }
        long cumulativeDays;
        long extensionSeconds;
        try {
            cumulativeDays = Math.addExact(extensionDays, days);
            extensionSeconds = Math.multiplyExact(days, SECONDS_PER_DAY);
            if (Math.multiplyExact(cumulativeDays, SECONDS_PER_DAY) > maxExtension.getSeconds()) {
                throw LedgerException.of(LedgerError.INVALID_DEADLINE,
                        "Cumulative extension exceeds " + maxExtension.toDays() + " days");
            }
        } catch (ArithmeticException e) {
            throw new LedgerException(LedgerError.INVALID_DEADLINE, "Extension overflows", e);
        }
        this.fundingDeadline = addSeconds(fundingDeadline, extensionSeconds);
        this.extensionDays = cumulativeDays;
    }

    public boolean isDonor(String identity) {
        return Identities.same(donor, identity);
    }

    public DonationStatus getStatus() {
        if (active) {
            return DonationStatus.ACTIVE;
        }
        if (distributed) {
            return DonationStatus.DISTRIBUTED;
        }
        return nonprofit != null ? DonationStatus.FUNDED : DonationStatus.CANCELLED;
    }

    private void requireDonor(String caller) {
        if (!isDonor(caller)) {
            throw LedgerException.of(LedgerError.UNAUTHORIZED_ACCESS, "Only the donor may modify donation " + id);
        }
    }

    private static Instant addSeconds(Instant base, long seconds) {
        long epochSecond;
        try {
            epochSecond = Math.addExact(base.getEpochSecond(), seconds);
        } catch (ArithmeticException e) {
            throw new LedgerException(LedgerError.INVALID_DEADLINE, "Deadline overflows", e);
        }
        if (epochSecond > MAX_DEADLINE.getEpochSecond()) {
            throw LedgerException.of(LedgerError.INVALID_DEADLINE, "Deadline beyond " + MAX_DEADLINE);
        }
        return Instant.ofEpochSecond(epochSecond);
    }

    // Getters
    public Long getId() { return id; }
    public String getDonor() { return donor; }
    public String getNonprofit() { return nonprofit; }
    public BigInteger getAmount() { return amount; }
    public int getEquityPercentage() { return equityPercentage; }
    public Instant getFundingDeadline() { return fundingDeadline; }
    public long getExtensionDays() { return extensionDays; }
    public BigInteger getValuation() { return valuation; }
    public String getNonprofitName() { return nonprofitName; }
    public String getDescription() { return description; }
    public boolean isActive() { return active; }
    public boolean isDistributed() { return distributed; }
    public Instant getCreatedAt() { return createdAt; }

    public enum DonationStatus {
        ACTIVE, FUNDED, DISTRIBUTED, CANCELLED
    }
}
