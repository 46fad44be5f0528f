package com.ayni.core.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Number of donations an identity has created. Rating deduplication keys on it.
 */
@Entity
@Table(name = "donor_activity")
public class DonorActivity {

    @Id
    @Column(name = "identity_address", length = 42)
    private String identity;

    @Column(name = "donation_count", nullable = false)
    private long donationCount;

    @Column(name = "last_donation_at")
    private Instant lastDonationAt;

    @Version
    private Long version;

    protected DonorActivity() {}

    public static DonorActivity start(String identity) {
        var activity = new DonorActivity();
        activity.identity = identity;
        activity.donationCount = 0;
        return activity;
    }

    public void recordDonation(Instant now) {
        this.donationCount = Math.addExact(donationCount, 1L);
        this.lastDonationAt = now;
    }

    public String getIdentity() { return identity; }
    public long getDonationCount() { return donationCount; }
    public Instant getLastDonationAt() { return lastDonationAt; }
}
