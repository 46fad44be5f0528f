package com.ayni.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Marks that a rater has rated a subject while the subject had a given donation count.
 */
@Entity
@Table(name = "rating_records", uniqueConstraints = {
    @UniqueConstraint(name = "uk_rating_key", columnNames = {"rater", "subject", "subject_donation_count"})
})
public class RatingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(nullable = false, length = 42)
    private String rater;

    @NotNull
    @Column(nullable = false, length = 42)
    private String subject;

    @Column(name = "subject_donation_count", nullable = false)
    private long subjectDonationCount;

    @Column(nullable = false)
    private int rating;

    @NotNull
    @Column(name = "rated_at", nullable = false)
    private Instant ratedAt;

    protected RatingRecord() {}

    public static RatingRecord create(String rater, String subject, long subjectDonationCount, int rating, Instant now) {
        var record = new RatingRecord();
        record.rater = rater;
        record.subject = subject;
        record.subjectDonationCount = subjectDonationCount;
        record.rating = rating;
        record.ratedAt = now;
        return record;
    }

    public UUID getId() { return id; }
    public String getRater() { return rater; }
    public String getSubject() { return subject; }
    public long getSubjectDonationCount() { return subjectDonationCount; }
    public int getRating() { return rating; }
    public Instant getRatedAt() { return ratedAt; }
}
