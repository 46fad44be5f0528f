package com.ayni.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Running rating aggregate for one identity acting in one role.
 * Only the latest review is kept.
 */
@Entity
@Table(name = "user_reputations", uniqueConstraints = {
    @UniqueConstraint(name = "uk_reputation_identity_role", columnNames = {"identity_address", "role_name"})
})
public class UserReputation {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "identity_address", nullable = false, length = 42)
    private String identity;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "role_name", nullable = false, length = 16)
    private Role role;

    @Column(nullable = false)
    private int rating;

    @Column(name = "total_ratings", nullable = false)
    private long totalRatings;

    @Column(name = "last_updated")
    private Instant lastUpdated;

    @Column(columnDefinition = "TEXT")
    private String review;

    @Version
    private Long version;

    protected UserReputation() {}

    public static UserReputation create(String identity, Role role) {
        if (role == Role.ADMIN) {
            throw new IllegalArgumentException("Reputation is tracked for donors and nonprofits only");
        }
        var reputation = new UserReputation();
        reputation.identity = identity;
        reputation.role = role;
        reputation.rating = 0;
        reputation.totalRatings = 0;
        return reputation;
    }

    /**
     * Folds a rating into the integer average: (average * count + rating) / (count + 1),
     * truncated.
     */
    public void applyRating(int newRating, String newReview, Instant now) {
        if (newRating < MIN_RATING || newRating > MAX_RATING) {
            throw new IllegalArgumentException("Rating must be between 1 and 5: " + newRating);
        }
        long weighted = Math.addExact(Math.multiplyExact((long) rating, totalRatings), newRating);
        long count = Math.addExact(totalRatings, 1L);
        this.rating = (int) (weighted / count);
        this.totalRatings = count;
        this.review = newReview;
        this.lastUpdated = now;
    }

    public UUID getId() { return id; }
    public String getIdentity() { return identity; }
    public Role getRole() { return role; }
    public int getRating() { return rating; }
    public long getTotalRatings() { return totalRatings; }
    public Instant getLastUpdated() { return lastUpdated; }
    public String getReview() { return review; }
}
