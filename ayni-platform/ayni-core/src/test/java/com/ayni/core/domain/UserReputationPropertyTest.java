package com.ayni.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the running rating average.
 */
class UserReputationPropertyTest {

    private static final String IDENTITY = "0x3333333333333333333333333333333333333333";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Property(tries = 200)
    void averageStaysWithinRatingBounds(
            @ForAll @Size(min = 1, max = 50) List<@IntRange(min = 1, max = 5) Integer> ratings) {
        var reputation = UserReputation.create(IDENTITY, Role.DONOR);

        for (int rating : ratings) {
            reputation.applyRating(rating, "ok", NOW);
            assertThat(reputation.getRating()).isBetween(UserReputation.MIN_RATING, UserReputation.MAX_RATING);
        }
        assertThat(reputation.getTotalRatings()).isEqualTo(ratings.size());
    }

    @Property(tries = 100)
    void everyUpdateFollowsTheTruncatedRecurrence(
            @ForAll @Size(min = 1, max = 30) List<@IntRange(min = 1, max = 5) Integer> ratings) {
        var reputation = UserReputation.create(IDENTITY, Role.NONPROFIT);
        long expected = 0;
        long count = 0;

        for (int rating : ratings) {
            expected = (expected * count + rating) / (count + 1);
            count++;
            reputation.applyRating(rating, "review " + count, NOW);
        }
        assertThat(reputation.getRating()).isEqualTo((int) expected);
        assertThat(reputation.getReview()).isEqualTo("review " + count);
    }

    @Example
    void truncatesTowardsZero() {
        var reputation = UserReputation.create(IDENTITY, Role.DONOR);

        reputation.applyRating(5, "first", NOW);
        reputation.applyRating(3, "second", NOW);
        reputation.applyRating(4, "third", NOW);

        // 5, then (5+3)/2 = 4, then (4*2+4)/3 = 4
        assertThat(reputation.getRating()).isEqualTo(4);
        assertThat(reputation.getTotalRatings()).isEqualTo(3);
        assertThat(reputation.getReview()).isEqualTo("third");
        assertThat(reputation.getLastUpdated()).isEqualTo(NOW);
    }

    @Property(tries = 50)
    void ratingsOutsideRangeAreRejected(@ForAll("outOfRange") int rating) {
        var reputation = UserReputation.create(IDENTITY, Role.DONOR);

        assertThatThrownBy(() -> reputation.applyRating(rating, "bad", NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(reputation.getTotalRatings()).isZero();
    }

    @Provide
    Arbitrary<Integer> outOfRange() {
        return Arbitraries.oneOf(
                Arbitraries.integers().between(-100, 0),
                Arbitraries.integers().between(6, 100));
    }

    @Example
    void adminHasNoReputation() {
        assertThatThrownBy(() -> UserReputation.create(IDENTITY, Role.ADMIN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
