package com.ayni.core.domain;

import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the donation state machine.
 */
class DonationPropertyTest {

    private static final String DONOR = "0x1111111111111111111111111111111111111111";
    private static final String NONPROFIT = "0x2222222222222222222222222222222222222222";
    private static final BigInteger MIN = new BigInteger("100000000000000000");
    private static final BigInteger MAX = new BigInteger("10000000000000000000");
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration FUNDING_PERIOD = Duration.ofDays(30);
    private static final Duration MAX_EXTENSION = Duration.ofDays(90);

    private static Donation newDonation(BigInteger amount) {
        var terms = new DonationTerms(amount, 5, "Clean Water", "Wells for the valley", BigInteger.valueOf(1000));
        return Donation.create(1L, DONOR, terms, NOW, FUNDING_PERIOD);
    }

    @Property(tries = 100)
    void termsWithinBoundsAreAccepted(
            @ForAll @BigRange(min = "100000000000000000", max = "10000000000000000000") BigInteger amount,
            @ForAll @IntRange(min = 1, max = 10) int percentage) {
        var terms = new DonationTerms(amount, percentage, "Name", "Description", BigInteger.ONE);
        assertThatCode(() -> terms.validate(MIN, MAX)).doesNotThrowAnyException();
    }

    @Property(tries = 100)
    void amountOutsideBoundsIsRejected(
            @ForAll @BigRange(min = "0", max = "99999999999999999") BigInteger belowMin,
            @ForAll @BigRange(min = "10000000000000000001", max = "1000000000000000000000") BigInteger aboveMax) {
        for (BigInteger amount : new BigInteger[]{belowMin, aboveMax}) {
            var terms = new DonationTerms(amount, 5, "Name", "Description", BigInteger.ONE);
            assertThatThrownBy(() -> terms.validate(MIN, MAX))
                    .isInstanceOf(LedgerException.class)
                    .extracting(e -> ((LedgerException) e).getError())
                    .isEqualTo(LedgerError.INVALID_AMOUNT);
        }
    }

    @Property(tries = 50)
    void percentageOutsideBoundsIsRejected(@ForAll("badPercentages") int percentage) {
        var terms = new DonationTerms(MIN, percentage, "Name", "Description", BigInteger.ONE);
        assertThatThrownBy(() -> terms.validate(MIN, MAX))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INVALID_PERCENTAGE);
    }

    @Provide
    Arbitrary<Integer> badPercentages() {
        return Arbitraries.oneOf(
                Arbitraries.integers().between(Integer.MIN_VALUE, 0),
                Arbitraries.integers().between(11, Integer.MAX_VALUE));
    }

    @Example
    void validationChecksRunInOrder() {
        var allWrong = new DonationTerms(BigInteger.ZERO, 0, "", "", BigInteger.ZERO);
        assertThatThrownBy(() -> allWrong.validate(MIN, MAX))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INVALID_AMOUNT);

        var blankName = new DonationTerms(MIN, 5, "   ", "Description", BigInteger.ZERO);
        assertThatThrownBy(() -> blankName.validate(MIN, MAX))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.EMPTY_STRING);

        var zeroValuation = new DonationTerms(MIN, 5, "Name", "Description", BigInteger.ZERO);
        assertThatThrownBy(() -> zeroValuation.validate(MIN, MAX))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.ZERO_VALUE);
    }

    @Example
    void newDonationIsActiveWithDeadlineOneFundingPeriodAhead() {
        Donation donation = newDonation(MIN);

        assertThat(donation.getStatus()).isEqualTo(Donation.DonationStatus.ACTIVE);
        assertThat(donation.getNonprofit()).isNull();
        assertThat(donation.getFundingDeadline()).isEqualTo(NOW.plus(FUNDING_PERIOD));
    }

    @Property(tries = 100)
    void fundingRequiresExactAmount(
            @ForAll @BigRange(min = "1", max = "20000000000000000000") BigInteger supplied) {
        Donation donation = newDonation(MIN);
        Assume.that(supplied.compareTo(MIN) != 0);

        assertThatThrownBy(() -> donation.fund(NONPROFIT, supplied, NOW))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INVALID_AMOUNT);
        assertThat(donation.isActive()).isTrue();
    }

    @Property(tries = 100)
    void fundingSucceedsUpToAndIncludingTheDeadline(
            @ForAll @LongRange(min = 0, max = 30L * 86_400) long secondsAfterCreation) {
        Donation donation = newDonation(MIN);

        donation.fund(NONPROFIT, MIN, NOW.plusSeconds(secondsAfterCreation));

        assertThat(donation.getStatus()).isEqualTo(Donation.DonationStatus.FUNDED);
        assertThat(donation.getNonprofit()).isEqualTo(NONPROFIT);
    }

    @Property(tries = 100)
    void fundingAfterDeadlineFails(@ForAll @LongRange(min = 1, max = 1_000_000) long secondsLate) {
        Donation donation = newDonation(MIN);
        Instant late = donation.getFundingDeadline().plusSeconds(secondsLate);

        assertThatThrownBy(() -> donation.fund(NONPROFIT, MIN, late))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.DEADLINE_PASSED);
    }

    @Example
    void donorCannotFundOwnDonation() {
        Donation donation = newDonation(MIN);

        assertThatThrownBy(() -> donation.fund(DONOR, MIN, NOW))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.UNAUTHORIZED_ACCESS);
    }

    @Example
    void fundedDonationCannotBeFundedOrCancelled() {
        Donation donation = newDonation(MIN);
        donation.fund(NONPROFIT, MIN, NOW);

        assertThatThrownBy(() -> donation.fund(NONPROFIT, MIN, NOW))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.DONATION_NOT_ACTIVE);
        assertThatThrownBy(() -> donation.cancel(DONOR))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.DONATION_NOT_ACTIVE);
    }

    @Example
    void distributedDonationCannotBeDistributedTwice() {
        Donation donation = newDonation(MIN);
        donation.fund(NONPROFIT, MIN, NOW);
        donation.checkDistributable(DONOR);
        donation.markDistributed();

        assertThat(donation.getStatus()).isEqualTo(Donation.DonationStatus.DISTRIBUTED);
        assertThatThrownBy(() -> donation.checkDistributable(DONOR))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.UNAUTHORIZED_ACCESS);
    }

    @Example
    void onlyDonorMayDistributeOrCancel() {
        Donation donation = newDonation(MIN);

        assertThatThrownBy(() -> donation.cancel(NONPROFIT))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.UNAUTHORIZED_ACCESS);
        assertThatThrownBy(() -> donation.checkDistributable(NONPROFIT))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.UNAUTHORIZED_ACCESS);

        donation.cancel(DONOR);
        assertThat(donation.getStatus()).isEqualTo(Donation.DonationStatus.CANCELLED);
    }

    @Property(tries = 100)
    void deadlineOnlyMovesForwardAndCumulativeExtensionIsCapped(
            @ForAll @Size(min = 1, max = 10) java.util.List<@IntRange(min = 1, max = 60) Integer> extensions) {
        Donation donation = newDonation(MIN);
        long granted = 0;

        for (int days : extensions) {
            Instant before = donation.getFundingDeadline();
            if (granted + days <= MAX_EXTENSION.toDays()) {
                donation.extendDeadline(DONOR, days, NOW, MAX_EXTENSION);
                granted += days;
                assertThat(donation.getFundingDeadline()).isEqualTo(before.plus(Duration.ofDays(days)));
            } else {
                assertThatThrownBy(() -> donation.extendDeadline(DONOR, days, NOW, MAX_EXTENSION))
                        .extracting(e -> ((LedgerException) e).getError())
                        .isEqualTo(LedgerError.INVALID_DEADLINE);
                assertThat(donation.getFundingDeadline()).isEqualTo(before);
            }
        }
        assertThat(donation.getExtensionDays()).isEqualTo(granted);
        assertThat(donation.getExtensionDays()).isLessThanOrEqualTo(MAX_EXTENSION.toDays());
    }

    @Example
    void extensionRejectsZeroAndOverflow() {
        Donation donation = newDonation(MIN);

        assertThatThrownBy(() -> donation.extendDeadline(DONOR, 0, NOW, MAX_EXTENSION))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.ZERO_VALUE);
        assertThatThrownBy(() -> donation.extendDeadline(DONOR, Long.MAX_VALUE, NOW, MAX_EXTENSION))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INVALID_DEADLINE);
        assertThatThrownBy(() -> donation.extendDeadline(DONOR, 3_000_000, NOW, Duration.ofSeconds(Long.MAX_VALUE)))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INVALID_DEADLINE);
        assertThat(donation.getFundingDeadline()).isEqualTo(NOW.plus(FUNDING_PERIOD));
    }

    @Example
    void extensionAfterDeadlineFails() {
        Donation donation = newDonation(MIN);
        Instant late = donation.getFundingDeadline().plusSeconds(1);

        assertThatThrownBy(() -> donation.extendDeadline(DONOR, 1, late, MAX_EXTENSION))
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.DEADLINE_PASSED);
    }
}
