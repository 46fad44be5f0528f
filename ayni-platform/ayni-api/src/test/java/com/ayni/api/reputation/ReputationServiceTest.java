package com.ayni.api.reputation;

import com.ayni.api.AyniApiApplication;
import com.ayni.api.access.AccessControlService;
import com.ayni.api.config.LedgerTestConfiguration;
import com.ayni.api.config.LedgerTestData;
import com.ayni.api.donation.DonationLedgerService;
import com.ayni.api.event.LedgerEventService;
import com.ayni.core.domain.LedgerEvent.EventType;
import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static com.ayni.api.config.LedgerTestData.*;
import static org.assertj.core.api.Assertions.*;

@SpringBootTest(classes = AyniApiApplication.class)
@Import(LedgerTestConfiguration.class)
@ActiveProfiles("test")
class ReputationServiceTest {

    private static final String RATER_A = "0x5555555555555555555555555555555555555555";
    private static final String RATER_B = "0x6666666666666666666666666666666666666666";
    private static final String RATER_C = "0x7777777777777777777777777777777777777777";

    @Autowired
    private ReputationService reputationService;

    @Autowired
    private DonationLedgerService ledger;

    @Autowired
    private AccessControlService accessControl;

    @Autowired
    private LedgerEventService eventService;

    @Autowired
    private LedgerTestData testData;

    @BeforeEach
    void setUp() {
        testData.reset();
    }

    @Test
    void neverRatedIdentityHasZeroedAggregates() {
        var reputation = reputationService.getReputation(DONOR);

        assertThat(reputation.asDonor().rating()).isZero();
        assertThat(reputation.asDonor().totalRatings()).isZero();
        assertThat(reputation.asNonprofit().totalRatings()).isZero();
        assertThat(reputation.asDonor().review()).isNull();
    }

    @Test
    void ratingsFoldIntoTruncatedAverage() {
        reputationService.updateReputation(RATER_A, DONOR, 5, "great");
        reputationService.updateReputation(RATER_B, DONOR, 3, "fine");
        var reputation = reputationService.updateReputation(RATER_C, DONOR, 4, "good");

        assertThat(reputation.asDonor().rating()).isEqualTo(4);
        assertThat(reputation.asDonor().totalRatings()).isEqualTo(3);
        assertThat(reputation.asDonor().review()).isEqualTo("good");
        assertThat(reputation.asDonor().lastUpdated()).isEqualTo(LedgerTestConfiguration.START);
        assertThat(reputation.asNonprofit().totalRatings()).isZero();
    }

    @Test
    void nonprofitSubjectsAreRatedOnTheirNonprofitAggregate() {
        Long id = ledger.createDonation(DONOR, defaultTerms()).id();
        ledger.fundDonation(id, NONPROFIT, ONE_ETHER);

        var reputation = reputationService.updateReputation(DONOR, NONPROFIT, 2, "slow reporting");

        assertThat(reputation.asNonprofit().rating()).isEqualTo(2);
        assertThat(reputation.asNonprofit().totalRatings()).isEqualTo(1);
        assertThat(reputation.asDonor().totalRatings()).isZero();
    }

    @Test
    void raterCanRateSubjectOncePerSubjectDonationCount() {
        reputationService.updateReputation(RATER_A, DONOR, 5, "first");
        assertLedgerError(() -> reputationService.updateReputation(RATER_A, DONOR, 1, "again"),
                LedgerError.ALREADY_RATED);

        // a new donation by the subject opens a new rating window
        ledger.createDonation(DONOR, defaultTerms());
        var reputation = reputationService.updateReputation(RATER_A, DONOR, 1, "after new donation");

        assertThat(reputation.asDonor().totalRatings()).isEqualTo(2);
        assertThat(reputation.asDonor().rating()).isEqualTo(3);
    }

    @Test
    void longQuoteHeavyReviewIsStoredAndLogged() {
        String review = "\"".repeat(9_000);

        var reputation = reputationService.updateReputation(RATER_A, DONOR, 5, review);

        assertThat(reputation.asDonor().review()).isEqualTo(review);
        assertThat(reputationService.getReputation(DONOR).asDonor().review()).isEqualTo(review);
        var events = eventService.eventsForIdentity(DONOR);
        assertThat(events).extracting(LedgerEventService.LedgerEventDto::eventType)
                .contains(EventType.REPUTATION_UPDATED);
    }

    @Test
    void otherRatersAreNotBlockedByEachOther() {
        reputationService.updateReputation(RATER_A, DONOR, 4, "a");

        assertThatCode(() -> reputationService.updateReputation(RATER_B, DONOR, 4, "b"))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsInvalidRatings() {
        assertLedgerError(() -> reputationService.updateReputation(RATER_A, DONOR, 0, "x"), LedgerError.INVALID_RATING);
        assertLedgerError(() -> reputationService.updateReputation(RATER_A, DONOR, 6, "x"), LedgerError.INVALID_RATING);
        assertLedgerError(() -> reputationService.updateReputation(RATER_A, DONOR, 3, "  "), LedgerError.EMPTY_STRING);
        assertLedgerError(() -> reputationService.updateReputation(RATER_A, DONOR, 3, null), LedgerError.EMPTY_STRING);
        assertLedgerError(() -> reputationService.updateReputation(RATER_A, "0x0000000000000000000000000000000000000000", 3, "x"),
                LedgerError.INVALID_ADDRESS);
        assertLedgerError(() -> reputationService.updateReputation(RATER_A, "not-an-address", 3, "x"),
                LedgerError.INVALID_ADDRESS);
        assertLedgerError(() -> reputationService.updateReputation(DONOR, DONOR, 5, "me"), LedgerError.UNAUTHORIZED_ACCESS);

        assertThat(reputationService.getReputation(DONOR).asDonor().totalRatings()).isZero();
    }

    @Test
    void pausedLedgerRejectsRatingsButServesReads() {
        reputationService.updateReputation(RATER_A, DONOR, 5, "before pause");
        accessControl.pause(ADMIN);

        assertLedgerError(() -> reputationService.updateReputation(RATER_B, DONOR, 1, "during pause"),
                LedgerError.PAUSED);
        assertThat(reputationService.getReputation(DONOR).asDonor().rating()).isEqualTo(5);
    }

    @Test
    void ratingRecordsOneEvent() {
        reputationService.updateReputation(RATER_A, DONOR, 5, "great");

        assertThat(eventService.eventsForIdentity(DONOR))
                .extracting(LedgerEventService.LedgerEventDto::eventType)
                .containsExactly(EventType.REPUTATION_UPDATED);
    }

    private static void assertLedgerError(ThrowingCallable call, LedgerError expected) {
        assertThatThrownBy(call)
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(expected);
    }
}
