package com.ayni.api.reputation;

import com.ayni.api.access.AccessControlService;
import com.ayni.api.event.LedgerEventService;
import com.ayni.api.state.LedgerStateService;
import com.ayni.api.state.ReentrancyGuard;
import com.ayni.core.domain.DonorActivity;
import com.ayni.core.domain.Identities;
import com.ayni.core.domain.LedgerEvent.EventType;
import com.ayni.core.domain.RatingRecord;
import com.ayni.core.domain.Role;
import com.ayni.core.domain.UserReputation;
import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import com.ayni.core.error.ReentrantCallException;
import com.ayni.core.repository.DonorActivityRepository;
import com.ayni.core.repository.RatingRecordRepository;
import com.ayni.core.repository.UserReputationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reputation aggregation between ledger participants.
 *
 * A rating lands on the subject's NONPROFIT aggregate when the subject holds the NONPROFIT
 * role, otherwise on its DONOR aggregate. A rater may rate a subject once per donation the
 * subject has created; the subject's first rating is keyed on a donation count of zero.
 */
@Service
@Transactional(noRollbackFor = ReentrantCallException.class)
public class ReputationService {

    private static final Logger log = LoggerFactory.getLogger(ReputationService.class);

    private final UserReputationRepository reputationRepository;
    private final RatingRecordRepository ratingRepository;
    private final DonorActivityRepository activityRepository;
    private final AccessControlService accessControl;
    private final LedgerEventService eventService;
    private final LedgerStateService ledgerState;
    private final ReentrancyGuard reentrancyGuard;

    public ReputationService(
            UserReputationRepository reputationRepository,
            RatingRecordRepository ratingRepository,
            DonorActivityRepository activityRepository,
            AccessControlService accessControl,
            LedgerEventService eventService,
            LedgerStateService ledgerState,
            ReentrancyGuard reentrancyGuard) {
        this.reputationRepository = reputationRepository;
        this.ratingRepository = ratingRepository;
        this.activityRepository = activityRepository;
        this.accessControl = accessControl;
        this.eventService = eventService;
        this.ledgerState = ledgerState;
        this.reentrancyGuard = reentrancyGuard;
    }

    public ReputationDto updateReputation(String caller, String subjectIdentity, int rating, String review) {
        reentrancyGuard.enter("updateReputation");
        try {
            accessControl.requireNotPaused();
            String subject = Identities.require(subjectIdentity);
            String rater = Identities.require(caller);
            if (rating < UserReputation.MIN_RATING || rating > UserReputation.MAX_RATING) {
                throw LedgerException.of(LedgerError.INVALID_RATING, "Rating must be between 1 and 5: " + rating);
            }
            if (review == null || review.isBlank()) {
                throw LedgerException.of(LedgerError.EMPTY_STRING, "Review is required");
            }
            if (rater.equals(subject)) {
                throw LedgerException.of(LedgerError.UNAUTHORIZED_ACCESS, "Participants cannot rate themselves");
            }

            long subjectDonations = activityRepository.findById(subject)
                    .map(DonorActivity::getDonationCount)
                    .orElse(0L);
            if (ratingRepository.existsByRaterAndSubjectAndSubjectDonationCount(rater, subject, subjectDonations)) {
                throw LedgerException.of(LedgerError.ALREADY_RATED,
                        rater + " already rated " + subject + " at donation count " + subjectDonations);
            }

            Instant now = ledgerState.now();
            Role role = accessControl.hasRole(subject, Role.NONPROFIT) ? Role.NONPROFIT : Role.DONOR;
            UserReputation reputation = reputationRepository.findByIdentityAndRole(subject, role)
                    .orElseGet(() -> UserReputation.create(subject, role));
            reputation.applyRating(rating, review, now);
            reputationRepository.save(reputation);
            ratingRepository.save(RatingRecord.create(rater, subject, subjectDonations, rating, now));

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("role", role.name());
            payload.put("rating", rating);
            payload.put("average", reputation.getRating());
            payload.put("totalRatings", reputation.getTotalRatings());
            payload.put("review", review);
            eventService.append(EventType.REPUTATION_UPDATED, null, subject, rater, payload);
            log.info("{} rated {} as {}: {} (average {} over {})",
                    rater, subject, role, rating, reputation.getRating(), reputation.getTotalRatings());
            return getReputation(subject);
        } finally {
            reentrancyGuard.exit();
        }
    }

    @Transactional(readOnly = true)
    public ReputationDto getReputation(String identity) {
        String subject = Identities.require(identity);
        return new ReputationDto(subject, aggregate(subject, Role.DONOR), aggregate(subject, Role.NONPROFIT));
    }

    private AggregateDto aggregate(String identity, Role role) {
        return reputationRepository.findByIdentityAndRole(identity, role)
                .map(rep -> new AggregateDto(rep.getRating(), rep.getTotalRatings(), rep.getLastUpdated(), rep.getReview()))
                .orElse(new AggregateDto(0, 0, null, null));
    }

    public record ReputationDto(String identity, AggregateDto asDonor, AggregateDto asNonprofit) {}

    public record AggregateDto(int rating, long totalRatings, Instant lastUpdated, String review) {}
}
