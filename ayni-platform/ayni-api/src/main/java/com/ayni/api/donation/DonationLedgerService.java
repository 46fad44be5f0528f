package com.ayni.api.donation;

import com.ayni.api.access.AccessControlService;
import com.ayni.api.config.LedgerProperties;
import com.ayni.api.escrow.EscrowVaultService;
import com.ayni.api.event.LedgerEventService;
import com.ayni.api.state.LedgerStateService;
import com.ayni.api.state.ReentrancyGuard;
import com.ayni.core.domain.Donation;
import com.ayni.core.domain.Donation.DonationStatus;
import com.ayni.core.domain.DonationTerms;
import com.ayni.core.domain.DonorActivity;
import com.ayni.core.domain.Identities;
import com.ayni.core.domain.LedgerEvent.EventType;
import com.ayni.core.domain.LedgerState;
import com.ayni.core.domain.Role;
import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import com.ayni.core.error.ReentrantCallException;
import com.ayni.core.repository.DonationRepository;
import com.ayni.core.repository.DonorActivityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Donation lifecycle: create, fund, distribute, cancel and extend.
 *
 * Each mutating operation holds the reentrancy guard, fails while the ledger is paused,
 * runs every check before it writes anything and records exactly one ledger event.
 */
@Service
@Transactional(noRollbackFor = ReentrantCallException.class)
public class DonationLedgerService {

    private static final Logger log = LoggerFactory.getLogger(DonationLedgerService.class);

    private final DonationRepository donationRepository;
    private final DonorActivityRepository activityRepository;
    private final EscrowVaultService escrowVault;
    private final AccessControlService accessControl;
    private final LedgerEventService eventService;
    private final LedgerStateService ledgerState;
    private final ReentrancyGuard reentrancyGuard;
    private final LedgerProperties properties;

    public DonationLedgerService(
            DonationRepository donationRepository,
            DonorActivityRepository activityRepository,
            EscrowVaultService escrowVault,
            AccessControlService accessControl,
            LedgerEventService eventService,
            LedgerStateService ledgerState,
            ReentrancyGuard reentrancyGuard,
            LedgerProperties properties) {
        this.donationRepository = donationRepository;
        this.activityRepository = activityRepository;
        this.escrowVault = escrowVault;
        this.accessControl = accessControl;
        this.eventService = eventService;
        this.ledgerState = ledgerState;
        this.reentrancyGuard = reentrancyGuard;
        this.properties = properties;
    }

    public DonationDto createDonation(String caller, DonationTerms terms) {
        reentrancyGuard.enter("createDonation");
        try {
            LedgerState state = accessControl.requireNotPaused();
            String donor = Identities.require(caller);
            terms.validate(properties.getMinDonationAmount(), properties.getMaxDonationAmount());

            Instant now = ledgerState.now();
            long donationId = state.nextDonationId(now);
            Donation donation = Donation.create(donationId, donor, terms, now, properties.getFundingPeriod());
            donationRepository.save(donation);

            accessControl.grantImplicit(donor, Role.DONOR);
            DonorActivity activity = activityRepository.findById(donor)
                    .orElseGet(() -> DonorActivity.start(donor));
            activity.recordDonation(now);
            activityRepository.save(activity);

            eventService.append(EventType.DONATION_CREATED, donationId, donor, donor, donationPayload(donation));
            log.info("Donation {} created by {} for {}", donationId, donor, terms.amount());
            return toDto(donation, BigInteger.ZERO);
        } finally {
            reentrancyGuard.exit();
        }
    }

    /**
     * Claims an active donation. The funder must supply exactly the donation amount, which
     * goes into escrow.
     */
    public DonationDto fundDonation(Long donationId, String funder, BigInteger suppliedValue) {
        reentrancyGuard.enter("fundDonation");
        try {
            accessControl.requireNotPaused();
            String nonprofit = Identities.require(funder);
            Donation donation = findDonation(donationId);

            donation.fund(nonprofit, suppliedValue, ledgerState.now());
            donationRepository.save(donation);
            escrowVault.deposit(donationId, donation.getAmount());
            accessControl.grantImplicit(nonprofit, Role.NONPROFIT);

            eventService.append(EventType.DONATION_FUNDED, donationId, nonprofit, nonprofit, donationPayload(donation));
            log.info("Donation {} funded by {}", donationId, nonprofit);
            return toDto(donation, escrowVault.balanceOf(donationId));
        } finally {
            reentrancyGuard.exit();
        }
    }

    /**
     * Releases the escrow of a funded donation to its nonprofit.
     */
    public DonationDto distributeDonation(Long donationId, String caller) {
        reentrancyGuard.enter("distributeDonation");
        try {
            accessControl.requireNotPaused();
            String donor = Identities.require(caller);
            Donation donation = findDonation(donationId);

            donation.checkDistributable(donor);
            if (escrowVault.balanceOf(donationId).signum() == 0 || donation.getNonprofit() == null) {
                throw LedgerException.of(LedgerError.INSUFFICIENT_FUNDS,
                        "Donation " + donationId + " holds no funds to distribute");
            }

            donation.markDistributed();
            donationRepository.save(donation);
            BigInteger released = escrowVault.release(donationId, donation.getNonprofit());

            Map<String, Object> payload = donationPayload(donation);
            payload.put("released", released);
            eventService.append(EventType.DONATION_DISTRIBUTED, donationId, donation.getNonprofit(), donor, payload);
            log.info("Donation {} distributed: {} to {}", donationId, released, donation.getNonprofit());
            return toDto(donation, escrowVault.balanceOf(donationId));
        } finally {
            reentrancyGuard.exit();
        }
    }

    /**
     * Cancels an active donation, refunding the donor if anything is escrowed. Allowed after
     * the funding deadline as long as nobody funded the donation.
     */
    public DonationDto cancelDonation(Long donationId, String caller) {
        reentrancyGuard.enter("cancelDonation");
        try {
            accessControl.requireNotPaused();
            String donor = Identities.require(caller);
            Donation donation = findDonation(donationId);

            donation.cancel(donor);
            donationRepository.save(donation);
            BigInteger refunded = BigInteger.ZERO;
            if (escrowVault.balanceOf(donationId).signum() > 0) {
                refunded = escrowVault.refund(donationId, donation.getDonor());
            }

            Map<String, Object> payload = donationPayload(donation);
            payload.put("refunded", refunded);
            eventService.append(EventType.DONATION_CANCELLED, donationId, donor, donor, payload);
            log.info("Donation {} cancelled by {}, refunded {}", donationId, donor, refunded);
            return toDto(donation, escrowVault.balanceOf(donationId));
        } finally {
            reentrancyGuard.exit();
        }
    }

    public DonationDto extendFundingPeriod(Long donationId, String caller, long extensionDays) {
        reentrancyGuard.enter("extendFundingPeriod");
        try {
            accessControl.requireNotPaused();
            String donor = Identities.require(caller);
            Donation donation = findDonation(donationId);

            Instant previousDeadline = donation.getFundingDeadline();
            donation.extendDeadline(donor, extensionDays, ledgerState.now(), properties.getMaxExtensionPeriod());
            donationRepository.save(donation);

            Map<String, Object> payload = donationPayload(donation);
            payload.put("previousDeadline", previousDeadline.toString());
            payload.put("extensionDaysGranted", extensionDays);
            eventService.append(EventType.FUNDING_PERIOD_EXTENDED, donationId, donor, donor, payload);
            log.info("Donation {} deadline extended by {} days to {}",
                    donationId, extensionDays, donation.getFundingDeadline());
            return toDto(donation, escrowVault.balanceOf(donationId));
        } finally {
            reentrancyGuard.exit();
        }
    }

    @Transactional(readOnly = true)
    public DonationDto getDonation(Long donationId) {
        Donation donation = findDonation(donationId);
        return toDto(donation, escrowVault.balanceOf(donationId));
    }

    @Transactional(readOnly = true)
    public long getDonationCount() {
        return ledgerState.current().getDonationCount();
    }

    @Transactional(readOnly = true)
    public List<DonationDto> getDonationsByDonor(String donor) {
        return donationRepository.findByDonorOrderByIdAsc(Identities.require(donor)).stream()
                .map(donation -> toDto(donation, escrowVault.balanceOf(donation.getId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DonationDto> getDonationsByNonprofit(String nonprofit) {
        return donationRepository.findByNonprofitOrderByIdAsc(Identities.require(nonprofit)).stream()
                .map(donation -> toDto(donation, escrowVault.balanceOf(donation.getId())))
                .toList();
    }

    private Donation findDonation(Long donationId) {
        if (donationId == null) {
            throw LedgerException.of(LedgerError.DONATION_NOT_FOUND, "Donation id is required");
        }
        return donationRepository.findById(donationId)
                .orElseThrow(() -> LedgerException.of(LedgerError.DONATION_NOT_FOUND,
                        "Donation not found: " + donationId));
    }

    private Map<String, Object> donationPayload(Donation donation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("donor", donation.getDonor());
        payload.put("nonprofit", donation.getNonprofit());
        payload.put("amount", donation.getAmount());
        payload.put("equityPercentage", donation.getEquityPercentage());
        payload.put("fundingDeadline", donation.getFundingDeadline().toString());
        payload.put("valuation", donation.getValuation());
        payload.put("nonprofitName", donation.getNonprofitName());
        payload.put("description", donation.getDescription());
        payload.put("status", donation.getStatus().name());
        return payload;
    }

    private DonationDto toDto(Donation donation, BigInteger escrowBalance) {
        return new DonationDto(
                donation.getId(),
                donation.getDonor(),
                donation.getNonprofit(),
                donation.getAmount(),
                donation.getEquityPercentage(),
                donation.getFundingDeadline(),
                donation.getExtensionDays(),
                donation.getValuation(),
                donation.getNonprofitName(),
                donation.getDescription(),
                donation.isActive(),
                donation.isDistributed(),
                donation.getStatus(),
                escrowBalance,
                donation.getCreatedAt()
        );
    }

    // DTOs
    public record DonationDto(
            Long id,
            String donor,
            String nonprofit,
            BigInteger amount,
            int equityPercentage,
            Instant fundingDeadline,
            long extensionDays,
            BigInteger valuation,
            String nonprofitName,
            String description,
            boolean active,
            boolean distributed,
            DonationStatus status,
            BigInteger escrowBalance,
            Instant createdAt
    ) {}
}
