package com.ayni.api.donation;

import com.ayni.api.config.LedgerErrorResponses;
import com.ayni.api.config.LedgerErrorResponses.ErrorResponse;
import com.ayni.core.domain.DonationTerms;
import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

@RestController
@RequestMapping("/api/v1/donations")
public class DonationController {

    private final DonationLedgerService ledgerService;

    public DonationController(DonationLedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PostMapping
    public ResponseEntity<DonationLedgerService.DonationDto> createDonation(
            @RequestBody CreateDonationRequest request) {
        var terms = new DonationTerms(
                request.amount(),
                request.equityPercentage(),
                request.nonprofitName(),
                request.description(),
                request.valuation());
        var donation = ledgerService.createDonation(request.caller(), terms);
        return ResponseEntity.status(HttpStatus.CREATED).body(donation);
    }

    @PostMapping("/{donationId}/fund")
    public ResponseEntity<DonationLedgerService.DonationDto> fundDonation(
            @PathVariable Long donationId,
            @RequestBody FundDonationRequest request) {
        return ResponseEntity.ok(ledgerService.fundDonation(donationId, request.caller(), request.value()));
    }

    @PostMapping("/{donationId}/distribute")
    public ResponseEntity<DonationLedgerService.DonationDto> distributeDonation(
            @PathVariable Long donationId,
            @RequestBody CallerRequest request) {
        return ResponseEntity.ok(ledgerService.distributeDonation(donationId, request.caller()));
    }

    @PostMapping("/{donationId}/cancel")
    public ResponseEntity<DonationLedgerService.DonationDto> cancelDonation(
            @PathVariable Long donationId,
            @RequestBody CallerRequest request) {
        return ResponseEntity.ok(ledgerService.cancelDonation(donationId, request.caller()));
    }

    @PostMapping("/{donationId}/extend")
    public ResponseEntity<DonationLedgerService.DonationDto> extendFundingPeriod(
            @PathVariable Long donationId,
            @RequestBody ExtendFundingRequest request) {
        return ResponseEntity.ok(
                ledgerService.extendFundingPeriod(donationId, request.caller(), request.extensionDays()));
    }

    @GetMapping("/{donationId}")
    public ResponseEntity<DonationLedgerService.DonationDto> getDonation(@PathVariable Long donationId) {
        return ResponseEntity.ok(ledgerService.getDonation(donationId));
    }

    @GetMapping("/count")
    public ResponseEntity<DonationCountResponse> getDonationCount() {
        return ResponseEntity.ok(new DonationCountResponse(ledgerService.getDonationCount()));
    }

    @GetMapping
    public ResponseEntity<List<DonationLedgerService.DonationDto>> findDonations(
            @RequestParam(required = false) String donor,
            @RequestParam(required = false) String nonprofit) {
        if ((donor == null) == (nonprofit == null)) {
            throw LedgerException.of(LedgerError.INVALID_ADDRESS,
                    "Exactly one of donor or nonprofit must be given");
        }
        if (donor != null) {
            return ResponseEntity.ok(ledgerService.getDonationsByDonor(donor));
        }
        return ResponseEntity.ok(ledgerService.getDonationsByNonprofit(nonprofit));
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerError(LedgerException e) {
        return LedgerErrorResponses.toResponse(e);
    }

    public record CreateDonationRequest(
            String caller,
            BigInteger amount,
            int equityPercentage,
            String nonprofitName,
            String description,
            BigInteger valuation
    ) {}
    public record FundDonationRequest(String caller, BigInteger value) {}
    public record CallerRequest(String caller) {}
    public record ExtendFundingRequest(String caller, long extensionDays) {}
    public record DonationCountResponse(long count) {}
}
