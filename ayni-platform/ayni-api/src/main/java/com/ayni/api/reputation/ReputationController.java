package com.ayni.api.reputation;

import com.ayni.api.config.LedgerErrorResponses;
import com.ayni.api.config.LedgerErrorResponses.ErrorResponse;
import com.ayni.core.error.LedgerException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/reputation")
public class ReputationController {

    private final ReputationService reputationService;

    public ReputationController(ReputationService reputationService) {
        this.reputationService = reputationService;
    }

    @PostMapping("/{subject}")
    public ResponseEntity<ReputationService.ReputationDto> rate(
            @PathVariable String subject,
            @RequestBody RateRequest request) {
        return ResponseEntity.ok(reputationService.updateReputation(
                request.caller(), subject, request.rating(), request.review()));
    }

    @GetMapping("/{identity}")
    public ResponseEntity<ReputationService.ReputationDto> getReputation(@PathVariable String identity) {
        return ResponseEntity.ok(reputationService.getReputation(identity));
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerError(LedgerException e) {
        return LedgerErrorResponses.toResponse(e);
    }

    public record RateRequest(String caller, int rating, String review) {}
}
