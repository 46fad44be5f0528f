package com.ayni.api.event;

import com.ayni.api.config.LedgerErrorResponses;
import com.ayni.api.config.LedgerErrorResponses.ErrorResponse;
import com.ayni.core.error.LedgerException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read access to the ledger event log for indexers.
 */
@RestController
@RequestMapping("/api/v1/events")
public class LedgerEventController {

    private final LedgerEventService eventService;

    public LedgerEventController(LedgerEventService eventService) {
        this.eventService = eventService;
    }

    @GetMapping
    public ResponseEntity<List<LedgerEventService.LedgerEventDto>> getEvents(
            @RequestParam(required = false) Long donationId,
            @RequestParam(required = false) String identity) {
        if (donationId != null) {
            return ResponseEntity.ok(eventService.eventsForDonation(donationId));
        }
        return ResponseEntity.ok(eventService.eventsForIdentity(identity));
    }

    @GetMapping("/{eventId}/verify")
    public ResponseEntity<LedgerEventService.EventVerificationResult> verifyEvent(@PathVariable Long eventId) {
        return ResponseEntity.ok(eventService.verifyEvent(eventId));
    }

    @ExceptionHandler(LedgerEventService.EventNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(LedgerEventService.EventNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("EVT_404", "EVENT_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerError(LedgerException e) {
        return LedgerErrorResponses.toResponse(e);
    }
}
