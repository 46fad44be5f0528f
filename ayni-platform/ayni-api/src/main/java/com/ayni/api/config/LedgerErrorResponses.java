package com.ayni.api.config;

import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps ledger failures to HTTP responses. Controllers delegate their
 * {@code @ExceptionHandler} methods here.
 */
public final class LedgerErrorResponses {

    private LedgerErrorResponses() {}

    public static ResponseEntity<ErrorResponse> toResponse(LedgerException e) {
        LedgerError error = e.getError();
        return ResponseEntity.status(statusOf(error))
                .body(new ErrorResponse(error.getCode(), error.name(), e.getMessage()));
    }

    static HttpStatus statusOf(LedgerError error) {
        if (error == LedgerError.DONATION_NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        }
        if (error == LedgerError.TRANSFER_FAILED) {
            return HttpStatus.BAD_GATEWAY;
        }
        return switch (error.getCategory()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case STATE -> HttpStatus.CONFLICT;
            case RESOURCE -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    public record ErrorResponse(String code, String error, String message) {}
}
