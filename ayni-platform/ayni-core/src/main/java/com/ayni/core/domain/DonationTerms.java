package com.ayni.core.domain;

import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;

import java.math.BigInteger;

/**
 * Terms a donor offers when creating a donation.
 */
public record DonationTerms(
        BigInteger amount,
        int equityPercentage,
        String nonprofitName,
        String description,
        BigInteger valuation
) {

    public static final int MIN_EQUITY_PERCENTAGE = 1;
    public static final int MAX_EQUITY_PERCENTAGE = 10;

    /**
     * Checks the terms against the configured amount bounds. Checks run in a fixed order
     * so the first violated rule decides the error.
     */
    public void validate(BigInteger minAmount, BigInteger maxAmount) {
        if (amount == null || amount.compareTo(minAmount) < 0 || amount.compareTo(maxAmount) > 0) {
            throw LedgerException.of(LedgerError.INVALID_AMOUNT,
                    "Amount must be between " + minAmount + " and " + maxAmount + ": " + amount);
        }
        if (equityPercentage < MIN_EQUITY_PERCENTAGE || equityPercentage > MAX_EQUITY_PERCENTAGE) {
            throw LedgerException.of(LedgerError.INVALID_PERCENTAGE,
                    "Equity percentage must be between 1 and 10: " + equityPercentage);
        }
        if (isBlank(nonprofitName) || isBlank(description)) {
            throw LedgerException.of(LedgerError.EMPTY_STRING, "Nonprofit name and description are required");
        }
        if (valuation == null || valuation.signum() <= 0) {
            throw LedgerException.of(LedgerError.ZERO_VALUE, "Valuation must be positive");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
