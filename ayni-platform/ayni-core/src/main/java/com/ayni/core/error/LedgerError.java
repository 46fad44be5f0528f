package com.ayni.core.error;

/**
 * Failure kinds raised by ledger operations, grouped by category.
 */
public enum LedgerError {

    INVALID_AMOUNT(Category.VALIDATION, "LDG_001"),
    INVALID_PERCENTAGE(Category.VALIDATION, "LDG_002"),
    EMPTY_STRING(Category.VALIDATION, "LDG_003"),
    ZERO_VALUE(Category.VALIDATION, "LDG_004"),
    INVALID_RATING(Category.VALIDATION, "LDG_005"),
    INVALID_DEADLINE(Category.VALIDATION, "LDG_006"),
    INVALID_ADDRESS(Category.VALIDATION, "LDG_007"),

    UNAUTHORIZED_ACCESS(Category.AUTHORIZATION, "LDG_101"),

    DONATION_NOT_ACTIVE(Category.STATE, "LDG_201"),
    DEADLINE_PASSED(Category.STATE, "LDG_202"),
    ALREADY_RATED(Category.STATE, "LDG_203"),
    DONATION_NOT_FOUND(Category.STATE, "LDG_204"),
    PAUSED(Category.STATE, "LDG_205"),
    NOT_PAUSED(Category.STATE, "LDG_206"),
    REENTRANT_CALL(Category.STATE, "LDG_207"),

    INSUFFICIENT_FUNDS(Category.RESOURCE, "LDG_301"),
    TRANSFER_FAILED(Category.RESOURCE, "LDG_302");

    private final Category category;
    private final String code;

    LedgerError(Category category, String code) {
        this.category = category;
        this.code = code;
    }

    public Category getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public enum Category {
        VALIDATION,
        AUTHORIZATION,
        STATE,
        RESOURCE
    }
}
