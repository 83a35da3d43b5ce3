package com.example.cleaner;

/**
 * Names of the row predicates, as written to the optional {@code rejection_reasons} column.
 */
public enum RejectionReason {
    EMAIL_INVALID("email_invalid"),
    MISSING_REQUIRED_FIELD("missing_required_field"),
    BIRTHDAY_INVALID("birthday_invalid"),
    DUPLICATE("duplicate");

    private final String label;

    RejectionReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
