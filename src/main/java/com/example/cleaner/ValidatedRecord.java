package com.example.cleaner;

import lombok.Value;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A record annotated with the outcome of each row predicate.
 */
@Value
public class ValidatedRecord {
    UserRecord record;
    boolean emailValid;
    boolean rowValid;
    boolean birthdayValid;
    boolean duplicate;

    public boolean isValid() {
        return emailValid && rowValid && birthdayValid && !duplicate;
    }

    public Set<RejectionReason> rejectionReasons() {
        Set<RejectionReason> reasons = EnumSet.noneOf(RejectionReason.class);
        if (!emailValid) reasons.add(RejectionReason.EMAIL_INVALID);
        if (!rowValid) reasons.add(RejectionReason.MISSING_REQUIRED_FIELD);
        if (!birthdayValid) reasons.add(RejectionReason.BIRTHDAY_INVALID);
        if (duplicate) reasons.add(RejectionReason.DUPLICATE);
        return reasons;
    }

    /** Pipe-joined reason labels in declaration order, empty for a valid row. */
    public String rejectionLabel() {
        return rejectionReasons().stream().map(RejectionReason::label).collect(Collectors.joining("|"));
    }
}
