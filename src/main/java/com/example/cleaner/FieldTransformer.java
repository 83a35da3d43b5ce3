package com.example.cleaner;

import com.example.cleaner.util.LenientDates;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Value-level cleanup applied before validation: strips disallowed characters from the
 * configured columns and rewrites {@code birthday_on} and {@code created_at} as ISO dates.
 * Values that do not survive the cleanup become null; original strings are not kept.
 */
@Slf4j
public class FieldTransformer {

    private final List<CanonicalField> strippedColumns;
    private final Pattern stripPattern;
    private final boolean lowercaseMailAddress;

    public FieldTransformer(CleanerConfig config) {
        this.strippedColumns = config.getStrippedColumns();
        this.stripPattern = config.compiledStripPattern();
        this.lowercaseMailAddress = config.isLowercaseMailAddress();
    }

    public List<UserRecord> transform(List<UserRecord> records) {
        List<UserRecord> out = new ArrayList<>(records.size());
        for (UserRecord r : records) {
            out.add(transform(r));
        }
        return out;
    }

    public UserRecord transform(UserRecord record) {
        UserRecord r = record;
        for (CanonicalField field : strippedColumns) {
            String cleaned;
            try {
                cleaned = strip(field, r.get(field));
            } catch (FieldTransformException e) {
                log.warn("{}; value replaced with null", e.getMessage());
                cleaned = null;
            }
            r = r.with(field, cleaned);
        }
        if (lowercaseMailAddress && r.getMailAddress() != null) {
            r = r.with(CanonicalField.MAIL_ADDRESS, r.getMailAddress().toLowerCase(Locale.ROOT));
        }
        return r.toBuilder()
                .birthdayOn(LenientDates.toIsoDate(r.getBirthdayOn()))
                .createdAt(LenientDates.toIsoDate(r.getCreatedAt()))
                .build();
    }

    String strip(CanonicalField field, String value) {
        if (value == null) return null;
        try {
            return stripPattern.matcher(value).replaceAll("");
        } catch (RuntimeException | StackOverflowError e) {
            throw new FieldTransformException(field, e);
        }
    }
}
