package com.example.cleaner;

import com.example.cleaner.util.LenientDates;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Row predicates and their combination. Each predicate is independent of the others;
 * a row is valid only if every one of them holds.
 */
public class RecordValidator {

    private static final Pattern EMAIL = Pattern.compile("^[\\w.-]+@[\\w.-]+\\.\\w+$", Pattern.UNICODE_CHARACTER_CLASS);

    private final DuplicateDetector duplicates;

    public RecordValidator(DuplicateDetector duplicates) {
        this.duplicates = duplicates;
    }

    public static boolean emailValid(String address) {
        return address != null && EMAIL.matcher(address).matches();
    }

    /** False iff a field required for identity is missing. */
    public static boolean rowValid(UserRecord record) {
        return record.getLoginId() != null && record.getMailAddress() != null;
    }

    public static boolean birthdayValid(String value) {
        return LenientDates.parse(value).isPresent();
    }

    /**
     * Evaluates all predicates for a batch of transformed records.
     *
     * @param batchIndex 1-based batch position, for subclasses and diagnostics
     */
    public List<ValidatedRecord> validate(int batchIndex, List<UserRecord> records) {
        boolean[] dup = duplicates.flagDuplicates(records);
        List<ValidatedRecord> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            UserRecord r = records.get(i);
            out.add(new ValidatedRecord(r,
                    emailValid(r.getMailAddress()),
                    rowValid(r),
                    birthdayValid(r.getBirthdayOn()),
                    dup[i]));
        }
        return out;
    }
}
