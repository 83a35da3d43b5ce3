package com.example.cleaner;

import lombok.Value;

/**
 * Identity used for duplicate detection. Null components compare equal to each other.
 */
@Value
public class DuplicateKey {
    String loginId;
    String mailAddress;

    public static DuplicateKey of(UserRecord r) {
        return new DuplicateKey(r.getLoginId(), r.getMailAddress());
    }
}
