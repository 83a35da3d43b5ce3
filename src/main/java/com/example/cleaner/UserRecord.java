package com.example.cleaner;

import lombok.Builder;
import lombok.Value;

/**
 * One row in the canonical schema. Every field is nullable.
 */
@Value
@Builder(toBuilder = true)
public class UserRecord {
    String id;
    String loginId;
    String mailAddress;
    String password;
    String createdAt;
    String salt;
    String birthdayOn;
    String gender;

    /** Builds a record from values indexed by {@link CanonicalField#ordinal()}. */
    public static UserRecord fromCanonical(String[] v) {
        return new UserRecord(v[0], v[1], v[2], v[3], v[4], v[5], v[6], v[7]);
    }

    public String get(CanonicalField field) {
        switch (field) {
            case ID: return id;
            case LOGIN_ID: return loginId;
            case MAIL_ADDRESS: return mailAddress;
            case PASSWORD: return password;
            case CREATED_AT: return createdAt;
            case SALT: return salt;
            case BIRTHDAY_ON: return birthdayOn;
            case GENDER: return gender;
            default: throw new IllegalArgumentException("Unknown field " + field);
        }
    }

    public UserRecord with(CanonicalField field, String value) {
        UserRecordBuilder b = toBuilder();
        switch (field) {
            case ID: b.id(value); break;
            case LOGIN_ID: b.loginId(value); break;
            case MAIL_ADDRESS: b.mailAddress(value); break;
            case PASSWORD: b.password(value); break;
            case CREATED_AT: b.createdAt(value); break;
            case SALT: b.salt(value); break;
            case BIRTHDAY_ON: b.birthdayOn(value); break;
            case GENDER: b.gender(value); break;
            default: throw new IllegalArgumentException("Unknown field " + field);
        }
        return b.build();
    }

    /** Values in canonical column order. */
    public String[] toArray() {
        return new String[]{id, loginId, mailAddress, password, createdAt, salt, birthdayOn, gender};
    }

    public boolean isEmpty() {
        for (String v : toArray()) {
            if (v != null) return false;
        }
        return true;
    }
}
