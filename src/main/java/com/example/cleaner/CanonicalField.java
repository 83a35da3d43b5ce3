package com.example.cleaner;

import java.util.Optional;

/**
 * The fixed output schema. Declaration order is the column order of every output file.
 */
public enum CanonicalField {
    ID("id"),
    LOGIN_ID("login_id"),
    MAIL_ADDRESS("mail_address"),
    PASSWORD("password"),
    CREATED_AT("created_at"),
    SALT("salt"),
    BIRTHDAY_ON("birthday_on"),
    GENDER("gender");

    private static final CanonicalField[] ALL = values();

    private final String columnName;

    CanonicalField(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }

    public static Optional<CanonicalField> byColumnName(String name) {
        for (CanonicalField f : ALL) {
            if (f.columnName.equals(name)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public static String[] columnNames() {
        String[] names = new String[ALL.length];
        for (int i = 0; i < ALL.length; i++) names[i] = ALL[i].columnName;
        return names;
    }
}
