package com.example.cleaner;

/**
 * Failure cleaning one field of one row. The field's cleaned value becomes null.
 */
public class FieldTransformException extends RuntimeException {

    public FieldTransformException(CanonicalField field, Throwable cause) {
        super("Cannot clean " + field.columnName() + ": " + cause.getMessage(), cause);
    }
}
