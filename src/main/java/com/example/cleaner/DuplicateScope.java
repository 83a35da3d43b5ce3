package com.example.cleaner;

/**
 * Range over which two rows with the same {@code (login_id, mail_address)} count as duplicates.
 */
public enum DuplicateScope {
    /** Only rows inside the same batch are compared. */
    BATCH,
    /** The whole input is compared; costs an extra read pass. */
    DATASET
}
