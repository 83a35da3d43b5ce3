package com.example.cleaner;

/**
 * Failure while handling a single batch. Caught at the batch boundary; the batch is dropped.
 */
public class BatchProcessingException extends RuntimeException {

    private final int batchIndex;

    public BatchProcessingException(int batchIndex, String message, Throwable cause) {
        super("Batch " + batchIndex + ": " + message, cause);
        this.batchIndex = batchIndex;
    }

    public int getBatchIndex() {
        return batchIndex;
    }
}
