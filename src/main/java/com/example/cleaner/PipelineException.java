package com.example.cleaner;

/**
 * Fatal I/O failure outside a batch boundary, e.g. while reading the input or appending
 * to a final file.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
