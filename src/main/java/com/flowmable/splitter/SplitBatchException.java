package com.flowmable.splitter;

/**
 * Run-level batch failure: missing input, nothing to process, or an unwritable report.
 * Per-file problems are reported as warnings instead.
 */
public class SplitBatchException extends Exception {

    public SplitBatchException(String message) {
        super(message);
    }

    public SplitBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
