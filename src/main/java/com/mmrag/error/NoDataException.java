package com.mmrag.error;

/**
 * Raised when a query runs against a store that holds no chunks yet.
 */
public class NoDataException extends RuntimeException {
    public NoDataException() {
        super("No documents have been ingested yet; upload documents first");
    }
}
