package com.campus.insight.exception;

/**
 * Aggregation or analytics found zero qualifying records.
 */
public class NoDataException extends InsightException {
    public NoDataException(String message) {
        super(message);
    }
}
